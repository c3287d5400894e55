package de.zeiterfassung.api_gleitzeit.service.holiday;

import de.zeiterfassung.api_gleitzeit.dto.holiday.HolidayView;
import de.zeiterfassung.api_gleitzeit.entity.boundaries.holiday.Holiday;
import de.zeiterfassung.api_gleitzeit.exception.ResourceNotFoundException;
import de.zeiterfassung.api_gleitzeit.repository.boundaries.holiday.HolidayRepository;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pflege der betrieblichen Feiertage. Gesetzliche Feiertage werden berechnet
 * und lassen sich nicht zusätzlich eintragen.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HolidayService {

    private final HolidayRepository holidayRepository;
    private final GermanHolidayCalendar holidayCalendar;
    private final TimeService timeService;

    @Transactional(readOnly = true)
    public List<Holiday> companyHolidays() {
        return holidayRepository.findAllByOrderByHolidayDateAsc();
    }

    /** Gesetzliche und betriebliche Feiertage eines Kalenderjahres, nach Datum sortiert. */
    @Transactional(readOnly = true)
    public List<HolidayView> holidaysOf(int year) {
        List<HolidayView> views = new ArrayList<>();
        holidayCalendar.statutoryHolidaysOf(year).forEach(date -> views.add(HolidayView.statutory(date)));
        holidayRepository.findByHolidayDateBetweenOrderByHolidayDateAsc(
                        LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31))
                .forEach(holiday -> views.add(HolidayView.of(holiday)));
        views.sort(Comparator.comparing(HolidayView::date));
        return views;
    }

    @Transactional(readOnly = true)
    public Holiday getHoliday(Long id) {
        return holidayRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Feiertag mit ID " + id + " nicht gefunden."));
    }

    @Transactional
    public Holiday addHoliday(String date, String description) {
        LocalDate holidayDate = checkedDate(date, null);
        Holiday saved = holidayRepository.save(Holiday.builder()
                .holidayDate(holidayDate)
                .description(description)
                .build());
        log.info("Betrieblicher Feiertag {} ({}) angelegt", holidayDate, description);
        return saved;
    }

    @Transactional
    public Holiday changeHoliday(Long id, String date, String description) {
        Holiday holiday = getHoliday(id);
        holiday.setHolidayDate(checkedDate(date, id));
        holiday.setDescription(description);
        log.info("Betrieblicher Feiertag {} auf {} geändert", id, holiday.getHolidayDate());
        return holidayRepository.save(holiday);
    }

    @Transactional
    public void removeHoliday(Long id) {
        Holiday holiday = getHoliday(id);
        holidayRepository.delete(holiday);
        log.info("Betrieblicher Feiertag {} ({}) gelöscht", id, holiday.getHolidayDate());
    }

    private LocalDate checkedDate(String raw, Long ownId) {
        LocalDate date = timeService.parseDate(raw);
        if (holidayCalendar.isStatutoryHoliday(date)) {
            throw new IllegalArgumentException("Der " + timeService.formatDate(date)
                    + " ist bereits ein gesetzlicher Feiertag.");
        }
        boolean taken = ownId == null
                ? holidayRepository.existsByHolidayDate(date)
                : holidayRepository.existsByHolidayDateAndIdNot(date, ownId);
        if (taken) {
            throw new IllegalArgumentException("Für den " + timeService.formatDate(date)
                    + " ist bereits ein Feiertag eingetragen.");
        }
        return date;
    }
}
