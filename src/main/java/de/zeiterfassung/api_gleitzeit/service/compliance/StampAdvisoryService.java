package de.zeiterfassung.api_gleitzeit.service.compliance;

import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampAdvisory;
import de.zeiterfassung.api_gleitzeit.entity.absence.Absence;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.repository.absence.AbsenceRepository;
import de.zeiterfassung.api_gleitzeit.repository.timeStamp.TimeStampRepository;
import de.zeiterfassung.api_gleitzeit.service.common.LaborLaw;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import de.zeiterfassung.api_gleitzeit.service.holiday.HolidayCalendar;
import de.zeiterfassung.api_gleitzeit.service.interval.IntervalCalculatorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class StampAdvisoryService {

    private final TimeStampRepository timeStampRepository;
    private final AbsenceRepository absenceRepository;
    private final IntervalCalculatorService intervalCalculator;
    private final WorkloadService workloadService;
    private final HolidayCalendar holidayCalendar;
    private final TimeService timeService;

    /**
     * Hinweise für einen geplanten Stempel. Eine leere Liste bedeutet, dass
     * ohne Rückfrage gestempelt werden kann.
     */
    @Transactional(readOnly = true)
    public List<StampAdvisory> advise(Employee employee, LocalDate date, LocalTime time) {
        List<StampAdvisory> advisories = new ArrayList<>();
        boolean minor = employee.isMinorOn(date);

        if (!intervalCalculator.isInsideWorkWindow(time, minor)) {
            advisories.add(new StampAdvisory(StampAdvisory.Kind.WORK_WINDOW, String.format(
                    "Der Stempel um %s liegt außerhalb der erlaubten Arbeitszeit von %s bis %s Uhr.",
                    timeService.format(time),
                    timeService.format(LaborLaw.WORK_WINDOW_START),
                    timeService.format(LaborLaw.workWindowEnd(minor)))));
        }

        restPeriodAdvisory(employee, date, time, minor).ifPresent(advisories::add);

        if (minor && workdaysBefore(employee, date) >= LaborLaw.MINOR_MAX_WORKDAYS_PER_WEEK) {
            advisories.add(new StampAdvisory(StampAdvisory.Kind.SIXTH_WORKDAY,
                    "In dieser Woche wurde bereits an 5 Tagen gearbeitet. Minderjährige dürfen höchstens 5 Tage pro Woche arbeiten."));
        }

        if (date.getDayOfWeek() == DayOfWeek.SUNDAY || holidayCalendar.isHoliday(date)) {
            advisories.add(new StampAdvisory(StampAdvisory.Kind.SUNDAY_OR_HOLIDAY, String.format(
                    "Der %s ist ein Sonn- oder Feiertag.", timeService.formatDate(date))));
        }

        Optional<Absence> absence = absenceRepository.findByEmployeeIdAndAbsenceDate(employee.getId(), date);
        absence.ifPresent(a -> advisories.add(new StampAdvisory(StampAdvisory.Kind.ABSENCE_TODAY, String.format(
                "Für den %s ist eine Abwesenheit (%s) eingetragen.", timeService.formatDate(date), a.getType()))));

        if (!advisories.isEmpty()) {
            log.debug("Hinweise für Mitarbeiter {} am {} {}: {}", employee.getId(), date, time, advisories);
        }
        return advisories;
    }

    // Nur für den ersten Stempel des Tages; maßgeblich ist das Alter am Tag des neuen Stempels
    private Optional<StampAdvisory> restPeriodAdvisory(Employee employee, LocalDate date, LocalTime time, boolean minor) {
        if (timeStampRepository.existsByEmployeeIdAndStampDate(employee.getId(), date)) {
            return Optional.empty();
        }
        Duration required = LaborLaw.restPeriod(minor);
        return workloadService.restBefore(employee, date.atTime(time))
                .filter(rest -> rest.compareTo(required) < 0)
                .map(rest -> new StampAdvisory(StampAdvisory.Kind.REST_PERIOD, String.format(
                        "Die gesetzliche Ruhezeit von %d Stunden wird nicht eingehalten (nur %.2f Stunden).",
                        required.toHours(), timeService.toHours(rest))));
    }

    private long workdaysBefore(Employee employee, LocalDate date) {
        LocalDate monday = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return timeStampRepository.findDistinctStampDatesBetween(employee.getId(), monday, monday.plusDays(6)).stream()
                .filter(day -> !day.equals(date))
                .count();
    }
}
