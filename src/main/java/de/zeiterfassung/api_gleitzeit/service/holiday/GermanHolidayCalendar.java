package de.zeiterfassung.api_gleitzeit.service.holiday;

import de.zeiterfassung.api_gleitzeit.repository.boundaries.holiday.HolidayRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.Month;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bundesweite gesetzliche Feiertage in Deutschland, ergänzt um die
 * betrieblichen Feiertage aus der Tabelle {@code holidays}.
 */
@Service
@RequiredArgsConstructor
public class GermanHolidayCalendar implements HolidayCalendar {

    private final HolidayRepository holidayRepository;

    private final Map<Integer, Set<LocalDate>> statutoryByYear = new ConcurrentHashMap<>();

    @Override
    @Transactional(readOnly = true)
    public boolean isHoliday(LocalDate date) {
        return isStatutoryHoliday(date) || holidayRepository.existsByHolidayDate(date);
    }

    public boolean isStatutoryHoliday(LocalDate date) {
        return statutoryByYear.computeIfAbsent(date.getYear(), GermanHolidayCalendar::statutoryHolidays).contains(date);
    }

    /** Gesetzliche Feiertage eines Jahres in aufsteigender Reihenfolge. */
    public List<LocalDate> statutoryHolidaysOf(int year) {
        return statutoryByYear.computeIfAbsent(year, GermanHolidayCalendar::statutoryHolidays).stream()
                .sorted()
                .toList();
    }

    static Set<LocalDate> statutoryHolidays(int year) {
        LocalDate easter = easterSunday(year);
        Set<LocalDate> days = new HashSet<>();
        days.add(LocalDate.of(year, Month.JANUARY, 1));     // Neujahr
        days.add(easter.minusDays(2));                      // Karfreitag
        days.add(easter.plusDays(1));                       // Ostermontag
        days.add(LocalDate.of(year, Month.MAY, 1));         // Tag der Arbeit
        days.add(easter.plusDays(39));                      // Christi Himmelfahrt
        days.add(easter.plusDays(50));                      // Pfingstmontag
        days.add(LocalDate.of(year, Month.OCTOBER, 3));     // Tag der Deutschen Einheit
        days.add(LocalDate.of(year, Month.DECEMBER, 25));   // 1. Weihnachtstag
        days.add(LocalDate.of(year, Month.DECEMBER, 26));   // 2. Weihnachtstag
        if (year == 2017) {
            days.add(LocalDate.of(year, Month.OCTOBER, 31)); // 500 Jahre Reformation
        }
        return Set.copyOf(days);
    }

    /** Ostersonntag nach der gregorianischen Osterformel (Meeus/Jones/Butcher). */
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
