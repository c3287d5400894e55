package de.zeiterfassung.api_gleitzeit.service.compliance;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import de.zeiterfassung.api_gleitzeit.repository.absence.AbsenceRepository;
import de.zeiterfassung.api_gleitzeit.repository.timeStamp.TimeStampRepository;
import de.zeiterfassung.api_gleitzeit.service.common.LaborLaw;
import de.zeiterfassung.api_gleitzeit.service.holiday.HolidayCalendar;
import de.zeiterfassung.api_gleitzeit.service.ledger.FlexTimeLedgerService;
import de.zeiterfassung.api_gleitzeit.service.notification.NotificationStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prüft den Zeitraum seit dem letzten Login bis gestern und legt für jeden
 * Verstoß eine Benachrichtigung an.
 *
 * <ul>
 *   <li>1 - Werktag ohne Stempel und ohne Abwesenheit</li>
 *   <li>2 - ungerade Anzahl Stempel</li>
 *   <li>3 - Ruhezeit (ArbZG § 5, JArbSchG § 13)</li>
 *   <li>4 - Durchschnitt über 24 Wochen (ArbZG § 3)</li>
 *   <li>5 - Tageshöchstarbeitszeit</li>
 *   <li>6 - Sonn- und Feiertage (ArbZG § 9)</li>
 *   <li>7, 8 - Wochenstunden und Arbeitstage Minderjähriger (JArbSchG §§ 8, 15)</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceMonitorService {

    private final TimeStampRepository timeStampRepository;
    private final AbsenceRepository absenceRepository;
    private final FlexTimeLedgerService ledgerService;
    private final NotificationStoreService notificationStore;
    private final WorkloadService workloadService;
    private final HolidayCalendar holidayCalendar;
    private final Clock clock;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate yesterday() {
        return today().minusDays(1);
    }

    /** Code 1: zieht für jeden Werktag ohne Stempel die Sollzeit ab. */
    @Transactional
    public List<LocalDate> checkMissingWorkdays(Employee employee) {
        List<LocalDate> penalized = new ArrayList<>();
        LocalDate from = employee.getLastLogin();
        if (from == null) {
            return penalized;
        }
        LocalDate until = yesterday();
        for (LocalDate date = from; !date.isAfter(until); date = date.plusDays(1)) {
            if (isWeekend(date)
                    || timeStampRepository.existsByEmployeeIdAndStampDate(employee.getId(), date)
                    || absenceRepository.existsByEmployeeIdAndAbsenceDate(employee.getId(), date)) {
                continue;
            }
            if (ledgerService.applyMissingDayPenalty(employee, date)) {
                penalized.add(date);
            }
        }
        log.info("Fehltage für Mitarbeiter {} von {} bis {}: {}", employee.getId(), from, until, penalized);
        return penalized;
    }

    /** Code 2: jeder Tag bis gestern mit ungerader Stempelanzahl, auch Wochenenden und nachgetragene Tage. */
    @Transactional
    public List<LocalDate> checkOddStampCounts(Employee employee) {
        List<LocalDate> oddDays = new ArrayList<>();
        for (LocalDate date : timeStampRepository.findDistinctStampDatesUntil(employee.getId(), yesterday())) {
            long count = timeStampRepository.countByEmployeeIdAndStampDate(employee.getId(), date);
            if (count % 2 != 0) {
                log.debug("{}: ungerade Stempelanzahl ({})", date, count);
                notificationStore.record(employee, NotificationCode.ODD_STAMP_COUNT, date);
                oddDays.add(date);
            }
        }
        return oddDays;
    }

    /** Codes 3 bis 8. */
    @Transactional
    public void checkLaborLaw(Employee employee) {
        if (employee.getLastLogin() == null) {
            return;
        }
        checkRestPeriods(employee);
        checkSixMonthAverage(employee);
        checkDailyMaximum(employee);
        checkSundaysAndHolidays(employee);
        checkMinorWeeklyHours(employee);
        checkMinorWorkdays(employee);
    }

    /** Code 3: Ruhezeit zwischen zwei gestempelten Tagen mit höchstens einem Tag Abstand. */
    @Transactional
    public void checkRestPeriods(Employee employee) {
        List<LocalDate> dates = stampedDatesInWindow(employee);
        for (int i = 0; i + 1 < dates.size(); i++) {
            LocalDate day = dates.get(i);
            LocalDate next = dates.get(i + 1);
            if (day.plusDays(1).isBefore(next)) {
                continue;
            }
            Duration required = LaborLaw.restPeriod(employee.isMinorOn(day));
            Optional<Duration> rest = workloadService.restBetween(employee, day, next);
            if (rest.isPresent() && rest.get().compareTo(required) < 0) {
                log.debug("Ruhezeit {} -> {}: {} statt {}", day, next, rest.get(), required);
                notificationStore.record(employee, NotificationCode.REST_PERIOD, next);
            }
        }
    }

    /** Code 4: Durchschnitt der gearbeiteten Tage der letzten 24 Wochen, datiert auf heute. */
    @Transactional
    public void checkSixMonthAverage(Employee employee) {
        LocalDate until = yesterday();
        LocalDate from = until.minusWeeks(LaborLaw.AVERAGE_WINDOW_WEEKS);
        workloadService.averagePerWorkday(employee, from, until)
                .filter(average -> average.compareTo(LaborLaw.AVERAGE_DAILY_LIMIT) > 0)
                .ifPresent(average -> {
                    log.debug("Durchschnitt {} bis {}: {}", from, until, average);
                    notificationStore.record(employee, NotificationCode.SIX_MONTH_AVERAGE, today());
                });
    }

    /** Code 5. */
    @Transactional
    public void checkDailyMaximum(Employee employee) {
        LocalDate from = employee.getLastLogin();
        LocalDate until = yesterday();
        if (from == null || from.isAfter(until)) {
            return;
        }
        workloadService.workedBetween(employee, from, until).byDate().forEach((date, worked) -> {
            Duration maximum = LaborLaw.dailyMaximum(employee.isMinorOn(date));
            if (worked.compareTo(maximum) > 0) {
                log.debug("{}: {} gearbeitet, erlaubt {}", date, worked, maximum);
                notificationStore.record(employee, NotificationCode.DAILY_MAXIMUM, date);
            }
        });
    }

    /** Code 6. */
    @Transactional
    public void checkSundaysAndHolidays(Employee employee) {
        for (LocalDate date : stampedDatesInWindow(employee)) {
            if (date.getDayOfWeek() == DayOfWeek.SUNDAY || holidayCalendar.isHoliday(date)) {
                notificationStore.record(employee, NotificationCode.SUNDAY_OR_HOLIDAY, date);
            }
        }
    }

    /** Code 7: nur abgeschlossene Wochen, datiert auf den Montag. */
    @Transactional
    public void checkMinorWeeklyHours(Employee employee) {
        if (!employee.isMinorOn(employee.getLastLogin())) {
            return;
        }
        for (LocalDate monday : completedWeeksInWindow(employee)) {
            if (!employee.isMinorOn(monday)) {
                continue;
            }
            Duration total = workloadService.weekTotal(employee, monday);
            if (total.compareTo(LaborLaw.MINOR_WEEKLY_MAXIMUM) > 0) {
                log.debug("Woche ab {}: {} gearbeitet", monday, total);
                notificationStore.record(employee, NotificationCode.MINOR_WEEKLY_HOURS, monday);
            }
        }
    }

    /** Code 8. */
    @Transactional
    public void checkMinorWorkdays(Employee employee) {
        if (!employee.isMinorOn(employee.getLastLogin())) {
            return;
        }
        for (LocalDate monday : completedWeeksInWindow(employee)) {
            if (!employee.isMinorOn(monday)) {
                continue;
            }
            int workdays = workloadService.workdaysInWeek(employee, monday);
            if (workdays > LaborLaw.MINOR_MAX_WORKDAYS_PER_WEEK) {
                log.debug("Woche ab {}: an {} Tagen gearbeitet", monday, workdays);
                notificationStore.record(employee, NotificationCode.MINOR_WORKDAYS, monday);
            }
        }
    }

    private List<LocalDate> stampedDatesInWindow(Employee employee) {
        LocalDate from = employee.getLastLogin();
        LocalDate until = yesterday();
        if (from == null || from.isAfter(until)) {
            return List.of();
        }
        return timeStampRepository.findDistinctStampDatesBetween(employee.getId(), from, until);
    }

    // Montage aller Wochen ab der Woche des letzten Logins, deren Sonntag spätestens gestern ist
    private List<LocalDate> completedWeeksInWindow(Employee employee) {
        List<LocalDate> mondays = new ArrayList<>();
        LocalDate until = yesterday();
        LocalDate monday = employee.getLastLogin().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        while (!monday.plusDays(6).isAfter(until)) {
            mondays.add(monday);
            monday = monday.plusWeeks(1);
        }
        return mondays;
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
