package de.zeiterfassung.api_gleitzeit.service.quota;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.employee.WeeklyHoursHistory;
import de.zeiterfassung.api_gleitzeit.repository.employee.WeeklyHoursHistoryRepository;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Ermittelt die am Datum gültigen Wochenstunden und daraus die tägliche Sollzeit.
 */
@Slf4j
@Service
public class QuotaResolverService {

    private static final int WORKDAYS_PER_WEEK = 5;

    private final WeeklyHoursHistoryRepository historyRepository;
    private final TimeService timeService;
    private final double fallbackDailyHours;

    public QuotaResolverService(WeeklyHoursHistoryRepository historyRepository,
                                TimeService timeService,
                                @Value("${gleitzeit.quota.fallback-daily-hours:8}") double fallbackDailyHours) {
        this.historyRepository = historyRepository;
        this.timeService = timeService;
        this.fallbackDailyHours = fallbackDailyHours;
    }

    /** Letzter Historieneintrag mit gültig-ab <= Datum, sonst die aktuellen Vertragsstunden. */
    @Transactional(readOnly = true)
    public Integer weeklyHoursOn(Employee employee, LocalDate date) {
        return historyRepository
                .findFirstByEmployeeIdAndEffectiveFromLessThanEqualOrderByEffectiveFromDesc(employee.getId(), date)
                .map(WeeklyHoursHistory::getWeeklyHours)
                .orElse(employee.getWeeklyHours());
    }

    @Transactional(readOnly = true)
    public Duration dailyTarget(Employee employee, LocalDate date) {
        Integer weeklyHours = weeklyHoursOn(employee, date);
        if (weeklyHours == null || weeklyHours <= 0) {
            if (!hasValidContract(employee)) {
                log.warn("Ungültige Wochenstunden ({}) für Mitarbeiter {}, verwende {}h Sollzeit",
                        employee.getWeeklyHours(), employee.getId(), fallbackDailyHours);
                return timeService.fromHours(fallbackDailyHours);
            }
            return Duration.ZERO;
        }
        return timeService.fromHours(weeklyHours / (double) WORKDAYS_PER_WEEK);
    }

    private boolean hasValidContract(Employee employee) {
        return employee.getWeeklyHours() != null && employee.getWeeklyHours() > 0;
    }
}
