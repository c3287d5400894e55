package de.zeiterfassung.api_gleitzeit.service.ledger;

import de.zeiterfassung.api_gleitzeit.dto.flexTime.CumulativeFlexTime;
import de.zeiterfassung.api_gleitzeit.dto.flexTime.FlexTimeAverage;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import de.zeiterfassung.api_gleitzeit.repository.timeStamp.TimeStampRepository;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import de.zeiterfassung.api_gleitzeit.service.interval.DayAccumulatorService;
import de.zeiterfassung.api_gleitzeit.service.interval.DeductionMode;
import de.zeiterfassung.api_gleitzeit.service.interval.WorkedDays;
import de.zeiterfassung.api_gleitzeit.service.quota.QuotaResolverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Auswertungen über Zeiträume. Ändert das Gleitzeitkonto nicht.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlexTimeRollupService {

    private final TimeStampRepository timeStampRepository;
    private final DayAccumulatorService dayAccumulator;
    private final QuotaResolverService quotaResolver;
    private final TimeService timeService;

    @Transactional(readOnly = true)
    public FlexTimeAverage averageFlexTime(Employee employee, LocalDate start, LocalDate end, boolean includeMissingDays) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Start- und Enddatum sind erforderlich.");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Das Startdatum darf nicht nach dem Enddatum liegen.");
        }

        List<TimeStamp> stamps = timeStampRepository
                .findByEmployeeIdAndStampDateBetweenOrderByStampDateAscStampTimeAsc(employee.getId(), start, end);
        WorkedDays worked = dayAccumulator.accumulate(stamps, employee.getBirthDate(), DeductionMode.BREAKS);

        Duration total = Duration.ZERO;
        List<LocalDate> considered = new ArrayList<>();
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            if (isWeekend(date)) {
                continue;
            }
            Duration target = quotaResolver.dailyTarget(employee, date);
            if (worked.byDate().containsKey(date)) {
                total = total.plus(worked.on(date).minus(target));
            } else if (includeMissingDays) {
                total = total.minus(target);
            } else {
                continue;
            }
            considered.add(date);
        }

        if (considered.isEmpty()) {
            return FlexTimeAverage.empty();
        }
        double totalHours = timeService.toHours(total);
        double average = timeService.round2(totalHours / considered.size());
        log.debug("Gleitzeit {} bis {} für Mitarbeiter {}: {} Tage, gesamt {}h, Schnitt {}h",
                start, end, employee.getId(), considered.size(), totalHours, average);
        return new FlexTimeAverage(average, totalHours, considered.size(), considered);
    }

    /** Gleitzeit seit Monats-, Quartals- und Jahresbeginn bis einschließlich {@code today}. */
    @Transactional(readOnly = true)
    public CumulativeFlexTime cumulative(Employee employee, LocalDate today, boolean includeMissingDays) {
        LocalDate monthStart = today.with(TemporalAdjusters.firstDayOfMonth());
        LocalDate quarterStart = LocalDate.of(today.getYear(), ((today.getMonthValue() - 1) / 3) * 3 + 1, 1);
        LocalDate yearStart = today.with(TemporalAdjusters.firstDayOfYear());

        return new CumulativeFlexTime(
                timeService.round2(averageFlexTime(employee, monthStart, today, includeMissingDays).totalHours()),
                timeService.round2(averageFlexTime(employee, quarterStart, today, includeMissingDays).totalHours()),
                timeService.round2(averageFlexTime(employee, yearStart, today, includeMissingDays).totalHours()));
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
