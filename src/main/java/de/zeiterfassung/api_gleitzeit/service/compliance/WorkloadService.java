package de.zeiterfassung.api_gleitzeit.service.compliance;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import de.zeiterfassung.api_gleitzeit.repository.timeStamp.TimeStampRepository;
import de.zeiterfassung.api_gleitzeit.service.interval.DayAccumulatorService;
import de.zeiterfassung.api_gleitzeit.service.interval.DeductionMode;
import de.zeiterfassung.api_gleitzeit.service.interval.WorkedDays;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Kennzahlen für die Arbeitszeitschutz-Regeln. Alle Arbeitszeiten sind um
 * die gesetzlichen Pausen gekürzt, das Arbeitsfenster wird nicht beschnitten.
 */
@Service
@RequiredArgsConstructor
public class WorkloadService {

    private final TimeStampRepository timeStampRepository;
    private final DayAccumulatorService dayAccumulator;

    @Transactional(readOnly = true)
    public WorkedDays workedBetween(Employee employee, LocalDate from, LocalDate to) {
        List<TimeStamp> stamps = timeStampRepository
                .findByEmployeeIdAndStampDateBetweenOrderByStampDateAscStampTimeAsc(employee.getId(), from, to);
        return dayAccumulator.accumulate(stamps, employee.getBirthDate(), DeductionMode.BREAKS);
    }

    @Transactional(readOnly = true)
    public Duration workedOn(Employee employee, LocalDate date) {
        return workedBetween(employee, date, date).on(date);
    }

    /** Summe der Woche ab {@code monday} (Montag bis Sonntag). */
    @Transactional(readOnly = true)
    public Duration weekTotal(Employee employee, LocalDate monday) {
        return workedBetween(employee, monday, monday.plusDays(6)).total();
    }

    @Transactional(readOnly = true)
    public int workdaysInWeek(Employee employee, LocalDate monday) {
        return timeStampRepository.findDistinctStampDatesBetween(employee.getId(), monday, monday.plusDays(6)).size();
    }

    /** Durchschnitt je Arbeitstag, leer wenn im Zeitraum nichts gearbeitet wurde. */
    @Transactional(readOnly = true)
    public Optional<Duration> averagePerWorkday(Employee employee, LocalDate from, LocalDate to) {
        WorkedDays worked = workedBetween(employee, from, to);
        if (worked.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(worked.total().dividedBy(worked.byDate().size()));
    }

    /**
     * Ruhezeit zwischen dem letzten Stempel von {@code earlier} und dem ersten
     * Stempel von {@code later}; leer, wenn einer der Tage keine Stempel hat.
     */
    @Transactional(readOnly = true)
    public Optional<Duration> restBetween(Employee employee, LocalDate earlier, LocalDate later) {
        List<TimeStamp> before = timeStampRepository.findByEmployeeIdAndStampDateOrderByStampTimeAsc(employee.getId(), earlier);
        List<TimeStamp> after = timeStampRepository.findByEmployeeIdAndStampDateOrderByStampTimeAsc(employee.getId(), later);
        if (before.isEmpty() || after.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(before.get(before.size() - 1).toDateTime(), after.get(0).toDateTime()));
    }

    /** Ruhezeit vor einem geplanten Stempel; leer, wenn es keinen früheren Tag mit Stempeln gibt. */
    @Transactional(readOnly = true)
    public Optional<Duration> restBefore(Employee employee, LocalDateTime plannedStamp) {
        return timeStampRepository
                .findFirstByEmployeeIdAndStampDateBeforeOrderByStampDateDescStampTimeDesc(
                        employee.getId(), plannedStamp.toLocalDate())
                .map(last -> Duration.between(last.toDateTime(), plannedStamp));
    }
}
