package de.zeiterfassung.api_gleitzeit.service.interval;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import de.zeiterfassung.api_gleitzeit.service.common.LaborLaw;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;

@Slf4j
@Service
public class IntervalCalculatorService {

    public record Interval(LocalDateTime start, LocalDateTime end) {

        public Duration duration() {
            return end.isAfter(start) ? Duration.between(start, end) : Duration.ZERO;
        }

        public Duration overlap(Interval other) {
            LocalDateTime s = start.isAfter(other.start) ? start : other.start;
            LocalDateTime e = end.isBefore(other.end) ? end : other.end;
            return e.isAfter(s) ? Duration.between(s, e) : Duration.ZERO;
        }
    }

    /**
     * Arbeitszeit eines Stempelpaares. Leer, wenn die Stempel an verschiedenen
     * Tagen liegen. Endet das Paar vor seinem Beginn, zählt es als 0.
     */
    public Optional<Duration> workedDuration(TimeStamp first, TimeStamp second, LocalDate birthDate,
                                             DeductionMode mode) {
        if (!first.getStampDate().equals(second.getStampDate())) {
            return Optional.empty();
        }
        if (second.getStampTime().isBefore(first.getStampTime())) {
            log.warn("Stempelpaar am {} endet vor dem Beginn ({} -> {}), wird mit 0 gewertet",
                    first.getStampDate(), first.getStampTime(), second.getStampTime());
            return Optional.of(Duration.ZERO);
        }

        boolean minor = Employee.isMinorOn(birthDate, first.getStampDate());
        Interval interval = new Interval(first.toDateTime(), second.toDateTime());
        Duration worked = interval.duration();

        if (mode.deductsBreaks()) {
            worked = worked.minus(breakDeduction(worked, minor));
        }
        if (mode.clipsWorkWindow()) {
            worked = worked.minus(outsideWorkWindow(interval, minor));
        }
        return Optional.of(worked.isNegative() ? Duration.ZERO : worked);
    }

    /** Gesetzliche Pause für ein einzelnes Intervall. */
    public Duration breakDeduction(Duration worked, boolean minor) {
        if (minor) {
            if (worked.compareTo(LaborLaw.MINOR_LONG_SHIFT) >= 0) return LaborLaw.MINOR_LONG_BREAK;
            if (worked.compareTo(LaborLaw.MINOR_SHORT_SHIFT) >= 0) return LaborLaw.MINOR_SHORT_BREAK;
            return Duration.ZERO;
        }
        if (worked.compareTo(LaborLaw.ADULT_LONG_SHIFT) >= 0) return LaborLaw.ADULT_LONG_BREAK;
        if (worked.compareTo(LaborLaw.ADULT_SHORT_SHIFT) >= 0) return LaborLaw.ADULT_SHORT_BREAK;
        return Duration.ZERO;
    }

    /** Anteil des Intervalls vor 06:00 und nach dem Ende des Arbeitsfensters. */
    public Duration outsideWorkWindow(Interval interval, boolean minor) {
        LocalDate date = interval.start().toLocalDate();
        Interval early = new Interval(date.atStartOfDay(), date.atTime(LaborLaw.WORK_WINDOW_START));
        Interval late = new Interval(date.atTime(LaborLaw.workWindowEnd(minor)), date.plusDays(1).atStartOfDay());
        return interval.overlap(early).plus(interval.overlap(late));
    }

    public boolean isInsideWorkWindow(LocalTime time, boolean minor) {
        return !time.isBefore(LaborLaw.WORK_WINDOW_START) && !time.isAfter(LaborLaw.workWindowEnd(minor));
    }
}
