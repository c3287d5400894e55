package de.zeiterfassung.api_gleitzeit.service.interval;

import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

/**
 * Gearbeitete Zeit je Datum und die Stempel, die dabei in Paaren verbraucht wurden.
 */
public record WorkedDays(SortedMap<LocalDate, Duration> byDate, List<TimeStamp> consumed) {

    public Duration on(LocalDate date) {
        return byDate.getOrDefault(date, Duration.ZERO);
    }

    public Duration total() {
        return byDate.values().stream().reduce(Duration.ZERO, Duration::plus);
    }

    public boolean isEmpty() {
        return byDate.isEmpty();
    }
}
