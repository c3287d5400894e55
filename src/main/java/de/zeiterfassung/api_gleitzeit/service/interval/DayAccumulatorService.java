package de.zeiterfassung.api_gleitzeit.service.interval;

import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class DayAccumulatorService {

    private final IntervalCalculatorService intervalCalculator;

    /**
     * Summiert die Arbeitszeit je Datum. Ein übrig gebliebener Einzelstempel
     * wird weder gezählt noch als verbraucht gemeldet.
     */
    public WorkedDays accumulate(List<TimeStamp> sortedStamps, LocalDate birthDate, DeductionMode mode) {
        SortedMap<LocalDate, Duration> byDate = new TreeMap<>();
        List<TimeStamp> consumed = new ArrayList<>();

        for (StampPairing.Step step : StampPairing.of(sortedStamps)) {
            if (!step.paired()) {
                log.debug("Einzelstempel {} {} bleibt offen", step.first().getStampDate(), step.first().getStampTime());
                continue;
            }
            Optional<Duration> worked = intervalCalculator.workedDuration(step.first(), step.second(), birthDate, mode);
            if (worked.isEmpty()) {
                continue;
            }
            byDate.merge(step.first().getStampDate(), worked.get(), Duration::plus);
            consumed.add(step.first());
            consumed.add(step.second());
        }
        return new WorkedDays(byDate, consumed);
    }
}
