package de.zeiterfassung.api_gleitzeit.dto.flexTime;

import java.time.LocalDate;
import java.util.List;

/**
 * Gleitzeit-Auswertung eines Zeitraums (nur Montag bis Freitag).
 */
public record FlexTimeAverage(double averageHours,
                              double totalHours,
                              int dayCount,
                              List<LocalDate> consideredDates) {

    public static FlexTimeAverage empty() {
        return new FlexTimeAverage(0.0, 0.0, 0, List.of());
    }
}
