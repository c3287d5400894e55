package de.zeiterfassung.api_gleitzeit.service.ledger;

import java.time.LocalDate;
import java.util.List;

public record Settlement(double deltaHours, List<LocalDate> settledDates, int settledStamps) {

    public static Settlement nothing() {
        return new Settlement(0.0, List.of(), 0);
    }
}
