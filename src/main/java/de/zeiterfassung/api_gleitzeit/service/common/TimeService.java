package de.zeiterfassung.api_gleitzeit.service.common;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

@Service
public class TimeService {

    // Uhrzeit 24h: "HH:mm"
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private static final DateTimeFormatter GERMAN_DATE =
            DateTimeFormatter.ofPattern("dd.MM.uuuu").withResolverStyle(ResolverStyle.STRICT);

    private static final double SECONDS_PER_HOUR = 3600.0;

    /** Prüft "HH:mm" strikt. */
    public LocalTime parse(String hhmm) {
        if (hhmm == null || hhmm.isBlank()) throw new IllegalArgumentException("Uhrzeit fehlt.");
        try {
            return LocalTime.parse(hhmm.trim(), HH_MM);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Ungültige Uhrzeit (HH:mm): " + hhmm);
        }
    }

    /** Formatiert als "HH:mm". */
    public String format(LocalTime t) {
        return (t == null) ? null : t.format(HH_MM);
    }

    /** Akzeptiert ISO (2024-05-17) und deutsches Format (17.05.2024). */
    public LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("Datum fehlt.");
        String s = raw.trim();
        try {
            return s.contains(".") ? LocalDate.parse(s, GERMAN_DATE) : LocalDate.parse(s);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Ungültiges Datum: " + raw);
        }
    }

    public String formatDate(LocalDate date) {
        return (date == null) ? "" : date.format(GERMAN_DATE);
    }

    public double toHours(Duration duration) {
        return duration.getSeconds() / SECONDS_PER_HOUR;
    }

    public Duration fromHours(double hours) {
        return Duration.ofSeconds(Math.round(hours * SECONDS_PER_HOUR));
    }

    public double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
