package de.zeiterfassung.api_gleitzeit.dto.holiday;

import com.fasterxml.jackson.annotation.JsonFormat;
import de.zeiterfassung.api_gleitzeit.entity.boundaries.holiday.Holiday;

import java.time.LocalDate;

/**
 * Feiertag in der API. {@code statutory} ist für bundesweite gesetzliche Feiertage gesetzt,
 * die keine Datenbank-ID haben.
 */
public record HolidayView(Long id,
                          @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
                          String description,
                          boolean statutory) {

    public static HolidayView of(Holiday holiday) {
        return new HolidayView(holiday.getId(), holiday.getHolidayDate(), holiday.getDescription(), false);
    }

    public static HolidayView statutory(LocalDate date) {
        return new HolidayView(null, date, "Gesetzlicher Feiertag", true);
    }
}
