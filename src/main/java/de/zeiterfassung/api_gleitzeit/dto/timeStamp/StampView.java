package de.zeiterfassung.api_gleitzeit.dto.timeStamp;

import com.fasterxml.jackson.annotation.JsonFormat;
import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;

import java.time.LocalDate;
import java.time.LocalTime;

public record StampView(Long id,
                        @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
                        @JsonFormat(pattern = "HH:mm:ss") LocalTime time,
                        boolean settled) {

    public static StampView of(TimeStamp stamp) {
        return new StampView(stamp.getId(), stamp.getStampDate(), stamp.getStampTime(), stamp.isSettled());
    }
}
