package de.zeiterfassung.api_gleitzeit.dto.notification;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.time.LocalTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationView(Long id,
                               int code,
                               String type,
                               @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
                               String message,
                               boolean popup,
                               @JsonFormat(pattern = "HH:mm") LocalTime popupTime) {
}
