package de.zeiterfassung.api_gleitzeit.dto.timeStamp;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Nachgetragener Stempel. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StampRequest {

    @NotBlank(message = "Bitte geben Sie ein Datum ein.")
    private String date;

    @NotBlank(message = "Bitte geben Sie eine Uhrzeit ein.")
    private String time;
}
