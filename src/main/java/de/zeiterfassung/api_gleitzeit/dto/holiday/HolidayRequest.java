package de.zeiterfassung.api_gleitzeit.dto.holiday;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HolidayRequest {

    @NotBlank(message = "Bitte geben Sie ein Datum ein.")
    private String date;

    @Size(max = 150, message = "Die Bezeichnung darf höchstens 150 Zeichen lang sein.")
    private String description;
}
