package de.zeiterfassung.api_gleitzeit.dto.timeStamp;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StampEditRequest {

    @NotBlank(message = "Bitte geben Sie eine Uhrzeit ein.")
    private String time;
}
