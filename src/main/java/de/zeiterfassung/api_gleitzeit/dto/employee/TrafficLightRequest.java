package de.zeiterfassung.api_gleitzeit.dto.employee;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrafficLightRequest {

    @NotNull(message = "Bitte geben Sie den Grenzwert für Grün ein.")
    private Double green;

    @NotNull(message = "Bitte geben Sie den Grenzwert für Rot ein.")
    private Double red;
}
