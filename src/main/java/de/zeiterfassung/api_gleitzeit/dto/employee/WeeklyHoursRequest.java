package de.zeiterfassung.api_gleitzeit.dto.employee;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WeeklyHoursRequest {

    @NotNull(message = "Bitte geben Sie die Wochenstunden ein.")
    private Integer weeklyHours;

    // optional, Standard ist heute
    private String effectiveFrom;
}
