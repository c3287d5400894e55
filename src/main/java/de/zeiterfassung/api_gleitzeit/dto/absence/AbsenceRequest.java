package de.zeiterfassung.api_gleitzeit.dto.absence;

import de.zeiterfassung.api_gleitzeit.entity.absence.AbsenceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AbsenceRequest {

    @NotBlank(message = "Bitte geben Sie ein Datum ein.")
    private String date;

    @NotNull(message = "Bitte wählen Sie die Art der Abwesenheit.")
    private AbsenceType type;
}
