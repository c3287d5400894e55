package de.zeiterfassung.api_gleitzeit.dto.employee;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationRequest {

    @NotBlank(message = "Bitte geben Sie einen Namen ein.")
    private String name;

    // ISO (2008-05-17) oder dd.MM.yyyy
    @NotBlank(message = "Bitte geben Sie ein Geburtsdatum ein.")
    private String birthDate;

    @NotNull(message = "Bitte geben Sie die vertraglichen Wochenstunden ein.")
    private Integer weeklyHours;

    // leer = Standardwerte aus gleitzeit.traffic-light.*
    private Double trafficLightGreen;
    private Double trafficLightRed;

    @ToString.Exclude
    private String password;

    @ToString.Exclude
    private String passwordRepeat;

    private String supervisorName;
}
