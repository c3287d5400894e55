package de.zeiterfassung.api_gleitzeit.dto.employee;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "Bitte geben Sie Ihren Namen ein.")
    private String name;

    @ToString.Exclude
    @NotBlank(message = "Bitte geben Sie Ihr Passwort ein.")
    private String password;

    private boolean includeMissingDays;
}
