package de.zeiterfassung.api_gleitzeit.dto.employee;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PasswordChangeRequest {

    @ToString.Exclude
    private String newPassword;

    @ToString.Exclude
    private String newPasswordRepeat;
}
