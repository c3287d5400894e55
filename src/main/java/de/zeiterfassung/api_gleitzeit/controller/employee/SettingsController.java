package de.zeiterfassung.api_gleitzeit.controller.employee;

import de.zeiterfassung.api_gleitzeit.controller.common.OperationResponses;
import de.zeiterfassung.api_gleitzeit.dto.common.OperationResult;
import de.zeiterfassung.api_gleitzeit.dto.employee.EmployeeView;
import de.zeiterfassung.api_gleitzeit.dto.employee.PasswordChangeRequest;
import de.zeiterfassung.api_gleitzeit.dto.employee.TrafficLightRequest;
import de.zeiterfassung.api_gleitzeit.dto.employee.WeeklyHoursRequest;
import de.zeiterfassung.api_gleitzeit.service.common.OperationRunner;
import de.zeiterfassung.api_gleitzeit.service.employee.EmployeeService;
import de.zeiterfassung.api_gleitzeit.service.employee.SettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/employees/{id}/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsService settingsService;
    private final EmployeeService employeeService;
    private final OperationRunner operationRunner;

    @PutMapping("/weekly-hours")
    public ResponseEntity<OperationResult<EmployeeView>> updateWeeklyHours(@PathVariable("id") Long id,
                                                                           @Valid @RequestBody WeeklyHoursRequest request) {
        return OperationResponses.ok(operationRunner.run("Wochenstunden ändern", () -> employeeService.toView(
                settingsService.updateWeeklyHours(employeeService.getEmployee(id),
                        request.getWeeklyHours(), request.getEffectiveFrom()))));
    }

    @PutMapping("/traffic-light")
    public ResponseEntity<OperationResult<EmployeeView>> updateTrafficLight(@PathVariable("id") Long id,
                                                                            @Valid @RequestBody TrafficLightRequest request) {
        return OperationResponses.ok(operationRunner.run("Ampelgrenzen ändern", () -> employeeService.toView(
                settingsService.updateTrafficLight(employeeService.getEmployee(id), request.getGreen(), request.getRed()))));
    }

    @PutMapping("/password")
    public ResponseEntity<OperationResult<Void>> changePassword(@PathVariable("id") Long id,
                                                                @RequestBody PasswordChangeRequest request) {
        return OperationResponses.ok(operationRunner.runVoid("Passwort ändern", () -> settingsService.changePassword(
                employeeService.getEmployee(id), request.getNewPassword(), request.getNewPasswordRepeat())));
    }
}
