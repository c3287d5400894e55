package de.zeiterfassung.api_gleitzeit.controller.employee;

import de.zeiterfassung.api_gleitzeit.controller.common.OperationResponses;
import de.zeiterfassung.api_gleitzeit.dto.common.OperationResult;
import de.zeiterfassung.api_gleitzeit.dto.employee.DashboardDTO;
import de.zeiterfassung.api_gleitzeit.dto.employee.EmployeeView;
import de.zeiterfassung.api_gleitzeit.dto.employee.LoginRequest;
import de.zeiterfassung.api_gleitzeit.dto.employee.RegistrationRequest;
import de.zeiterfassung.api_gleitzeit.dto.employee.TeamMemberView;
import de.zeiterfassung.api_gleitzeit.service.common.OperationRunner;
import de.zeiterfassung.api_gleitzeit.service.employee.EmployeeService;
import de.zeiterfassung.api_gleitzeit.service.session.SessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/employees")
@RequiredArgsConstructor
public class EmployeeController {

    private final EmployeeService employeeService;
    private final SessionService sessionService;
    private final OperationRunner operationRunner;

    @PostMapping("/register")
    public ResponseEntity<OperationResult<EmployeeView>> register(@Valid @RequestBody RegistrationRequest request) {
        return OperationResponses.created(operationRunner.run("Registrierung",
                () -> employeeService.toView(employeeService.register(request))));
    }

    @PostMapping("/login")
    public ResponseEntity<OperationResult<DashboardDTO>> login(@Valid @RequestBody LoginRequest request) {
        return OperationResponses.ok(operationRunner.run("Login", () -> sessionService.login(request)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EmployeeView> getEmployee(@PathVariable("id") Long id) {
        return ResponseEntity.ok(employeeService.toView(employeeService.getEmployee(id)));
    }

    @GetMapping("/{id}/dashboard")
    public ResponseEntity<DashboardDTO> getDashboard(@PathVariable("id") Long id,
                                                     @RequestParam(name = "includeMissingDays", defaultValue = "false")
                                                     boolean includeMissingDays) {
        return ResponseEntity.ok(sessionService.dashboard(employeeService.getEmployee(id), includeMissingDays));
    }

    // Mitarbeiter, deren Vorgesetzter {id} ist
    @GetMapping("/{id}/team")
    public ResponseEntity<List<TeamMemberView>> getTeam(@PathVariable("id") Long id) {
        return ResponseEntity.ok(employeeService.team(id));
    }
}
