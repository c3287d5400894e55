package de.zeiterfassung.api_gleitzeit.controller.absence;

import de.zeiterfassung.api_gleitzeit.controller.common.OperationResponses;
import de.zeiterfassung.api_gleitzeit.dto.absence.AbsenceRequest;
import de.zeiterfassung.api_gleitzeit.dto.absence.AbsenceView;
import de.zeiterfassung.api_gleitzeit.dto.common.OperationResult;
import de.zeiterfassung.api_gleitzeit.service.absence.AbsenceService;
import de.zeiterfassung.api_gleitzeit.service.common.OperationRunner;
import de.zeiterfassung.api_gleitzeit.service.employee.EmployeeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/employees/{id}/absences")
@RequiredArgsConstructor
public class AbsenceController {

    private final AbsenceService absenceService;
    private final EmployeeService employeeService;
    private final OperationRunner operationRunner;

    @PostMapping
    public ResponseEntity<OperationResult<AbsenceView>> registerAbsence(@PathVariable("id") Long id,
                                                                        @Valid @RequestBody AbsenceRequest request) {
        return OperationResponses.created(operationRunner.run("Abwesenheit eintragen", () -> AbsenceView.of(
                absenceService.registerAbsence(employeeService.getEmployee(id), request.getDate(), request.getType()))));
    }

    @GetMapping
    public List<AbsenceView> getAbsences(@PathVariable("id") Long id) {
        return absenceService.absences(employeeService.getEmployee(id)).stream()
                .map(AbsenceView::of)
                .toList();
    }
}
