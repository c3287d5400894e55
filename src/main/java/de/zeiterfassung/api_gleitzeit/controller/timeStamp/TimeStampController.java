package de.zeiterfassung.api_gleitzeit.controller.timeStamp;

import de.zeiterfassung.api_gleitzeit.controller.common.OperationResponses;
import de.zeiterfassung.api_gleitzeit.dto.common.OperationResult;
import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampAdvisory;
import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampEditRequest;
import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampRequest;
import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampView;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.service.common.OperationRunner;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import de.zeiterfassung.api_gleitzeit.service.compliance.StampAdvisoryService;
import de.zeiterfassung.api_gleitzeit.service.employee.EmployeeService;
import de.zeiterfassung.api_gleitzeit.service.timeStamp.TimeStampService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/employees/{id}/stamps")
@RequiredArgsConstructor
public class TimeStampController {

    private final TimeStampService timeStampService;
    private final StampAdvisoryService advisoryService;
    private final EmployeeService employeeService;
    private final OperationRunner operationRunner;
    private final TimeService timeService;
    private final Clock clock;

    // Hinweise vor dem Stempeln; ohne Parameter für jetzt
    @GetMapping("/advisories")
    public ResponseEntity<?> getAdvisories(@PathVariable("id") Long id,
                                           @RequestParam(name = "date", required = false) String date,
                                           @RequestParam(name = "time", required = false) String time) {
        Employee employee = employeeService.getEmployee(id);
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDate stampDate = date == null ? now.toLocalDate() : timeService.parseDate(date);
            LocalTime stampTime = time == null ? now.toLocalTime() : timeService.parse(time);
            List<StampAdvisory> advisories = advisoryService.advise(employee, stampDate, stampTime);
            return ResponseEntity.ok(advisories);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/clock")
    public ResponseEntity<OperationResult<StampView>> clock(@PathVariable("id") Long id,
                                                            @RequestParam(name = "confirmAbsenceRemoval", defaultValue = "false")
                                                            boolean confirmAbsenceRemoval) {
        return OperationResponses.created(operationRunner.run("Stempeln", () -> StampView.of(
                timeStampService.clock(employeeService.getEmployee(id), confirmAbsenceRemoval))));
    }

    @PostMapping
    public ResponseEntity<OperationResult<StampView>> addManualStamp(@PathVariable("id") Long id,
                                                                     @Valid @RequestBody StampRequest request) {
        return OperationResponses.created(operationRunner.run("Stempel nachtragen", () -> StampView.of(
                timeStampService.addManualStamp(employeeService.getEmployee(id), request.getDate(), request.getTime()))));
    }

    @PutMapping("/{stampId}")
    public ResponseEntity<OperationResult<StampView>> editStamp(@PathVariable("id") Long id,
                                                                @PathVariable("stampId") Long stampId,
                                                                @Valid @RequestBody StampEditRequest request) {
        return OperationResponses.ok(operationRunner.run("Stempel bearbeiten", () -> StampView.of(
                timeStampService.editStamp(employeeService.getEmployee(id), stampId, request.getTime()))));
    }

    @DeleteMapping("/{stampId}")
    public ResponseEntity<OperationResult<Void>> deleteStamp(@PathVariable("id") Long id,
                                                             @PathVariable("stampId") Long stampId) {
        return OperationResponses.ok(operationRunner.runVoid("Stempel löschen",
                () -> timeStampService.deleteStamp(employeeService.getEmployee(id), stampId)));
    }

    @GetMapping
    public ResponseEntity<?> getStamps(@PathVariable("id") Long id,
                                       @RequestParam(name = "date", required = false) String date) {
        Employee employee = employeeService.getEmployee(id);
        try {
            LocalDate day = date == null ? LocalDate.now(clock) : timeService.parseDate(date);
            List<StampView> stamps = timeStampService.stampsOn(employee, day).stream().map(StampView::of).toList();
            return ResponseEntity.ok(stamps);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
