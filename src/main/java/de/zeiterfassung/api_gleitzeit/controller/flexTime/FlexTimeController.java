package de.zeiterfassung.api_gleitzeit.controller.flexTime;

import de.zeiterfassung.api_gleitzeit.dto.flexTime.CumulativeFlexTime;
import de.zeiterfassung.api_gleitzeit.dto.flexTime.FlexTimeAverage;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import de.zeiterfassung.api_gleitzeit.service.employee.EmployeeService;
import de.zeiterfassung.api_gleitzeit.service.ledger.FlexTimeRollupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

@RestController
@RequestMapping("/api/employees/{id}/flex-time")
@RequiredArgsConstructor
public class FlexTimeController {

    private final FlexTimeRollupService rollupService;
    private final EmployeeService employeeService;
    private final TimeService timeService;
    private final Clock clock;

    @GetMapping("/average")
    public ResponseEntity<?> getAverage(@PathVariable("id") Long id,
                                        @RequestParam("start") String start,
                                        @RequestParam("end") String end,
                                        @RequestParam(name = "includeMissingDays", defaultValue = "false")
                                        boolean includeMissingDays) {
        Employee employee = employeeService.getEmployee(id);
        try {
            FlexTimeAverage average = rollupService.averageFlexTime(employee,
                    timeService.parseDate(start), timeService.parseDate(end), includeMissingDays);
            return ResponseEntity.ok(average);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/cumulative")
    public ResponseEntity<CumulativeFlexTime> getCumulative(@PathVariable("id") Long id,
                                                            @RequestParam(name = "includeMissingDays", defaultValue = "false")
                                                            boolean includeMissingDays) {
        Employee employee = employeeService.getEmployee(id);
        return ResponseEntity.ok(rollupService.cumulative(employee, LocalDate.now(clock), includeMissingDays));
    }
}
