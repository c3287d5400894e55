package de.zeiterfassung.api_gleitzeit.controller.boundaries.holiday;

import de.zeiterfassung.api_gleitzeit.controller.common.OperationResponses;
import de.zeiterfassung.api_gleitzeit.dto.common.OperationResult;
import de.zeiterfassung.api_gleitzeit.dto.holiday.HolidayRequest;
import de.zeiterfassung.api_gleitzeit.dto.holiday.HolidayView;
import de.zeiterfassung.api_gleitzeit.service.common.OperationRunner;
import de.zeiterfassung.api_gleitzeit.service.holiday.HolidayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/holidays")
@RequiredArgsConstructor
public class HolidayController {

    private final HolidayService holidayService;
    private final OperationRunner operationRunner;

    /** Ohne {@code year} nur die betrieblichen Feiertage, mit {@code year} zusätzlich die gesetzlichen. */
    @GetMapping
    public List<HolidayView> listHolidays(@RequestParam(name = "year", required = false) Integer year) {
        if (year != null) {
            return holidayService.holidaysOf(year);
        }
        return holidayService.companyHolidays().stream()
                .map(HolidayView::of)
                .toList();
    }

    @GetMapping("/{id}")
    public HolidayView getHoliday(@PathVariable("id") Long id) {
        return HolidayView.of(holidayService.getHoliday(id));
    }

    @PostMapping
    public ResponseEntity<OperationResult<HolidayView>> addHoliday(@Valid @RequestBody HolidayRequest request) {
        return OperationResponses.created(operationRunner.run("Feiertag anlegen", () -> HolidayView.of(
                holidayService.addHoliday(request.getDate(), request.getDescription()))));
    }

    @PutMapping("/{id}")
    public ResponseEntity<OperationResult<HolidayView>> changeHoliday(@PathVariable("id") Long id,
                                                                      @Valid @RequestBody HolidayRequest request) {
        return OperationResponses.ok(operationRunner.run("Feiertag ändern", () -> HolidayView.of(
                holidayService.changeHoliday(id, request.getDate(), request.getDescription()))));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OperationResult<Void>> removeHoliday(@PathVariable("id") Long id) {
        return OperationResponses.ok(operationRunner.runVoid("Feiertag löschen",
                () -> holidayService.removeHoliday(id)));
    }
}
