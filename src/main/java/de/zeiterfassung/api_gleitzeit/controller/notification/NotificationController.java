package de.zeiterfassung.api_gleitzeit.controller.notification;

import de.zeiterfassung.api_gleitzeit.controller.common.OperationResponses;
import de.zeiterfassung.api_gleitzeit.dto.common.OperationResult;
import de.zeiterfassung.api_gleitzeit.dto.notification.NotificationView;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.service.common.OperationRunner;
import de.zeiterfassung.api_gleitzeit.service.compliance.PopupWarningService;
import de.zeiterfassung.api_gleitzeit.service.employee.EmployeeService;
import de.zeiterfassung.api_gleitzeit.service.notification.NotificationStoreService;
import de.zeiterfassung.api_gleitzeit.service.notification.NotificationTextRenderer;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/employees/{id}/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationStoreService notificationStore;
    private final PopupWarningService popupWarningService;
    private final NotificationTextRenderer textRenderer;
    private final EmployeeService employeeService;
    private final OperationRunner operationRunner;

    // Meldungen ohne PopUps
    @GetMapping
    public List<NotificationView> getNotifications(@PathVariable("id") Long id) {
        Employee employee = employeeService.getEmployee(id);
        return notificationStore.messages(employee).stream().map(textRenderer::view).toList();
    }

    // Für den Timer des Clients: heutige PopUps, die noch angezeigt werden müssen
    @GetMapping("/popups")
    public List<NotificationView> getPendingPopups(@PathVariable("id") Long id) {
        Employee employee = employeeService.getEmployee(id);
        return popupWarningService.pendingPopups(employee).stream().map(textRenderer::view).toList();
    }

    @DeleteMapping("/popups/{notificationId}")
    public ResponseEntity<OperationResult<Void>> acknowledgePopup(@PathVariable("id") Long id,
                                                                  @PathVariable("notificationId") Long notificationId) {
        return OperationResponses.ok(operationRunner.runVoid("PopUp bestätigen",
                () -> popupWarningService.acknowledge(employeeService.getEmployee(id), notificationId)));
    }
}
