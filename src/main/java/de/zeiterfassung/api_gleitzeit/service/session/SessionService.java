package de.zeiterfassung.api_gleitzeit.service.session;

import de.zeiterfassung.api_gleitzeit.dto.employee.DashboardDTO;
import de.zeiterfassung.api_gleitzeit.dto.employee.LoginRequest;
import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampView;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.repository.employee.EmployeeRepository;
import de.zeiterfassung.api_gleitzeit.repository.timeStamp.TimeStampRepository;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import de.zeiterfassung.api_gleitzeit.service.compliance.ComplianceCycleService;
import de.zeiterfassung.api_gleitzeit.service.employee.EmployeeService;
import de.zeiterfassung.api_gleitzeit.service.ledger.FlexTimeRollupService;
import de.zeiterfassung.api_gleitzeit.service.notification.NotificationStoreService;
import de.zeiterfassung.api_gleitzeit.service.notification.NotificationTextRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    private static final String LOGIN_FAILED = "Name oder Passwort ist falsch.";

    private final EmployeeRepository employeeRepository;
    private final TimeStampRepository timeStampRepository;
    private final EmployeeService employeeService;
    private final ComplianceCycleService cycleService;
    private final FlexTimeRollupService rollupService;
    private final NotificationStoreService notificationStore;
    private final NotificationTextRenderer textRenderer;
    private final PasswordEncoder passwordEncoder;
    private final TimeService timeService;
    private final Clock clock;

    /**
     * Prüft die Anmeldedaten, bewertet den Zeitraum seit dem letzten Login
     * neu und setzt erst danach den letzten Login auf heute.
     */
    @Transactional
    public DashboardDTO login(LoginRequest request) {
        Employee employee = employeeRepository.findByName(request.getName() == null ? "" : request.getName().trim())
                .orElseThrow(() -> new IllegalArgumentException(LOGIN_FAILED));
        if (request.getPassword() == null || !passwordEncoder.matches(request.getPassword(), employee.getPasswordHash())) {
            log.warn("Fehlgeschlagener Login für {}", request.getName());
            throw new IllegalArgumentException(LOGIN_FAILED);
        }

        cycleService.run(employee);

        employee.setLastLogin(LocalDate.now(clock));
        employeeRepository.save(employee);
        log.info("Mitarbeiter {} angemeldet, Gleitzeit {}h", employee.getId(), employee.getFlexBalance());
        return dashboard(employee, request.isIncludeMissingDays());
    }

    @Transactional(readOnly = true)
    public DashboardDTO dashboard(Employee employee, boolean includeMissingDays) {
        LocalDate today = LocalDate.now(clock);
        return DashboardDTO.builder()
                .employee(employeeService.toView(employee))
                .flexBalance(timeService.round2(employee.currentFlexBalance()))
                .trafficLight(employeeService.trafficLight(employee))
                .messages(notificationStore.messages(employee).stream().map(textRenderer::view).toList())
                .cumulative(rollupService.cumulative(employee, today, includeMissingDays))
                .todayStamps(timeStampRepository.findByEmployeeIdAndStampDateOrderByStampTimeAsc(employee.getId(), today)
                        .stream().map(StampView::of).toList())
                .build();
    }
}
