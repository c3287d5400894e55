package de.zeiterfassung.api_gleitzeit.service.compliance;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import de.zeiterfassung.api_gleitzeit.service.ledger.Settlement;
import de.zeiterfassung.api_gleitzeit.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ComplianceCycleServiceTest extends IntegrationTestSupport {

    @Autowired
    private ComplianceCycleService cycleService;

    @Test
    void run_penalizesMissingDaysBeforeSettling() {
        Employee employee = adult(MONDAY);
        workday(employee, YESTERDAY, "09:00", "17:30");

        Settlement settlement = cycleService.run(employee);

        // Montag fehlt (-8h), Dienstag 8,5h minus 30 Minuten Pause = Soll
        assertThat(settlement.deltaHours()).isCloseTo(0.0, within(1e-9));
        assertThat(employee.getFlexBalance()).isCloseTo(-8.0, within(1e-9));
        assertThat(hasNotification(employee, NotificationCode.MISSING_WORKDAY, MONDAY)).isTrue();
        assertThat(hasNotification(employee, NotificationCode.MISSING_WORKDAY, YESTERDAY)).isFalse();
    }

    @Test
    void run_twiceChangesNothing() {
        Employee employee = adult(MONDAY);
        workday(employee, MONDAY, "09:00", "18:00");
        stamp(employee, YESTERDAY, "09:00");

        cycleService.run(employee);
        double balance = employee.getFlexBalance();
        int messages = notificationStore.messages(employee).size();
        cycleService.run(employee);

        assertThat(employee.getFlexBalance()).isCloseTo(balance, within(1e-9));
        assertThat(notificationStore.messages(employee)).hasSize(messages);
        assertThat(hasNotification(employee, NotificationCode.ODD_STAMP_COUNT, YESTERDAY)).isTrue();
    }
}
