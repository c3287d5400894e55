package de.zeiterfassung.api_gleitzeit.service.compliance;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.notification.Notification;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import de.zeiterfassung.api_gleitzeit.exception.ResourceNotFoundException;
import de.zeiterfassung.api_gleitzeit.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class PopupWarningServiceTest extends IntegrationTestSupport {

    @Autowired
    private PopupWarningService popupWarningService;

    @Test
    void refresh_plansBothWarningsForMinor() {
        Employee employee = minor(TODAY);
        stamp(employee, TODAY, "09:00");

        popupWarningService.refresh(employee);

        // Fenster endet 20:00, Höchstzeit 9h brutto, je 30 Minuten Vorlauf
        assertThat(popupWarningService.pendingPopups(employee))
                .extracting(Notification::getCode, Notification::getPopupTime)
                .containsExactly(
                        tuple(NotificationCode.MAX_HOURS_APPROACHING, LocalTime.of(17, 30)),
                        tuple(NotificationCode.WORK_WINDOW_ENDING, LocalTime.of(19, 30)));
    }

    @Test
    void refresh_countsEarlierPairsOfTheDay() {
        Employee employee = adult(TODAY);
        stamp(employee, TODAY, "06:00");
        stamp(employee, TODAY, "08:00");
        stamp(employee, TODAY, "09:00");

        popupWarningService.refresh(employee);

        // 10:45 - 0:30 - 2:00 = 8:15 nach dem letzten Stempel
        assertThat(notificationStore.popupsOn(employee, TODAY))
                .filteredOn(n -> n.getCode() == NotificationCode.MAX_HOURS_APPROACHING)
                .extracting(Notification::getPopupTime)
                .containsExactly(LocalTime.of(17, 15));
    }

    @Test
    void refresh_removesPopupsAfterClockingOut() {
        Employee employee = adult(TODAY);
        stamp(employee, TODAY, "08:00");
        popupWarningService.refresh(employee);
        assertThat(notificationStore.popupsOn(employee, TODAY)).isNotEmpty();

        stamp(employee, TODAY, "09:30");
        popupWarningService.refresh(employee);

        assertThat(notificationStore.popupsOn(employee, TODAY)).isEmpty();
    }

    @Test
    void createPopups_skipsWarningsInThePast() {
        Employee employee = minor(TODAY);
        stamp(employee, TODAY, "00:00");
        stamp(employee, TODAY, "01:30");
        stamp(employee, TODAY, "01:31");

        popupWarningService.createPopups(employee);

        // 01:31 + 8:30 - 1:30 = 08:31, bereits vorbei
        assertThat(notificationStore.popupsOn(employee, TODAY))
                .extracting(Notification::getCode)
                .containsExactly(NotificationCode.WORK_WINDOW_ENDING);
    }

    @Test
    void acknowledge_deletesPopup() {
        Employee employee = adult(TODAY);
        stamp(employee, TODAY, "09:00");
        popupWarningService.refresh(employee);
        Notification popup = notificationStore.popupsOn(employee, TODAY).get(0);

        popupWarningService.acknowledge(employee, popup.getId());

        assertThat(notificationStore.popupsOn(employee, TODAY)).hasSize(1);
    }

    @Test
    void acknowledge_rejectsRegularMessagesAndUnknownIds() {
        Employee employee = adult(MONDAY);
        notificationStore.record(employee, NotificationCode.MISSING_WORKDAY, MONDAY);
        Notification message = notificationStore.messages(employee).get(0);

        assertThatThrownBy(() -> popupWarningService.acknowledge(employee, message.getId()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> popupWarningService.acknowledge(employee, 999_999L))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
