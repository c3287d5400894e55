package de.zeiterfassung.api_gleitzeit.service.timeStamp;

import de.zeiterfassung.api_gleitzeit.entity.absence.AbsenceType;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import de.zeiterfassung.api_gleitzeit.exception.ResourceNotFoundException;
import de.zeiterfassung.api_gleitzeit.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimeStampServiceTest extends IntegrationTestSupport {

    @Autowired
    private TimeStampService timeStampService;

    @Test
    void clock_stampsCurrentTimeAndPlansPopups() {
        Employee employee = adult(TODAY);

        TimeStamp stamp = timeStampService.clock(employee, false);

        assertThat(stamp.getStampDate()).isEqualTo(TODAY);
        assertThat(stamp.getStampTime()).isEqualTo(LocalTime.of(10, 0));
        assertThat(notificationStore.popupsOn(employee, TODAY)).hasSize(2);
    }

    @Test
    void clock_rejectsSecondStampInSameSecond() {
        Employee employee = adult(TODAY);
        timeStampService.clock(employee, false);

        assertThatThrownBy(() -> timeStampService.clock(employee, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("existiert bereits ein Stempel");
    }

    @Test
    void clock_onVacationNeedsConfirmation() {
        Employee employee = adult(TODAY);
        absence(employee, TODAY, AbsenceType.VACATION);

        assertThatThrownBy(() -> timeStampService.clock(employee, false))
                .isInstanceOf(IllegalArgumentException.class);

        timeStampService.clock(employee, true);
        assertThat(absenceRepository.existsByEmployeeIdAndAbsenceDate(employee.getId(), TODAY)).isFalse();
        assertThat(timeStampRepository.countByEmployeeIdAndStampDate(employee.getId(), TODAY)).isEqualTo(1);
    }

    @Test
    void clock_onSickDayIsRejectedEvenWhenConfirmed() {
        Employee employee = adult(TODAY);
        absence(employee, TODAY, AbsenceType.SICK);

        assertThatThrownBy(() -> timeStampService.clock(employee, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(timeStampRepository.countByEmployeeIdAndStampDate(employee.getId(), TODAY)).isZero();
    }

    @Test
    void addManualStamp_settlesCompletedPair() {
        Employee employee = adult(TODAY);

        timeStampService.addManualStamp(employee, "2025-03-11", "09:00");
        assertThat(hasNotification(employee, NotificationCode.ODD_STAMP_COUNT, YESTERDAY)).isTrue();
        assertThat(employee.getLastLogin()).isEqualTo(YESTERDAY);

        timeStampService.addManualStamp(employee, "11.03.2025", "18:00");

        assertThat(employee.getFlexBalance()).isCloseTo(0.25, within(1e-9));
        assertThat(hasNotification(employee, NotificationCode.ODD_STAMP_COUNT, YESTERDAY)).isFalse();
    }

    @Test
    void addManualStamp_rejectsFutureAndAbsenceDays() {
        Employee employee = adult(TODAY);
        absence(employee, MONDAY, AbsenceType.VACATION);

        assertThatThrownBy(() -> timeStampService.addManualStamp(employee, "2025-03-12", "10:01"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Stempel in der Zukunft sind nicht erlaubt.");
        assertThatThrownBy(() -> timeStampService.addManualStamp(employee, "2025-03-10", "09:00"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> timeStampService.addManualStamp(employee, "2025-03-11", "9 Uhr"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void editStamp_recalculatesDay() {
        Employee employee = adult(TODAY);
        timeStampService.addManualStamp(employee, "2025-03-11", "09:00");
        TimeStamp end = timeStampService.addManualStamp(employee, "2025-03-11", "18:00");

        timeStampService.editStamp(employee, end.getId(), "17:00");

        // 8h minus 30 Minuten Pause
        assertThat(employee.getFlexBalance()).isCloseTo(-0.5, within(1e-9));
        assertThat(timeStampRepository.findByEmployeeIdAndStampDateOrderByStampTimeAsc(employee.getId(), YESTERDAY))
                .allMatch(TimeStamp::isSettled);
    }

    @Test
    void editStamp_sameTimeChangesNothing() {
        Employee employee = adult(TODAY);
        timeStampService.addManualStamp(employee, "2025-03-11", "09:00");
        TimeStamp end = timeStampService.addManualStamp(employee, "2025-03-11", "18:00");

        TimeStamp unchanged = timeStampService.editStamp(employee, end.getId(), "18:00");

        assertThat(unchanged.getStampTime()).isEqualTo(LocalTime.of(18, 0));
        assertThat(employee.getFlexBalance()).isCloseTo(0.25, within(1e-9));
    }

    @Test
    void deleteStamp_revertsDayAndFlagsOddCount() {
        Employee employee = adult(TODAY);
        timeStampService.addManualStamp(employee, "2025-03-11", "09:00");
        TimeStamp end = timeStampService.addManualStamp(employee, "2025-03-11", "18:00");

        timeStampService.deleteStamp(employee, end.getId());

        assertThat(employee.getFlexBalance()).isCloseTo(0.0, within(1e-9));
        assertThat(timeStampService.stampsOn(employee, YESTERDAY)).hasSize(1);
        assertThat(hasNotification(employee, NotificationCode.ODD_STAMP_COUNT, YESTERDAY)).isTrue();
    }

    @Test
    void stampsOfOtherEmployeesAreNotFound() {
        Employee owner = adult(TODAY);
        Employee other = adult(TODAY);
        TimeStamp stamp = stamp(owner, YESTERDAY, "09:00");

        assertThatThrownBy(() -> timeStampService.deleteStamp(other, stamp.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> timeStampService.editStamp(other, stamp.getId(), "10:00"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
