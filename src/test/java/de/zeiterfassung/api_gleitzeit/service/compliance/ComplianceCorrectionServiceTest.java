package de.zeiterfassung.api_gleitzeit.service.compliance;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import de.zeiterfassung.api_gleitzeit.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class ComplianceCorrectionServiceTest extends IntegrationTestSupport {

    @Autowired
    private ComplianceCorrectionService correctionService;

    @Autowired
    private ComplianceMonitorService monitorService;

    @Test
    void removesSundayWarningWhenStampsAreGone() {
        Employee employee = adult(LAST_FRIDAY);
        workday(employee, LAST_SUNDAY, "10:00", "12:00");
        monitorService.checkSundaysAndHolidays(employee);
        assertThat(hasNotification(employee, NotificationCode.SUNDAY_OR_HOLIDAY, LAST_SUNDAY)).isTrue();

        timeStampRepository.deleteAll(timeStampRepository
                .findByEmployeeIdAndStampDateOrderByStampTimeAsc(employee.getId(), LAST_SUNDAY));
        timeStampRepository.flush();

        assertThat(correctionService.correct(employee)).isEqualTo(1);
        assertThat(hasNotification(employee, NotificationCode.SUNDAY_OR_HOLIDAY, LAST_SUNDAY)).isFalse();
    }

    @Test
    void keepsWarningWhileViolationPersists() {
        Employee employee = adult(MONDAY);
        workday(employee, MONDAY, "14:00", "22:00");
        workday(employee, YESTERDAY, "07:00", "15:00");
        monitorService.checkRestPeriods(employee);

        assertThat(correctionService.correct(employee)).isZero();
        assertThat(hasNotification(employee, NotificationCode.REST_PERIOD, YESTERDAY)).isTrue();
    }

    @Test
    void removesRestPeriodWarningAfterEdit() {
        Employee employee = adult(MONDAY);
        workday(employee, MONDAY, "14:00", "22:00");
        stamp(employee, YESTERDAY, "07:00");
        stamp(employee, YESTERDAY, "17:00");
        monitorService.checkRestPeriods(employee);

        TimeStamp first = timeStampRepository
                .findByEmployeeIdAndStampDateOrderByStampTimeAsc(employee.getId(), YESTERDAY).get(0);
        first.setStampTime(LocalTime.of(9, 0));
        timeStampRepository.saveAndFlush(first);

        assertThat(correctionService.correct(employee)).isEqualTo(1);
        assertThat(hasNotification(employee, NotificationCode.REST_PERIOD, YESTERDAY)).isFalse();
    }

    @Test
    void dailyMaximumResolvedWhenWithinLimit() {
        Employee employee = adult(MONDAY);
        workday(employee, MONDAY, "09:00", "17:00");

        assertThat(correctionService.isResolved(employee, NotificationCode.DAILY_MAXIMUM, MONDAY)).isTrue();
        assertThat(correctionService.isResolved(employee, NotificationCode.DAILY_MAXIMUM, YESTERDAY)).isTrue();
    }

    @Test
    void missingWorkdayAndOddCountAreNeverCorrectedHere() {
        Employee employee = adult(MONDAY);
        notificationStore.record(employee, NotificationCode.MISSING_WORKDAY, MONDAY);
        notificationStore.record(employee, NotificationCode.ODD_STAMP_COUNT, YESTERDAY);

        assertThat(correctionService.correct(employee)).isZero();
        assertThat(correctionService.isResolved(employee, NotificationCode.ODD_STAMP_COUNT, YESTERDAY)).isFalse();
    }

    @Test
    void minorRulesResolvedOnceEmployeeIsAdult() {
        Employee employee = adult(MONDAY);

        assertThat(correctionService.isResolved(employee, NotificationCode.MINOR_WORKDAYS, MONDAY)).isTrue();
        assertThat(correctionService.isResolved(employee, NotificationCode.MINOR_WEEKLY_HOURS, MONDAY)).isTrue();
    }
}
