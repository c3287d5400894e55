package de.zeiterfassung.api_gleitzeit.service.compliance;

import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampAdvisory;
import de.zeiterfassung.api_gleitzeit.entity.absence.AbsenceType;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class StampAdvisoryServiceTest extends IntegrationTestSupport {

    @Autowired
    private StampAdvisoryService advisoryService;

    @Test
    void regularStamp_hasNoAdvisories() {
        Employee employee = adult(TODAY);
        workday(employee, YESTERDAY, "08:00", "17:00");

        assertThat(advisoryService.advise(employee, TODAY, LocalTime.of(8, 0))).isEmpty();
    }

    @Test
    void lateStamp_isOutsideWorkWindow() {
        Employee employee = minor(TODAY);

        assertThat(advisoryService.advise(employee, TODAY, LocalTime.of(20, 30)))
                .extracting(StampAdvisory::kind)
                .containsExactly(StampAdvisory.Kind.WORK_WINDOW);
        assertThat(advisoryService.advise(adult(TODAY), TODAY, LocalTime.of(20, 30))).isEmpty();
    }

    @Test
    void firstStampAfterShortRest_warns() {
        Employee employee = adult(TODAY);
        workday(employee, YESTERDAY, "13:00", "22:00");

        assertThat(advisoryService.advise(employee, TODAY, LocalTime.of(7, 0)))
                .extracting(StampAdvisory::kind)
                .containsExactly(StampAdvisory.Kind.REST_PERIOD);
        assertThat(advisoryService.advise(employee, TODAY, LocalTime.of(9, 0))).isEmpty();
    }

    @Test
    void laterStampsOfTheDay_skipRestCheck() {
        Employee employee = adult(TODAY);
        workday(employee, YESTERDAY, "13:00", "22:00");
        stamp(employee, TODAY, "07:00");

        assertThat(advisoryService.advise(employee, TODAY, LocalTime.of(8, 0))).isEmpty();
    }

    @Test
    void minorSixthWorkday_warns() {
        Employee employee = minor(LocalDate.of(2025, 3, 3));
        for (int i = 0; i < 5; i++) {
            workday(employee, LocalDate.of(2025, 3, 3).plusDays(i), "08:00", "12:00");
        }

        assertThat(advisoryService.advise(employee, LocalDate.of(2025, 3, 8), LocalTime.of(9, 0)))
                .extracting(StampAdvisory::kind)
                .containsExactly(StampAdvisory.Kind.SIXTH_WORKDAY);
        // ein weiterer Stempel am Freitag ist kein sechster Tag
        assertThat(advisoryService.advise(employee, LocalDate.of(2025, 3, 7), LocalTime.of(13, 0))).isEmpty();
    }

    @Test
    void sundayAndAbsence_areReported() {
        Employee employee = adult(TODAY);
        absence(employee, LocalDate.of(2025, 3, 13), AbsenceType.VACATION);

        assertThat(advisoryService.advise(employee, LocalDate.of(2025, 3, 16), LocalTime.of(10, 0)))
                .extracting(StampAdvisory::kind)
                .containsExactly(StampAdvisory.Kind.SUNDAY_OR_HOLIDAY);
        assertThat(advisoryService.advise(employee, LocalDate.of(2025, 3, 13), LocalTime.of(10, 0)))
                .extracting(StampAdvisory::kind)
                .containsExactly(StampAdvisory.Kind.ABSENCE_TODAY);
    }

    @Test
    void goodFriday_isHoliday() {
        Employee employee = adult(TODAY);

        assertThat(advisoryService.advise(employee, LocalDate.of(2025, 4, 18), LocalTime.of(10, 0)))
                .extracting(StampAdvisory::kind)
                .containsExactly(StampAdvisory.Kind.SUNDAY_OR_HOLIDAY);
    }
}
