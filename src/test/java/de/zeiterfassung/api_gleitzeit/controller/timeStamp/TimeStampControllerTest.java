package de.zeiterfassung.api_gleitzeit.controller.timeStamp;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampAdvisory;
import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampEditRequest;
import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampRequest;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import de.zeiterfassung.api_gleitzeit.exception.GlobalExceptionHandler;
import de.zeiterfassung.api_gleitzeit.exception.ResourceNotFoundException;
import de.zeiterfassung.api_gleitzeit.service.common.OperationRunner;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import de.zeiterfassung.api_gleitzeit.service.compliance.StampAdvisoryService;
import de.zeiterfassung.api_gleitzeit.service.employee.EmployeeService;
import de.zeiterfassung.api_gleitzeit.service.timeStamp.TimeStampService;
import de.zeiterfassung.api_gleitzeit.support.FixedClockConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = TimeStampController.class)
@AutoConfigureMockMvc(addFilters = false)
class TimeStampControllerTest {

    @SpringBootConfiguration
    @Import({TimeStampController.class, OperationRunner.class, TimeService.class,
            GlobalExceptionHandler.class, FixedClockConfiguration.class})
    static class TestApplication {}

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 12);

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    TimeStampService timeStampService;

    @MockBean
    StampAdvisoryService advisoryService;

    @MockBean
    EmployeeService employeeService;

    @MockBean
    PlatformTransactionManager transactionManager;

    private Employee employee;

    @BeforeEach
    void setup() {
        employee = new Employee();
        employee.setId(1L);
        when(employeeService.getEmployee(1L)).thenReturn(employee);
    }

    private static TimeStamp stamp(long id, LocalDate date, String time) {
        return TimeStamp.builder().id(id).stampDate(date).stampTime(LocalTime.parse(time)).build();
    }

    @Test
    void advisories_defaultToNow() throws Exception {
        when(advisoryService.advise(employee, TODAY, LocalTime.of(10, 0))).thenReturn(List.of(
                new StampAdvisory(StampAdvisory.Kind.REST_PERIOD, "Ruhezeit")));

        mockMvc.perform(get("/api/employees/1/stamps/advisories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("REST_PERIOD"));
    }

    @Test
    void advisories_returns400_whenDateInvalid() throws Exception {
        mockMvc.perform(get("/api/employees/1/stamps/advisories").param("date", "gestern"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Ungültiges Datum: gestern"));
    }

    @Test
    void clock_returns201() throws Exception {
        when(timeStampService.clock(employee, false)).thenReturn(stamp(5L, TODAY, "10:00"));

        mockMvc.perform(post("/api/employees/1/stamps/clock"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value(5))
                .andExpect(jsonPath("$.data.time").value("10:00:00"));
    }

    @Test
    void clock_returns400_whenAbsenceNotConfirmed() throws Exception {
        when(timeStampService.clock(any(), anyBoolean()))
                .thenThrow(new IllegalArgumentException("Für heute ist eine Abwesenheit eingetragen."));

        mockMvc.perform(post("/api/employees/1/stamps/clock"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("VIOLATION"));
    }

    @Test
    void addManualStamp_passesDateAndTime() throws Exception {
        when(timeStampService.addManualStamp(employee, "11.03.2025", "09:00"))
                .thenReturn(stamp(6L, TODAY.minusDays(1), "09:00"));

        mockMvc.perform(post("/api/employees/1/stamps")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new StampRequest("11.03.2025", "09:00"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.date").value("2025-03-11"));
    }

    @Test
    void editStamp_returns200() throws Exception {
        when(timeStampService.editStamp(employee, 6L, "17:00")).thenReturn(stamp(6L, TODAY.minusDays(1), "17:00"));

        mockMvc.perform(put("/api/employees/1/stamps/6")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new StampEditRequest("17:00"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.time").value("17:00:00"));
    }

    @Test
    void deleteStamp_returns404_whenStampUnknown() throws Exception {
        doThrow(new ResourceNotFoundException("Stempel nicht gefunden: 8"))
                .when(timeStampService).deleteStamp(employee, 8L);

        mockMvc.perform(delete("/api/employees/1/stamps/8"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("NOT_FOUND"));
    }

    @Test
    void getStamps_defaultsToToday() throws Exception {
        when(timeStampService.stampsOn(eq(employee), eq(TODAY))).thenReturn(List.of(stamp(5L, TODAY, "08:00")));

        mockMvc.perform(get("/api/employees/1/stamps"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].time").value("08:00:00"));
        verify(timeStampService).stampsOn(employee, TODAY);
    }
}
