package de.zeiterfassung.api_gleitzeit.dto.employee;

import com.fasterxml.jackson.annotation.JsonFormat;
import de.zeiterfassung.api_gleitzeit.service.employee.TrafficLight;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeView {
    private Long id;
    private String name;
    private Integer weeklyHours;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate birthDate;

    private Double flexBalance;
    private Double trafficLightGreen;
    private Double trafficLightRed;
    private TrafficLight trafficLight;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate lastLogin;

    private String supervisorName;
}
