package de.zeiterfassung.api_gleitzeit.dto.employee;

import de.zeiterfassung.api_gleitzeit.dto.flexTime.CumulativeFlexTime;
import de.zeiterfassung.api_gleitzeit.dto.notification.NotificationView;
import de.zeiterfassung.api_gleitzeit.dto.timeStamp.StampView;
import de.zeiterfassung.api_gleitzeit.service.employee.TrafficLight;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Startseite nach dem Login.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardDTO {
    private EmployeeView employee;
    private double flexBalance;
    private TrafficLight trafficLight;
    private List<NotificationView> messages;
    private CumulativeFlexTime cumulative;
    private List<StampView> todayStamps;
}
