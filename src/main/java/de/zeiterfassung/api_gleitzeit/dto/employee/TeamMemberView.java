package de.zeiterfassung.api_gleitzeit.dto.employee;

import de.zeiterfassung.api_gleitzeit.service.employee.TrafficLight;

public record TeamMemberView(Long id, String name, double flexBalance, TrafficLight trafficLight) {
}
