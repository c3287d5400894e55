package de.zeiterfassung.api_gleitzeit.service.employee;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.employee.WeeklyHoursHistory;
import de.zeiterfassung.api_gleitzeit.repository.employee.EmployeeRepository;
import de.zeiterfassung.api_gleitzeit.repository.employee.WeeklyHoursHistoryRepository;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Persönliche Einstellungen: Wochenstunden, Ampelgrenzen und Passwort.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService {

    private final EmployeeRepository employeeRepository;
    private final WeeklyHoursHistoryRepository historyRepository;
    private final PasswordEncoder passwordEncoder;
    private final TimeService timeService;
    private final Clock clock;

    /**
     * Legt den Historieneintrag für das Gültig-ab-Datum an oder überschreibt ihn
     * und setzt die aktuellen Vertragsstunden.
     */
    @Transactional
    public Employee updateWeeklyHours(Employee employee, Integer weeklyHours, String effectiveFrom) {
        EmployeeService.validateWeeklyHours(weeklyHours);
        LocalDate from = effectiveFrom == null || effectiveFrom.isBlank()
                ? LocalDate.now(clock)
                : timeService.parseDate(effectiveFrom);

        WeeklyHoursHistory entry = historyRepository.findByEmployeeIdAndEffectiveFrom(employee.getId(), from)
                .orElseGet(() -> WeeklyHoursHistory.builder().employee(employee).effectiveFrom(from).build());
        entry.setWeeklyHours(weeklyHours);
        historyRepository.save(entry);

        employee.setWeeklyHours(weeklyHours);
        log.info("Wochenstunden von Mitarbeiter {} ab {} auf {} gesetzt", employee.getId(), from, weeklyHours);
        return employeeRepository.save(employee);
    }

    @Transactional
    public Employee updateTrafficLight(Employee employee, Double green, Double red) {
        if (green == null || red == null) {
            throw new IllegalArgumentException("Bitte geben Sie beide Grenzwerte ein.");
        }
        EmployeeService.validateTrafficLight(green, red);
        employee.setTrafficLightGreen(green);
        employee.setTrafficLightRed(red);
        log.info("Ampelgrenzen von Mitarbeiter {}: grün ab {}, rot bis {}", employee.getId(), green, red);
        return employeeRepository.save(employee);
    }

    @Transactional
    public void changePassword(Employee employee, String newPassword, String repeat) {
        EmployeeService.validatePassword(newPassword, repeat);
        employee.setPasswordHash(passwordEncoder.encode(newPassword));
        employeeRepository.save(employee);
        log.info("Passwort von Mitarbeiter {} geändert", employee.getId());
    }
}
