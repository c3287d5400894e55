package de.zeiterfassung.api_gleitzeit.service.employee;

import de.zeiterfassung.api_gleitzeit.dto.employee.EmployeeView;
import de.zeiterfassung.api_gleitzeit.dto.employee.RegistrationRequest;
import de.zeiterfassung.api_gleitzeit.dto.employee.TeamMemberView;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.employee.WeeklyHoursHistory;
import de.zeiterfassung.api_gleitzeit.exception.ResourceNotFoundException;
import de.zeiterfassung.api_gleitzeit.repository.employee.EmployeeRepository;
import de.zeiterfassung.api_gleitzeit.repository.employee.WeeklyHoursHistoryRepository;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;

@Slf4j
@Service
public class EmployeeService {

    private final EmployeeRepository employeeRepository;
    private final WeeklyHoursHistoryRepository historyRepository;
    private final PasswordEncoder passwordEncoder;
    private final TimeService timeService;
    private final Clock clock;
    private final int minimumAge;
    private final double defaultGreen;
    private final double defaultRed;

    public EmployeeService(EmployeeRepository employeeRepository,
                           WeeklyHoursHistoryRepository historyRepository,
                           PasswordEncoder passwordEncoder,
                           TimeService timeService,
                           Clock clock,
                           @Value("${gleitzeit.registration.minimum-age:16}") int minimumAge,
                           @Value("${gleitzeit.traffic-light.default-green:0}") double defaultGreen,
                           @Value("${gleitzeit.traffic-light.default-red:-5}") double defaultRed) {
        this.employeeRepository = employeeRepository;
        this.historyRepository = historyRepository;
        this.passwordEncoder = passwordEncoder;
        this.timeService = timeService;
        this.clock = clock;
        this.minimumAge = minimumAge;
        this.defaultGreen = defaultGreen;
        this.defaultRed = defaultRed;
    }

    @Transactional(readOnly = true)
    public Employee getEmployee(Long id) {
        return employeeRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Mitarbeiter nicht gefunden: " + id));
    }

    @Transactional
    public Employee register(RegistrationRequest request) {
        LocalDate today = LocalDate.now(clock);
        String name = request.getName() == null ? "" : request.getName().trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Bitte geben Sie einen Namen ein.");
        }
        if (employeeRepository.existsByName(name)) {
            throw new IllegalArgumentException("Der Name " + name + " ist bereits vergeben.");
        }

        LocalDate birthDate = timeService.parseDate(request.getBirthDate());
        if (birthDate.isAfter(today)) {
            throw new IllegalArgumentException("Das Geburtsdatum darf nicht in der Zukunft liegen.");
        }
        if (Period.between(birthDate, today).getYears() < minimumAge) {
            throw new IllegalArgumentException("Mitarbeiter müssen mindestens " + minimumAge + " Jahre alt sein.");
        }

        validateWeeklyHours(request.getWeeklyHours());
        double green = request.getTrafficLightGreen() == null ? defaultGreen : request.getTrafficLightGreen();
        double red = request.getTrafficLightRed() == null ? defaultRed : request.getTrafficLightRed();
        validateTrafficLight(green, red);
        validatePassword(request.getPassword(), request.getPasswordRepeat());

        Employee supervisor = null;
        if (request.getSupervisorName() != null && !request.getSupervisorName().isBlank()) {
            supervisor = employeeRepository.findByName(request.getSupervisorName().trim())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Vorgesetzter nicht gefunden: " + request.getSupervisorName()));
        }

        Employee employee = new Employee();
        employee.setName(name);
        employee.setBirthDate(birthDate);
        employee.setWeeklyHours(request.getWeeklyHours());
        employee.setTrafficLightGreen(green);
        employee.setTrafficLightRed(red);
        employee.setPasswordHash(passwordEncoder.encode(request.getPassword()));
        employee.setFlexBalance(0.0);
        employee.setLastLogin(today);
        employee.setSupervisor(supervisor);
        Employee saved = employeeRepository.save(employee);

        historyRepository.save(WeeklyHoursHistory.builder()
                .employee(saved)
                .effectiveFrom(today)
                .weeklyHours(request.getWeeklyHours())
                .build());

        log.info("Mitarbeiter {} ({}) registriert, {} Wochenstunden", saved.getId(), name, saved.getWeeklyHours());
        return saved;
    }

    /** Mitarbeiter, deren Vorgesetzter {@code supervisorId} ist. */
    @Transactional(readOnly = true)
    public List<TeamMemberView> team(Long supervisorId) {
        getEmployee(supervisorId);
        return employeeRepository.findBySupervisorIdOrderByNameAsc(supervisorId).stream()
                .map(member -> new TeamMemberView(member.getId(), member.getName(),
                        timeService.round2(member.currentFlexBalance()), trafficLight(member)))
                .toList();
    }

    public TrafficLight trafficLight(Employee employee) {
        return TrafficLight.evaluate(employee.currentFlexBalance(),
                employee.getTrafficLightGreen() == null ? defaultGreen : employee.getTrafficLightGreen(),
                employee.getTrafficLightRed() == null ? defaultRed : employee.getTrafficLightRed());
    }

    public EmployeeView toView(Employee employee) {
        return EmployeeView.builder()
                .id(employee.getId())
                .name(employee.getName())
                .weeklyHours(employee.getWeeklyHours())
                .birthDate(employee.getBirthDate())
                .flexBalance(timeService.round2(employee.currentFlexBalance()))
                .trafficLightGreen(employee.getTrafficLightGreen())
                .trafficLightRed(employee.getTrafficLightRed())
                .trafficLight(trafficLight(employee))
                .lastLogin(employee.getLastLogin())
                .supervisorName(employee.getSupervisor() == null ? null : employee.getSupervisor().getName())
                .build();
    }

    static void validateWeeklyHours(Integer weeklyHours) {
        if (weeklyHours == null || weeklyHours <= 0) {
            throw new IllegalArgumentException("Die Wochenstunden müssen eine ganze Zahl größer 0 sein.");
        }
    }

    static void validateTrafficLight(double green, double red) {
        if (red >= green) {
            throw new IllegalArgumentException("Der Grenzwert für Rot muss kleiner als der für Grün sein.");
        }
    }

    static void validatePassword(String password, String repeat) {
        if (password == null || password.isBlank()) {
            throw new IllegalArgumentException("Bitte geben Sie ein Passwort ein.");
        }
        if (!password.equals(repeat)) {
            throw new IllegalArgumentException("Die Passwörter müssen übereinstimmen.");
        }
    }
}
