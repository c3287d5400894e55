package de.zeiterfassung.api_gleitzeit.service.employee;

import de.zeiterfassung.api_gleitzeit.dto.employee.RegistrationRequest;
import de.zeiterfassung.api_gleitzeit.dto.employee.TeamMemberView;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.exception.ResourceNotFoundException;
import de.zeiterfassung.api_gleitzeit.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmployeeServiceTest extends IntegrationTestSupport {

    @Autowired
    private EmployeeService employeeService;

    @Autowired
    private PasswordEncoder passwordEncoder;

    private RegistrationRequest request(String name) {
        return new RegistrationRequest(name, "17.05.1990", 40, null, null, "geheim", "geheim", null);
    }

    @Test
    void register_storesHashedPasswordAndHistory() {
        Employee employee = employeeService.register(request("Anna Berger"));

        assertThat(employee.getId()).isNotNull();
        assertThat(employee.getPasswordHash()).isNotEqualTo("geheim");
        assertThat(passwordEncoder.matches("geheim", employee.getPasswordHash())).isTrue();
        assertThat(employee.getLastLogin()).isEqualTo(TODAY);
        assertThat(employee.getFlexBalance()).isZero();
        assertThat(employee.getTrafficLightGreen()).isEqualTo(0.0);
        assertThat(employee.getTrafficLightRed()).isEqualTo(-5.0);
        assertThat(historyRepository.findByEmployeeIdOrderByEffectiveFromAsc(employee.getId()))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getEffectiveFrom()).isEqualTo(TODAY);
                    assertThat(entry.getWeeklyHours()).isEqualTo(40);
                });
    }

    @Test
    void register_rejectsDuplicateName() {
        employeeService.register(request("Anna Berger"));

        assertThatThrownBy(() -> employeeService.register(request(" Anna Berger ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Der Name Anna Berger ist bereits vergeben.");
    }

    @Test
    void register_rejectsTooYoungAndFutureBirthDates() {
        RegistrationRequest tooYoung = request("Ben");
        tooYoung.setBirthDate("2010-01-01");
        RegistrationRequest unborn = request("Clara");
        unborn.setBirthDate("2026-01-01");

        assertThatThrownBy(() -> employeeService.register(tooYoung))
                .hasMessage("Mitarbeiter müssen mindestens 16 Jahre alt sein.");
        assertThatThrownBy(() -> employeeService.register(unborn))
                .hasMessage("Das Geburtsdatum darf nicht in der Zukunft liegen.");
    }

    @Test
    void register_validatesHoursTrafficLightAndPassword() {
        RegistrationRequest noHours = request("Dora");
        noHours.setWeeklyHours(0);
        RegistrationRequest badLight = request("Emil");
        badLight.setTrafficLightGreen(-2.0);
        badLight.setTrafficLightRed(3.0);
        RegistrationRequest mismatch = request("Frida");
        mismatch.setPasswordRepeat("anders");

        assertThatThrownBy(() -> employeeService.register(noHours)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> employeeService.register(badLight))
                .hasMessage("Der Grenzwert für Rot muss kleiner als der für Grün sein.");
        assertThatThrownBy(() -> employeeService.register(mismatch))
                .hasMessage("Die Passwörter müssen übereinstimmen.");
    }

    @Test
    void team_listsEmployeesOfSupervisor() {
        Employee boss = employeeService.register(request("Chefin"));
        RegistrationRequest member = request("Zoe");
        member.setSupervisorName("Chefin");
        employeeService.register(member);
        RegistrationRequest other = request("Max");
        other.setSupervisorName("Chefin");
        Employee max = employeeService.register(other);
        max.setFlexBalance(-6.0);

        List<TeamMemberView> team = employeeService.team(boss.getId());

        assertThat(team).extracting(TeamMemberView::name).containsExactly("Max", "Zoe");
        assertThat(team.get(0).trafficLight()).isEqualTo(TrafficLight.RED);
        assertThat(team.get(1).trafficLight()).isEqualTo(TrafficLight.GREEN);
    }

    @Test
    void register_rejectsUnknownSupervisor() {
        RegistrationRequest request = request("Greta");
        request.setSupervisorName("Niemand");

        assertThatThrownBy(() -> employeeService.register(request))
                .hasMessage("Vorgesetzter nicht gefunden: Niemand");
    }

    @Test
    void getEmployee_unknownId() {
        assertThatThrownBy(() -> employeeService.getEmployee(424242L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void trafficLight_usesEmployeeThresholds() {
        Employee employee = adult(TODAY);
        employee.setFlexBalance(-1.0);
        assertThat(employeeService.trafficLight(employee)).isEqualTo(TrafficLight.YELLOW);

        employee.setTrafficLightGreen(-2.0);
        assertThat(employeeService.trafficLight(employee)).isEqualTo(TrafficLight.GREEN);
        assertThat(employeeService.toView(employee).getBirthDate()).isEqualTo(LocalDate.of(1990, 5, 17));
    }
}
