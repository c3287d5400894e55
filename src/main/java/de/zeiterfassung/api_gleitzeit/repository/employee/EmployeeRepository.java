package de.zeiterfassung.api_gleitzeit.repository.employee;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, Long> {

    Optional<Employee> findByName(String name);

    boolean existsByName(String name);

    List<Employee> findBySupervisorIdOrderByNameAsc(Long supervisorId);
}
