package de.zeiterfassung.api_gleitzeit.repository.absence;

import de.zeiterfassung.api_gleitzeit.entity.absence.Absence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface AbsenceRepository extends JpaRepository<Absence, Long> {

    boolean existsByEmployeeIdAndAbsenceDate(Long employeeId, LocalDate absenceDate);

    Optional<Absence> findByEmployeeIdAndAbsenceDate(Long employeeId, LocalDate absenceDate);

    List<Absence> findByEmployeeIdOrderByAbsenceDateAsc(Long employeeId);
}
