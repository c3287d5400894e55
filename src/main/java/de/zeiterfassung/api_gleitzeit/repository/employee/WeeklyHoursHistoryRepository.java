package de.zeiterfassung.api_gleitzeit.repository.employee;

import de.zeiterfassung.api_gleitzeit.entity.employee.WeeklyHoursHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface WeeklyHoursHistoryRepository extends JpaRepository<WeeklyHoursHistory, Long> {

    // Letzter Eintrag, der am Datum bereits gültig ist
    Optional<WeeklyHoursHistory> findFirstByEmployeeIdAndEffectiveFromLessThanEqualOrderByEffectiveFromDesc(
            Long employeeId, LocalDate date);

    Optional<WeeklyHoursHistory> findByEmployeeIdAndEffectiveFrom(Long employeeId, LocalDate effectiveFrom);

    List<WeeklyHoursHistory> findByEmployeeIdOrderByEffectiveFromAsc(Long employeeId);
}
