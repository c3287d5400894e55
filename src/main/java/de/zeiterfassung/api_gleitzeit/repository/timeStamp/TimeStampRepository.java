package de.zeiterfassung.api_gleitzeit.repository.timeStamp;

import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface TimeStampRepository extends JpaRepository<TimeStamp, Long> {

    Optional<TimeStamp> findByIdAndEmployeeId(Long id, Long employeeId);

    List<TimeStamp> findByEmployeeIdAndSettledFalseOrderByStampDateAscStampTimeAsc(Long employeeId);

    List<TimeStamp> findByEmployeeIdAndStampDateOrderByStampTimeAsc(Long employeeId, LocalDate stampDate);

    List<TimeStamp> findByEmployeeIdAndStampDateAndSettledTrueOrderByStampTimeAsc(Long employeeId, LocalDate stampDate);

    List<TimeStamp> findByEmployeeIdAndStampDateBetweenOrderByStampDateAscStampTimeAsc(
            Long employeeId, LocalDate from, LocalDate to);

    boolean existsByEmployeeIdAndStampDate(Long employeeId, LocalDate stampDate);

    boolean existsByEmployeeIdAndStampDateAndSettledTrue(Long employeeId, LocalDate stampDate);

    boolean existsByEmployeeIdAndStampDateAndStampTime(Long employeeId, LocalDate stampDate, LocalTime stampTime);

    long countByEmployeeIdAndStampDate(Long employeeId, LocalDate stampDate);

    // Letzter Stempel vor einem Datum (für die Ruhezeitprüfung vor dem Einstempeln)
    Optional<TimeStamp> findFirstByEmployeeIdAndStampDateBeforeOrderByStampDateDescStampTimeDesc(
            Long employeeId, LocalDate stampDate);

    @Query("SELECT DISTINCT t.stampDate FROM TimeStamp t " +
            "WHERE t.employee.id = :employeeId AND t.stampDate <= :until " +
            "ORDER BY t.stampDate")
    List<LocalDate> findDistinctStampDatesUntil(@Param("employeeId") Long employeeId,
                                                @Param("until") LocalDate until);

    @Query("SELECT DISTINCT t.stampDate FROM TimeStamp t " +
            "WHERE t.employee.id = :employeeId AND t.stampDate BETWEEN :from AND :to " +
            "ORDER BY t.stampDate")
    List<LocalDate> findDistinctStampDatesBetween(@Param("employeeId") Long employeeId,
                                                  @Param("from") LocalDate from,
                                                  @Param("to") LocalDate to);
}
