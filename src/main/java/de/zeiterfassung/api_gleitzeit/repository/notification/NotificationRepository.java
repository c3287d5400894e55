package de.zeiterfassung.api_gleitzeit.repository.notification;

import de.zeiterfassung.api_gleitzeit.entity.notification.Notification;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    boolean existsByEmployeeIdAndCodeAndNotificationDate(Long employeeId, NotificationCode code, LocalDate date);

    Optional<Notification> findByEmployeeIdAndCodeAndNotificationDate(Long employeeId, NotificationCode code,
                                                                      LocalDate date);

    Optional<Notification> findByIdAndEmployeeId(Long id, Long employeeId);

    List<Notification> findByEmployeeIdAndCodeOrderByNotificationDateAsc(Long employeeId, NotificationCode code);

    List<Notification> findByEmployeeIdAndPopupFalseOrderByNotificationDateAscCodeAsc(Long employeeId);

    List<Notification> findByEmployeeIdAndPopupTrueAndNotificationDateOrderByPopupTimeAsc(Long employeeId,
                                                                                       LocalDate date);

    long countByEmployeeIdAndCodeAndNotificationDate(Long employeeId, NotificationCode code, LocalDate date);
}
