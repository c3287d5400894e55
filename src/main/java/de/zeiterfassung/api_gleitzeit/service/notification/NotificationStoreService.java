package de.zeiterfassung.api_gleitzeit.service.notification;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.notification.Notification;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import de.zeiterfassung.api_gleitzeit.repository.notification.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Benachrichtigungen sind eindeutig je (Mitarbeiter, Code, Datum).
 * Ein erneutes Auslösen desselben Verstoßes am selben Tag ändert nichts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationStoreService {

    private final NotificationRepository notificationRepository;
    private final NotificationDispatchService dispatchService;

    /** @return true, wenn die Benachrichtigung neu angelegt wurde */
    @Transactional
    public boolean record(Employee employee, NotificationCode code, LocalDate date) {
        if (exists(employee, code, date)) {
            log.debug("Benachrichtigung {} für {} existiert bereits", code, date);
            return false;
        }
        Notification saved = notificationRepository.save(Notification.builder()
                .employee(employee)
                .code(code)
                .notificationDate(date)
                .popup(false)
                .build());
        log.info("Benachrichtigung {} für Mitarbeiter {} am {} angelegt", code, employee.getId(), date);
        dispatchService.dispatchAfterCommit(employee, saved);
        return true;
    }

    @Transactional
    public boolean recordPopup(Employee employee, NotificationCode code, LocalDate date, LocalTime popupTime) {
        if (exists(employee, code, date)) {
            return false;
        }
        notificationRepository.save(Notification.builder()
                .employee(employee)
                .code(code)
                .notificationDate(date)
                .popup(true)
                .popupTime(popupTime)
                .build());
        log.info("PopUp {} für Mitarbeiter {} um {} geplant", code, employee.getId(), popupTime);
        return true;
    }

    @Transactional(readOnly = true)
    public boolean exists(Employee employee, NotificationCode code, LocalDate date) {
        return notificationRepository.existsByEmployeeIdAndCodeAndNotificationDate(employee.getId(), code, date);
    }

    @Transactional(readOnly = true)
    public List<Notification> findByCode(Employee employee, NotificationCode code) {
        return notificationRepository.findByEmployeeIdAndCodeOrderByNotificationDateAsc(employee.getId(), code);
    }

    @Transactional(readOnly = true)
    public Optional<Notification> findForEmployee(Employee employee, Long notificationId) {
        return notificationRepository.findByIdAndEmployeeId(notificationId, employee.getId());
    }

    /** Alle Meldungen ohne PopUps, nach Datum sortiert. */
    @Transactional(readOnly = true)
    public List<Notification> messages(Employee employee) {
        return notificationRepository.findByEmployeeIdAndPopupFalseOrderByNotificationDateAscCodeAsc(employee.getId());
    }

    @Transactional(readOnly = true)
    public List<Notification> popupsOn(Employee employee, LocalDate date) {
        return notificationRepository.findByEmployeeIdAndPopupTrueAndNotificationDateOrderByPopupTimeAsc(
                employee.getId(), date);
    }

    /** @return true, wenn eine Benachrichtigung gelöscht wurde */
    @Transactional
    public boolean remove(Employee employee, NotificationCode code, LocalDate date) {
        Optional<Notification> existing = notificationRepository
                .findByEmployeeIdAndCodeAndNotificationDate(employee.getId(), code, date);
        existing.ifPresent(this::delete);
        return existing.isPresent();
    }

    // flush, damit ein Neuanlegen mit gleichem Schlüssel in derselben Transaktion möglich bleibt
    @Transactional
    public void delete(Notification notification) {
        notificationRepository.delete(notification);
        notificationRepository.flush();
        log.debug("Benachrichtigung {} am {} gelöscht", notification.getCode(), notification.getNotificationDate());
    }

    @Transactional
    public int deletePopupsOn(Employee employee, LocalDate date) {
        List<Notification> popups = popupsOn(employee, date);
        notificationRepository.deleteAll(popups);
        notificationRepository.flush();
        return popups.size();
    }
}
