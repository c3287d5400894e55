package de.zeiterfassung.api_gleitzeit.service.compliance;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.notification.Notification;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import de.zeiterfassung.api_gleitzeit.exception.ResourceNotFoundException;
import de.zeiterfassung.api_gleitzeit.repository.timeStamp.TimeStampRepository;
import de.zeiterfassung.api_gleitzeit.service.common.LaborLaw;
import de.zeiterfassung.api_gleitzeit.service.interval.DayAccumulatorService;
import de.zeiterfassung.api_gleitzeit.service.interval.DeductionMode;
import de.zeiterfassung.api_gleitzeit.service.notification.NotificationStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * PopUp-Warnungen des laufenden Tages (Codes 9 und 10). Die Zeilen werden
 * beim Einstempeln angelegt und vom Client zur hinterlegten Uhrzeit angezeigt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PopupWarningService {

    private final TimeStampRepository timeStampRepository;
    private final DayAccumulatorService dayAccumulator;
    private final NotificationStoreService notificationStore;
    private final Clock clock;

    /** Löscht die heutigen PopUps und legt sie neu an, solange eingestempelt ist. */
    @Transactional
    public void refresh(Employee employee) {
        LocalDate today = LocalDate.now(clock);
        int removed = notificationStore.deletePopupsOn(employee, today);
        long stampsToday = timeStampRepository.countByEmployeeIdAndStampDate(employee.getId(), today);
        log.debug("PopUps für Mitarbeiter {}: {} gelöscht, {} Stempel heute", employee.getId(), removed, stampsToday);
        if (stampsToday % 2 != 0) {
            createPopups(employee);
        }
    }

    @Transactional
    public void createPopups(Employee employee) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        boolean minor = employee.isMinorOn(today);

        LocalTime windowWarning = LaborLaw.workWindowEnd(minor).minus(LaborLaw.POPUP_LEAD_TIME);
        if (windowWarning.isAfter(now.toLocalTime())) {
            notificationStore.recordPopup(employee, NotificationCode.WORK_WINDOW_ENDING, today, windowWarning);
        }

        List<TimeStamp> stamps = timeStampRepository.findByEmployeeIdAndStampDateOrderByStampTimeAsc(employee.getId(), today);
        if (stamps.isEmpty()) {
            return;
        }
        // Bruttozeit der abgeschlossenen Paare, ohne Pausenabzug
        Duration worked = dayAccumulator.accumulate(stamps, employee.getBirthDate(), DeductionMode.RAW).on(today);
        Duration remaining = LaborLaw.grossDailyMaximum(minor).minus(LaborLaw.POPUP_LEAD_TIME).minus(worked);
        if (remaining.isNegative() || remaining.isZero()) {
            log.debug("Keine Höchstarbeitszeit-Warnung: bereits {} gearbeitet", worked);
            return;
        }
        LocalDateTime warning = stamps.get(stamps.size() - 1).toDateTime().plus(remaining);
        if (warning.toLocalDate().equals(today) && warning.isAfter(now)) {
            notificationStore.recordPopup(employee, NotificationCode.MAX_HOURS_APPROACHING, today, warning.toLocalTime());
        }
    }

    /** Heutige PopUps, deren Uhrzeit noch nicht erreicht ist. */
    @Transactional(readOnly = true)
    public List<Notification> pendingPopups(Employee employee) {
        LocalDateTime now = LocalDateTime.now(clock);
        return notificationStore.popupsOn(employee, now.toLocalDate()).stream()
                .filter(popup -> popup.getPopupTime() != null && popup.getPopupTime().isAfter(now.toLocalTime()))
                .toList();
    }

    /** Entfernt ein angezeigtes PopUp. */
    @Transactional
    public void acknowledge(Employee employee, Long notificationId) {
        Notification popup = notificationStore.findForEmployee(employee, notificationId)
                .orElseThrow(() -> new ResourceNotFoundException("Benachrichtigung nicht gefunden: " + notificationId));
        if (!popup.isPopup()) {
            throw new IllegalArgumentException("Nur PopUp-Benachrichtigungen können bestätigt werden.");
        }
        notificationStore.delete(popup);
        log.info("PopUp {} von Mitarbeiter {} bestätigt", popup.getCode(), employee.getId());
    }
}
