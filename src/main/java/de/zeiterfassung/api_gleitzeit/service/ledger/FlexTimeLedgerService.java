package de.zeiterfassung.api_gleitzeit.service.ledger;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.notification.Notification;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import de.zeiterfassung.api_gleitzeit.repository.employee.EmployeeRepository;
import de.zeiterfassung.api_gleitzeit.repository.timeStamp.TimeStampRepository;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import de.zeiterfassung.api_gleitzeit.service.interval.DayAccumulatorService;
import de.zeiterfassung.api_gleitzeit.service.interval.DeductionMode;
import de.zeiterfassung.api_gleitzeit.service.interval.WorkedDays;
import de.zeiterfassung.api_gleitzeit.service.notification.NotificationStoreService;
import de.zeiterfassung.api_gleitzeit.service.quota.QuotaResolverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Führt das Gleitzeitkonto. Jeder Tag wird höchstens einmal gegen die
 * Sollzeit verrechnet, bis er mit {@link #revertDay} zurückgenommen wird.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlexTimeLedgerService {

    private final TimeStampRepository timeStampRepository;
    private final EmployeeRepository employeeRepository;
    private final DayAccumulatorService dayAccumulator;
    private final QuotaResolverService quotaResolver;
    private final NotificationStoreService notificationStore;
    private final TimeService timeService;

    /**
     * Verrechnet alle noch offenen Stempelpaare mit dem Gleitzeitkonto und
     * markiert die verbrauchten Stempel als verrechnet.
     */
    @Transactional
    public Settlement settle(Employee employee) {
        List<TimeStamp> unsettled = timeStampRepository
                .findByEmployeeIdAndSettledFalseOrderByStampDateAscStampTimeAsc(employee.getId());
        WorkedDays worked = dayAccumulator.accumulate(unsettled, employee.getBirthDate(),
                DeductionMode.BREAKS_AND_WORK_WINDOW);
        if (worked.consumed().isEmpty()) {
            return Settlement.nothing();
        }

        Duration total = Duration.ZERO;
        for (Map.Entry<LocalDate, Duration> day : worked.byDate().entrySet()) {
            total = total.plus(deltaFor(employee, day.getKey(), day.getValue()));
        }

        worked.consumed().forEach(stamp -> stamp.setSettled(true));
        timeStampRepository.saveAll(worked.consumed());

        double deltaHours = timeService.toHours(total);
        adjustBalance(employee, deltaHours);
        log.info("Gleitzeit für Mitarbeiter {} verrechnet: {} Tage, {} Stempel, Delta {}h, neuer Stand {}h",
                employee.getId(), worked.byDate().size(), worked.consumed().size(),
                deltaHours, employee.getFlexBalance());
        return new Settlement(deltaHours, new ArrayList<>(worked.byDate().keySet()), worked.consumed().size());
    }

    private Duration deltaFor(Employee employee, LocalDate date, Duration worked) {
        if (notificationStore.exists(employee, NotificationCode.MISSING_WORKDAY, date)) {
            // Sollzeit wurde bereits beim Fehltag abgezogen
            log.debug("{}: Fehltag-Abzug vorhanden, nur Arbeitszeit {} wird gutgeschrieben", date, worked);
            return worked;
        }
        if (timeStampRepository.existsByEmployeeIdAndStampDateAndSettledTrue(employee.getId(), date)) {
            log.debug("{}: Tag bereits verrechnet, zusätzliche Arbeitszeit {}", date, worked);
            return worked;
        }
        Duration target = quotaResolver.dailyTarget(employee, date);
        log.debug("{}: Arbeitszeit {} gegen Sollzeit {}", date, worked, target);
        return worked.minus(target);
    }

    /**
     * Nimmt die Verrechnung eines Tages vollständig zurück. Muss vor der
     * Änderung der Stempel aufgerufen werden.
     */
    @Transactional
    public double revertDay(Employee employee, LocalDate date) {
        List<TimeStamp> stamps = timeStampRepository.findByEmployeeIdAndStampDateOrderByStampTimeAsc(employee.getId(), date);
        List<TimeStamp> settled = stamps.stream().filter(TimeStamp::isSettled).toList();

        if (employee.getLastLogin() != null && date.isBefore(employee.getLastLogin())) {
            log.debug("Letzter Login von {} auf {} zurückgesetzt", employee.getLastLogin(), date);
            employee.setLastLogin(date);
        }

        Duration worked = dayAccumulator.accumulate(settled, employee.getBirthDate(),
                DeductionMode.BREAKS_AND_WORK_WINDOW).on(date);
        Duration target = quotaResolver.dailyTarget(employee, date);
        Optional<Notification> missingDay = notificationStore
                .findByCode(employee, NotificationCode.MISSING_WORKDAY).stream()
                .filter(n -> n.getNotificationDate().equals(date))
                .findFirst();

        double deltaHours = 0.0;
        if (missingDay.isPresent()) {
            deltaHours = timeService.toHours(target.minus(worked));
            notificationStore.delete(missingDay.get());
        } else if (!settled.isEmpty()) {
            deltaHours = -timeService.toHours(worked.minus(target));
        }

        notificationStore.remove(employee, NotificationCode.ODD_STAMP_COUNT, date);

        stamps.forEach(stamp -> stamp.setSettled(false));
        timeStampRepository.saveAll(stamps);
        adjustBalance(employee, deltaHours);

        log.info("Verrechnung vom {} für Mitarbeiter {} zurückgenommen, Korrektur {}h", date, employee.getId(), deltaHours);
        return deltaHours;
    }

    /**
     * Zieht für einen Werktag ohne Stempel die Sollzeit ab, höchstens einmal je Tag.
     *
     * @return true, wenn abgezogen wurde
     */
    @Transactional
    public boolean applyMissingDayPenalty(Employee employee, LocalDate date) {
        if (notificationStore.exists(employee, NotificationCode.MISSING_WORKDAY, date)) {
            return false;
        }
        Duration target = quotaResolver.dailyTarget(employee, date);
        adjustBalance(employee, -timeService.toHours(target));
        notificationStore.record(employee, NotificationCode.MISSING_WORKDAY, date);
        log.info("Fehltag {} für Mitarbeiter {}: {} von der Gleitzeit abgezogen", date, employee.getId(), target);
        return true;
    }

    /**
     * Gibt einen zuvor abgezogenen Fehltag zurück (z.B. nachträglich eingetragener Urlaub).
     *
     * @return true, wenn gutgeschrieben wurde
     */
    @Transactional
    public boolean creditMissingDay(Employee employee, LocalDate date) {
        Optional<Notification> missingDay = notificationStore
                .findByCode(employee, NotificationCode.MISSING_WORKDAY).stream()
                .filter(n -> n.getNotificationDate().equals(date))
                .findFirst();
        if (missingDay.isEmpty()) {
            return false;
        }
        Duration target = quotaResolver.dailyTarget(employee, date);
        adjustBalance(employee, timeService.toHours(target));
        notificationStore.delete(missingDay.get());
        log.info("Fehltag-Abzug vom {} für Mitarbeiter {} zurückgebucht ({})", date, employee.getId(), target);
        return true;
    }

    private void adjustBalance(Employee employee, double deltaHours) {
        employee.setFlexBalance(employee.currentFlexBalance() + deltaHours);
        employeeRepository.save(employee);
    }
}
