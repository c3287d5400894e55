package de.zeiterfassung.api_gleitzeit.service.compliance;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.notification.Notification;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import de.zeiterfassung.api_gleitzeit.repository.timeStamp.TimeStampRepository;
import de.zeiterfassung.api_gleitzeit.service.common.LaborLaw;
import de.zeiterfassung.api_gleitzeit.service.notification.NotificationStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Löscht Arbeitszeitschutz-Meldungen (Codes 3 bis 8), deren Verstoß nach
 * einer Korrektur der Stempel nicht mehr besteht.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceCorrectionService {

    private static final Set<NotificationCode> CORRECTABLE = EnumSet.of(
            NotificationCode.REST_PERIOD,
            NotificationCode.SIX_MONTH_AVERAGE,
            NotificationCode.DAILY_MAXIMUM,
            NotificationCode.SUNDAY_OR_HOLIDAY,
            NotificationCode.MINOR_WEEKLY_HOURS,
            NotificationCode.MINOR_WORKDAYS);

    private final NotificationStoreService notificationStore;
    private final TimeStampRepository timeStampRepository;
    private final WorkloadService workloadService;
    private final Clock clock;

    /** @return Anzahl gelöschter Meldungen */
    @Transactional
    public int correct(Employee employee) {
        int deleted = 0;
        for (Notification notification : notificationStore.messages(employee)) {
            if (!CORRECTABLE.contains(notification.getCode())) {
                continue;
            }
            if (isResolved(employee, notification.getCode(), notification.getNotificationDate())) {
                log.info("Meldung {} vom {} für Mitarbeiter {} ist behoben und wird gelöscht",
                        notification.getCode(), notification.getNotificationDate(), employee.getId());
                notificationStore.delete(notification);
                deleted++;
            }
        }
        return deleted;
    }

    boolean isResolved(Employee employee, NotificationCode code, LocalDate date) {
        return switch (code) {
            case REST_PERIOD -> restPeriodResolved(employee, date);
            case SIX_MONTH_AVERAGE -> averageResolved(employee);
            case DAILY_MAXIMUM -> !hasStamps(employee, date)
                    || workloadService.workedOn(employee, date).compareTo(LaborLaw.dailyMaximum(employee.isMinorOn(date))) <= 0;
            case SUNDAY_OR_HOLIDAY -> !hasStamps(employee, date);
            case MINOR_WEEKLY_HOURS -> !employee.isMinorOn(date)
                    || workloadService.weekTotal(employee, date).compareTo(LaborLaw.MINOR_WEEKLY_MAXIMUM) <= 0;
            case MINOR_WORKDAYS -> !employee.isMinorOn(date)
                    || workloadService.workdaysInWeek(employee, date) <= LaborLaw.MINOR_MAX_WORKDAYS_PER_WEEK;
            default -> false;
        };
    }

    private boolean restPeriodResolved(Employee employee, LocalDate date) {
        LocalDate dayBefore = date.minusDays(1);
        Optional<Duration> rest = workloadService.restBetween(employee, dayBefore, date);
        return rest.isEmpty() || rest.get().compareTo(LaborLaw.restPeriod(employee.isMinorOn(dayBefore))) >= 0;
    }

    private boolean averageResolved(Employee employee) {
        LocalDate until = LocalDate.now(clock).minusDays(1);
        return workloadService.averagePerWorkday(employee, until.minusWeeks(LaborLaw.AVERAGE_WINDOW_WEEKS), until)
                .map(average -> average.compareTo(LaborLaw.AVERAGE_DAILY_LIMIT) <= 0)
                .orElse(true);
    }

    private boolean hasStamps(Employee employee, LocalDate date) {
        return timeStampRepository.existsByEmployeeIdAndStampDate(employee.getId(), date);
    }
}
