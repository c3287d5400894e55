package de.zeiterfassung.api_gleitzeit.service.timeStamp;

import de.zeiterfassung.api_gleitzeit.entity.absence.Absence;
import de.zeiterfassung.api_gleitzeit.entity.absence.AbsenceType;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;
import de.zeiterfassung.api_gleitzeit.exception.ResourceNotFoundException;
import de.zeiterfassung.api_gleitzeit.repository.absence.AbsenceRepository;
import de.zeiterfassung.api_gleitzeit.repository.timeStamp.TimeStampRepository;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import de.zeiterfassung.api_gleitzeit.service.compliance.ComplianceCycleService;
import de.zeiterfassung.api_gleitzeit.service.compliance.PopupWarningService;
import de.zeiterfassung.api_gleitzeit.service.ledger.FlexTimeLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Stempeln, Nachtragen, Bearbeiten und Löschen von Zeitstempeln.
 *
 * Jede Änderung an einem vergangenen Tag nimmt zuerst dessen Verrechnung
 * zurück und lässt danach die komplette Prüfung erneut laufen.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeStampService {

    private final TimeStampRepository timeStampRepository;
    private final AbsenceRepository absenceRepository;
    private final FlexTimeLedgerService ledgerService;
    private final ComplianceCycleService cycleService;
    private final PopupWarningService popupWarningService;
    private final TimeService timeService;
    private final Clock clock;

    @Transactional
    public TimeStamp clock(Employee employee, boolean confirmAbsenceRemoval) {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        LocalDate today = now.toLocalDate();

        Optional<Absence> absence = absenceRepository.findByEmployeeIdAndAbsenceDate(employee.getId(), today);
        if (absence.isPresent()) {
            if (!confirmAbsenceRemoval) {
                throw new IllegalArgumentException("Für heute ist eine Abwesenheit eingetragen. "
                        + "Bitte bestätigen Sie, dass der Urlaub gelöscht werden soll.");
            }
            if (absence.get().getType() != AbsenceType.VACATION) {
                throw new IllegalArgumentException("Für heute ist eine Abwesenheit ("
                        + absence.get().getType() + ") eingetragen, Stempeln ist nicht möglich.");
            }
            absenceRepository.delete(absence.get());
            absenceRepository.flush();
            log.info("Urlaub am {} für Mitarbeiter {} wegen Stempelung gelöscht", today, employee.getId());
        }

        rejectDuplicate(employee, today, now.toLocalTime());
        TimeStamp stamp = timeStampRepository.save(TimeStamp.builder()
                .employee(employee)
                .stampDate(today)
                .stampTime(now.toLocalTime())
                .build());
        log.info("Mitarbeiter {} gestempelt: {} {}", employee.getId(), today, stamp.getStampTime());

        ledgerService.settle(employee);
        popupWarningService.refresh(employee);
        return stamp;
    }

    @Transactional
    public TimeStamp addManualStamp(Employee employee, String date, String time) {
        LocalDate stampDate = timeService.parseDate(date);
        LocalTime stampTime = timeService.parse(time);
        rejectFuture(stampDate, stampTime);
        if (absenceRepository.existsByEmployeeIdAndAbsenceDate(employee.getId(), stampDate)) {
            throw new IllegalArgumentException("Am " + timeService.formatDate(stampDate)
                    + " ist eine Abwesenheit eingetragen, es kann kein Stempel nachgetragen werden.");
        }
        rejectDuplicate(employee, stampDate, stampTime);

        ledgerService.revertDay(employee, stampDate);
        TimeStamp stamp = timeStampRepository.save(TimeStamp.builder()
                .employee(employee)
                .stampDate(stampDate)
                .stampTime(stampTime)
                .build());
        log.info("Stempel {} {} für Mitarbeiter {} nachgetragen", stampDate, stampTime, employee.getId());

        afterChange(employee, stampDate);
        return stamp;
    }

    @Transactional
    public TimeStamp editStamp(Employee employee, Long stampId, String time) {
        TimeStamp stamp = findStamp(employee, stampId);
        LocalTime newTime = timeService.parse(time);
        if (newTime.equals(stamp.getStampTime())) {
            return stamp;
        }
        rejectFuture(stamp.getStampDate(), newTime);
        rejectDuplicate(employee, stamp.getStampDate(), newTime);

        ledgerService.revertDay(employee, stamp.getStampDate());
        LocalTime oldTime = stamp.getStampTime();
        stamp.setStampTime(newTime);
        TimeStamp saved = timeStampRepository.save(stamp);
        log.info("Stempel {} vom {} für Mitarbeiter {}: {} -> {}",
                stampId, stamp.getStampDate(), employee.getId(), oldTime, newTime);

        afterChange(employee, stamp.getStampDate());
        return saved;
    }

    @Transactional
    public void deleteStamp(Employee employee, Long stampId) {
        TimeStamp stamp = findStamp(employee, stampId);
        LocalDate date = stamp.getStampDate();

        ledgerService.revertDay(employee, date);
        timeStampRepository.delete(stamp);
        timeStampRepository.flush();
        log.info("Stempel {} vom {} {} für Mitarbeiter {} gelöscht", stampId, date, stamp.getStampTime(), employee.getId());

        afterChange(employee, date);
    }

    @Transactional(readOnly = true)
    public List<TimeStamp> stampsOn(Employee employee, LocalDate date) {
        return timeStampRepository.findByEmployeeIdAndStampDateOrderByStampTimeAsc(employee.getId(), date);
    }

    private void afterChange(Employee employee, LocalDate date) {
        cycleService.run(employee);
        if (date.equals(LocalDate.now(clock))) {
            popupWarningService.refresh(employee);
        }
    }

    private TimeStamp findStamp(Employee employee, Long stampId) {
        return timeStampRepository.findByIdAndEmployeeId(stampId, employee.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Stempel nicht gefunden: " + stampId));
    }

    private void rejectFuture(LocalDate date, LocalTime time) {
        if (date.atTime(time).isAfter(LocalDateTime.now(clock))) {
            throw new IllegalArgumentException("Stempel in der Zukunft sind nicht erlaubt.");
        }
    }

    private void rejectDuplicate(Employee employee, LocalDate date, LocalTime time) {
        if (timeStampRepository.existsByEmployeeIdAndStampDateAndStampTime(employee.getId(), date, time)) {
            throw new IllegalArgumentException("Am " + timeService.formatDate(date) + " um "
                    + timeService.format(time) + " existiert bereits ein Stempel.");
        }
    }
}
