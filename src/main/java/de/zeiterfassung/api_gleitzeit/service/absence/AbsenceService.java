package de.zeiterfassung.api_gleitzeit.service.absence;

import de.zeiterfassung.api_gleitzeit.entity.absence.Absence;
import de.zeiterfassung.api_gleitzeit.entity.absence.AbsenceType;
import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.repository.absence.AbsenceRepository;
import de.zeiterfassung.api_gleitzeit.repository.timeStamp.TimeStampRepository;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import de.zeiterfassung.api_gleitzeit.service.ledger.FlexTimeLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AbsenceService {

    private final AbsenceRepository absenceRepository;
    private final TimeStampRepository timeStampRepository;
    private final FlexTimeLedgerService ledgerService;
    private final TimeService timeService;

    /**
     * Trägt Urlaub oder Krankheit ein. Wurde für den Tag bereits die Sollzeit
     * als Fehltag abgezogen, wird sie zurückgebucht.
     */
    @Transactional
    public Absence registerAbsence(Employee employee, String date, AbsenceType type) {
        if (type == null || !type.isSelfService()) {
            throw new IllegalArgumentException("Es können nur Urlaub und Krankheit eingetragen werden.");
        }
        LocalDate absenceDate = timeService.parseDate(date);
        if (timeStampRepository.existsByEmployeeIdAndStampDate(employee.getId(), absenceDate)) {
            throw new IllegalArgumentException("Am " + timeService.formatDate(absenceDate)
                    + " wurde bereits gestempelt.");
        }
        if (absenceRepository.existsByEmployeeIdAndAbsenceDate(employee.getId(), absenceDate)) {
            throw new IllegalArgumentException("Für den " + timeService.formatDate(absenceDate)
                    + " ist bereits eine Abwesenheit eingetragen.");
        }

        Absence absence = absenceRepository.save(Absence.builder()
                .employee(employee)
                .absenceDate(absenceDate)
                .type(type)
                .build());
        boolean credited = ledgerService.creditMissingDay(employee, absenceDate);
        log.info("{} am {} für Mitarbeiter {} eingetragen{}", type, absenceDate, employee.getId(),
                credited ? ", Fehltag-Abzug zurückgebucht" : "");
        return absence;
    }

    @Transactional(readOnly = true)
    public List<Absence> absences(Employee employee) {
        return absenceRepository.findByEmployeeIdOrderByAbsenceDateAsc(employee.getId());
    }
}
