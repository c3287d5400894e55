package de.zeiterfassung.api_gleitzeit.service.compliance;

import de.zeiterfassung.api_gleitzeit.entity.employee.Employee;
import de.zeiterfassung.api_gleitzeit.service.ledger.FlexTimeLedgerService;
import de.zeiterfassung.api_gleitzeit.service.ledger.Settlement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Vollständige Neubewertung nach Login oder Stempeländerung. Die Reihenfolge
 * ist fest: Fehltage vor der Verrechnung, damit ein Tag mit Code 1 nicht
 * zusätzlich gegen die Sollzeit gerechnet wird.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceCycleService {

    private final ComplianceMonitorService monitorService;
    private final ComplianceCorrectionService correctionService;
    private final FlexTimeLedgerService ledgerService;

    @Transactional
    public Settlement run(Employee employee) {
        monitorService.checkMissingWorkdays(employee);
        monitorService.checkOddStampCounts(employee);
        Settlement settlement = ledgerService.settle(employee);
        monitorService.checkLaborLaw(employee);
        int corrected = correctionService.correct(employee);
        log.info("Prüfung für Mitarbeiter {} abgeschlossen: Delta {}h, {} Meldungen behoben",
                employee.getId(), settlement.deltaHours(), corrected);
        return settlement;
    }
}
