package de.zeiterfassung.api_gleitzeit.service.common;

import de.zeiterfassung.api_gleitzeit.dto.common.OperationResult;
import de.zeiterfassung.api_gleitzeit.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Führt eine schreibende Operation in genau einer Transaktion aus und
 * übersetzt den Ausgang in ein {@link OperationResult}. Jede Exception
 * rollt die gesamte Transaktion zurück.
 */
@Slf4j
@Component
public class OperationRunner {

    static final String PERSISTENCE_FAILURE = "Die Änderung konnte nicht gespeichert werden.";
    static final String INTERNAL_FAILURE = "Bei der Verarbeitung ist ein interner Fehler aufgetreten.";

    private final TransactionTemplate transactionTemplate;

    public OperationRunner(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> OperationResult<T> run(String operation, Supplier<T> work) {
        try {
            T result = transactionTemplate.execute(status -> work.get());
            return OperationResult.success(result);
        } catch (IllegalArgumentException e) {
            log.warn("{} abgelehnt: {}", operation, e.getMessage());
            return OperationResult.violation(e.getMessage());
        } catch (ResourceNotFoundException e) {
            log.warn("{}: {}", operation, e.getMessage());
            return OperationResult.notFound(e.getMessage());
        } catch (DataAccessException e) {
            log.error("{} fehlgeschlagen, Transaktion zurückgerollt: {}", operation, e.getMessage(), e);
            return OperationResult.failure(PERSISTENCE_FAILURE);
        } catch (RuntimeException e) {
            log.error("{} fehlgeschlagen: {}", operation, e.getMessage(), e);
            return OperationResult.failure(INTERNAL_FAILURE);
        }
    }

    public OperationResult<Void> runVoid(String operation, Runnable work) {
        return run(operation, () -> {
            work.run();
            return null;
        });
    }
}
