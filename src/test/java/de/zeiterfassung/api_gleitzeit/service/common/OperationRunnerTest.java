package de.zeiterfassung.api_gleitzeit.service.common;

import de.zeiterfassung.api_gleitzeit.dto.common.OperationResult;
import de.zeiterfassung.api_gleitzeit.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OperationRunnerTest {

    private PlatformTransactionManager transactionManager;
    private TransactionStatus transactionStatus;
    private OperationRunner runner;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        transactionStatus = mock(TransactionStatus.class);
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        runner = new OperationRunner(transactionManager);
    }

    @Test
    void success_commitsAndReturnsPayload() {
        OperationResult<String> result = runner.run("Test", () -> "ok");

        assertThat(result.status()).isEqualTo(OperationResult.Status.SUCCESS);
        assertThat(result.data()).isEqualTo("ok");
        verify(transactionManager).commit(transactionStatus);
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void illegalArgument_becomesViolationAndRollsBack() {
        OperationResult<String> result = runner.run("Test", () -> {
            throw new IllegalArgumentException("Stempel in der Zukunft sind nicht erlaubt.");
        });

        assertThat(result.status()).isEqualTo(OperationResult.Status.VIOLATION);
        assertThat(result.message()).isEqualTo("Stempel in der Zukunft sind nicht erlaubt.");
        assertThat(result.succeeded()).isFalse();
        verify(transactionManager).rollback(transactionStatus);
    }

    @Test
    void missingResource_becomesNotFound() {
        OperationResult<Void> result = runner.runVoid("Test", () -> {
            throw new ResourceNotFoundException("Stempel nicht gefunden: 9");
        });

        assertThat(result.status()).isEqualTo(OperationResult.Status.NOT_FOUND);
        assertThat(result.message()).isEqualTo("Stempel nicht gefunden: 9");
    }

    @Test
    void dataAccessError_becomesGenericFailure() {
        OperationResult<String> result = runner.run("Test", () -> {
            throw new DataIntegrityViolationException("uq_notification_employee_code_date");
        });

        assertThat(result.status()).isEqualTo(OperationResult.Status.FAILURE);
        assertThat(result.message()).isEqualTo(OperationRunner.PERSISTENCE_FAILURE);
        verify(transactionManager).rollback(transactionStatus);
    }

    @Test
    void unexpectedError_becomesInternalFailure() {
        OperationResult<String> result = runner.run("Test", () -> {
            throw new IllegalStateException("kaputt");
        });

        assertThat(result.status()).isEqualTo(OperationResult.Status.FAILURE);
        assertThat(result.message()).isEqualTo(OperationRunner.INTERNAL_FAILURE);
    }
}
