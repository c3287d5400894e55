package de.zeiterfassung.api_gleitzeit.controller.common;

import de.zeiterfassung.api_gleitzeit.dto.common.OperationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** HTTP-Status zu einem {@link OperationResult}. */
public final class OperationResponses {

    private OperationResponses() {
    }

    public static <T> ResponseEntity<OperationResult<T>> ok(OperationResult<T> result) {
        return respond(result, HttpStatus.OK);
    }

    public static <T> ResponseEntity<OperationResult<T>> created(OperationResult<T> result) {
        return respond(result, HttpStatus.CREATED);
    }

    private static <T> ResponseEntity<OperationResult<T>> respond(OperationResult<T> result, HttpStatus onSuccess) {
        HttpStatus status = switch (result.status()) {
            case SUCCESS -> onSuccess;
            case VIOLATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(result);
    }
}
