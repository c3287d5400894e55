package de.zeiterfassung.api_gleitzeit.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Ergebnis einer schreibenden Operation: Erfolg, fachliche Ablehnung,
 * nicht gefundene Ressource oder technischer Fehler.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult<T>(Status status, String message, T data) {

    public enum Status {
        SUCCESS,
        VIOLATION,
        NOT_FOUND,
        FAILURE
    }

    public static <T> OperationResult<T> success(T data) {
        return new OperationResult<>(Status.SUCCESS, null, data);
    }

    public static <T> OperationResult<T> success(T data, String message) {
        return new OperationResult<>(Status.SUCCESS, message, data);
    }

    public static <T> OperationResult<T> violation(String message) {
        return new OperationResult<>(Status.VIOLATION, message, null);
    }

    public static <T> OperationResult<T> notFound(String message) {
        return new OperationResult<>(Status.NOT_FOUND, message, null);
    }

    public static <T> OperationResult<T> failure(String message) {
        return new OperationResult<>(Status.FAILURE, message, null);
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }
}
