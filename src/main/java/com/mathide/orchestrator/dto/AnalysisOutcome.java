package com.mathide.orchestrator.dto;

/**
 * Result of a side operation (check, progress, branching, verification) that either
 * yields a typed value or explains why it could not.
 */
public class AnalysisOutcome<T> {

    public enum Status {
        OK,
        MALFORMED_RESPONSE,
        NOT_ALLOWED
    }

    private final Status status;
    private final T      result;
    private final String message;

    private AnalysisOutcome(Status status, T result, String message) {
        this.status  = status;
        this.result  = result;
        this.message = message;
    }

    public static <T> AnalysisOutcome<T> ok(T result) {
        return new AnalysisOutcome<>(Status.OK, result, null);
    }

    public static <T> AnalysisOutcome<T> malformed(String message) {
        return new AnalysisOutcome<>(Status.MALFORMED_RESPONSE, null, message);
    }

    public static <T> AnalysisOutcome<T> notAllowed(String message) {
        return new AnalysisOutcome<>(Status.NOT_ALLOWED, null, message);
    }

    public Status getStatus() { return status; }
    public T getResult()      { return result; }
    public String getMessage() { return message; }

    public boolean isOk() {
        return status == Status.OK;
    }
}
