package com.heronix.registrar.model;

/**
 * Outcome of a workflow step on a record.
 *
 * Expected business failures (wrong status, no seats, undeclared result)
 * come back as a failed result; callers must check {@link #success()}.
 */
public record OperationResult(boolean success, String message) {

    public static OperationResult ok(String message) {
        return new OperationResult(true, message);
    }

    public static OperationResult failure(String message) {
        return new OperationResult(false, message);
    }
}
