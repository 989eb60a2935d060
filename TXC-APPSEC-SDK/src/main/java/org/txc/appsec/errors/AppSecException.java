package org.txc.appsec.errors;

/**
 * Base type for every failure an SDK operation can report.
 * The operation name (e.g. "GetAttackGroup") identifies which call failed.
 */
public abstract class AppSecException extends Exception {
    private final String operation;

    protected AppSecException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    protected AppSecException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
