package com.upgradedoctor.check.result;

/**
 * A {@link DiagnosticResult} violates its structural invariants.
 */
public class ResultValidationException extends RuntimeException {

    public ResultValidationException(String message) {
        super(message);
    }

    public ResultValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
