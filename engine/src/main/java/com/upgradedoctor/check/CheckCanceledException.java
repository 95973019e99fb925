package com.upgradedoctor.check;

/**
 * The run's {@link ExecutionContext} was canceled while a check was still working.
 */
public class CheckCanceledException extends RuntimeException {

    public CheckCanceledException(String message) {
        super(message);
    }
}
