package com.upgradedoctor.check;

/**
 * The run's deadline passed while a check was still working.
 */
public class CheckTimeoutException extends RuntimeException {

    public CheckTimeoutException(String message) {
        super(message);
    }
}
