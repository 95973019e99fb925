package com.upgradedoctor.check;

/**
 * A check selection pattern is not a valid glob.
 */
public class InvalidPatternException extends IllegalArgumentException {

    public InvalidPatternException(String message) {
        super(message);
    }

    public InvalidPatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
