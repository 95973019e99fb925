package com.upgradedoctor.check;

/**
 * A check with the same ID is already registered.
 */
public class DuplicateCheckException extends Exception {

    private final String checkId;

    public DuplicateCheckException(String checkId) {
        super("check with ID " + checkId + " already registered");
        this.checkId = checkId;
    }

    public String getCheckId() {
        return checkId;
    }
}
