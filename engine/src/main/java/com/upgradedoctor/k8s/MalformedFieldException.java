package com.upgradedoctor.k8s;

/**
 * An unstructured field exists but does not have the expected JSON type.
 */
public class MalformedFieldException extends RuntimeException {

    public MalformedFieldException(String[] path, String expectedType, Object actual) {
        super(String.format("field .%s: expected %s but found %s",
            String.join(".", path), expectedType, actual == null ? "null" : actual.getClass().getSimpleName()));
    }
}
