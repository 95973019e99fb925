package com.upgradedoctor.k8s;

/**
 * Failure reported by a {@link ResourceReader}. The {@link ErrorKind} is decided once, by the
 * reader, so callers branch on a plain enum instead of inspecting client exceptions.
 */
public class ResourceAccessException extends RuntimeException {

    public enum ErrorKind {
        /** The object does not exist, or its resource type is not registered in the cluster. */
        NOT_FOUND,
        FORBIDDEN,
        TIMEOUT,
        UNAVAILABLE,
        OTHER
    }

    private final ErrorKind kind;

    public ResourceAccessException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ResourceAccessException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isNotFound() {
        return kind == ErrorKind.NOT_FOUND;
    }

    public static ResourceAccessException notFound(String message) {
        return new ResourceAccessException(ErrorKind.NOT_FOUND, message);
    }

    /** True when {@code e} is a not-found failure; a null argument is never not-found. */
    public static boolean isNotFound(Throwable e) {
        return e instanceof ResourceAccessException rae && rae.isNotFound();
    }
}
