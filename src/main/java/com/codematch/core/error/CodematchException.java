package com.codematch.core.error;

/**
 * Base class of every failure this service reports to its callers.
 * Each subclass carries a fixed {@link ErrorKind}.
 */
public abstract class CodematchException extends RuntimeException {

    private final ErrorKind kind;

    protected CodematchException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CodematchException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
