package com.codematch.core.error;

/**
 * Thrown when the validation service rejects a batch of files outright.
 */
public class ValidationFailureException extends CodematchException {

    public ValidationFailureException(String message) {
        super(ErrorKind.VALIDATION_FAILURE, message);
    }

    public ValidationFailureException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_FAILURE, message, cause);
    }
}
