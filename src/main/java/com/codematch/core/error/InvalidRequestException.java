package com.codematch.core.error;

/**
 * Thrown for malformed caller input (bad address, unsupported chain, empty session).
 */
public class InvalidRequestException extends CodematchException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(ErrorKind.INVALID_REQUEST, message, cause);
    }
}
