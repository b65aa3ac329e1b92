package com.codematch.core.error;

/**
 * Thrown when a call to the matching service itself fails.
 */
public class VerificationTransportException extends CodematchException {

    public VerificationTransportException(String message) {
        super(ErrorKind.VERIFICATION_TRANSPORT_FAILURE, message);
    }

    public VerificationTransportException(String message, Throwable cause) {
        super(ErrorKind.VERIFICATION_TRANSPORT_FAILURE, message, cause);
    }
}
