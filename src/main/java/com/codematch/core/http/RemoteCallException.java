package com.codematch.core.http;

/**
 * A call to a remote JSON service failed, either at the transport level or with a
 * non-success HTTP status.
 */
public class RemoteCallException extends RuntimeException {

    /** Status code reported when no HTTP response was received. */
    public static final int NO_RESPONSE = -1;

    private final int statusCode;

    public RemoteCallException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
