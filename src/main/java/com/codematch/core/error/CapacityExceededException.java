package com.codematch.core.error;

/**
 * Thrown when admitting a batch of files would push a session past its size cap.
 * Nothing from the batch has been stored.
 */
public class CapacityExceededException extends CodematchException {

    private final long requestedBytes;
    private final long maxBytes;

    public CapacityExceededException(long requestedBytes, long maxBytes) {
        super(ErrorKind.CAPACITY_EXCEEDED,
                "Too much session memory used (%d of %d bytes). Delete some files or clear the session."
                        .formatted(requestedBytes, maxBytes));
        this.requestedBytes = requestedBytes;
        this.maxBytes = maxBytes;
    }

    public long getRequestedBytes() {
        return requestedBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
