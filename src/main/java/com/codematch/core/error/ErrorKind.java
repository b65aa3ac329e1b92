package com.codematch.core.error;

/**
 * Stable classification of hard failures surfaced to callers.
 */
public enum ErrorKind {
    CAPACITY_EXCEEDED,
    VALIDATION_FAILURE,
    INCOMPLETE_CANDIDATE,
    VERIFICATION_TRANSPORT_FAILURE,
    NOT_FOUND,
    INVALID_REQUEST
}
