package com.codematch.core.error;

/**
 * Thrown when a candidate lacks a compiler version or has missing or invalid sources
 * and the caller asked for an immediate verdict.
 */
public class IncompleteCandidateException extends CodematchException {

    public IncompleteCandidateException(String message) {
        super(ErrorKind.INCOMPLETE_CANDIDATE, message);
    }
}
