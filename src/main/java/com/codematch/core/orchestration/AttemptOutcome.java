package com.codematch.core.orchestration;

import com.codematch.core.model.CandidateStatus;

/**
 * What one {@link VerificationOrchestrator#verify} call did for one candidate.
 *
 * @param candidateId       the candidate
 * @param kind              how the attempt ended
 * @param status            the candidate's status afterwards
 * @param verificationCalls number of calls made to the matching service (0, 1 or 2), including a call that failed
 */
public record AttemptOutcome(
    String candidateId,
    Kind kind,
    CandidateStatus status,
    int verificationCalls
) {

    public enum Kind {
        /** Gate not passed; candidate left unchanged. */
        SKIPPED,
        /** Candidate already holds a confirmed match for its current target; no call made. */
        ALREADY_CONFIRMED,
        /** Adopted an already-stored result for the same address and chain. */
        STORED_MATCH,
        /** The matching service returned a verdict. */
        VERIFIED,
        /** The matching service call failed; recorded as {@code error}. */
        FAILED
    }
}
