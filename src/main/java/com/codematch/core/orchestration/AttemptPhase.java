package com.codematch.core.orchestration;

import com.codematch.core.model.CandidateStatus;
import com.codematch.core.model.Match;

/**
 * Phases of a single verification attempt.
 * <p>
 * {@code PRIMARY -> DONE}, or {@code PRIMARY -> EXPANDED_RETRY -> DONE} when the primary
 * verdict is {@code extra-file-input-bug}. The retry phase always ends the attempt.
 */
public enum AttemptPhase {
    PRIMARY,
    EXPANDED_RETRY,
    DONE;

    public AttemptPhase next(Match verdict) {
        return switch (this) {
            case PRIMARY -> verdict.status() == CandidateStatus.EXTRA_FILE_INPUT_BUG ? EXPANDED_RETRY : DONE;
            case EXPANDED_RETRY, DONE -> DONE;
        };
    }
}
