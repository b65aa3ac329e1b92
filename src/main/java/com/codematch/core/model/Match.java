package com.codematch.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Verdict returned by the matching service, or read back from its stored results.
 *
 * @param status           match status; {@code null} means the service produced no verdict
 * @param address          the address the verdict is for
 * @param chainId          the chain the verdict is for
 * @param message          diagnostic text; nullable
 * @param storageTimestamp when the result was stored; nullable
 */
public record Match(
    CandidateStatus status,
    String address,
    String chainId,
    String message,
    Instant storageTimestamp
) implements Serializable {

    public static Match error(String address, String chainId, String message) {
        return new Match(CandidateStatus.ERROR, address, chainId, message, null);
    }

    public boolean isConfirmed() {
        return status != null && status.isConfirmedMatch();
    }
}
