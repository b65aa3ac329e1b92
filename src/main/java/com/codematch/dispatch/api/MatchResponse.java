package com.codematch.dispatch.api;

import com.codematch.core.model.Match;

import java.time.Instant;

public record MatchResponse(
    String address,
    String chainId,
    String status,
    String message,
    Instant storageTimestamp
) {

    public static MatchResponse from(Match match) {
        return new MatchResponse(match.address(), match.chainId(),
                match.status() != null ? match.status().wireValue() : null,
                match.message(), match.storageTimestamp());
    }
}
