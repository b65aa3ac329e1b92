package com.codematch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verification status of a contract candidate.
 */
public enum CandidateStatus {
    PENDING("pending"),
    VERIFIABLE("verifiable"),
    PERFECT("perfect"),
    PARTIAL("partial"),
    EXTRA_FILE_INPUT_BUG("extra-file-input-bug"),
    ERROR("error"),
    FALSE("false");   // only assigned by batch lookups: no match found

    private final String wireValue;

    CandidateStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** True for the two statuses that count as a confirmed match. */
    public boolean isConfirmedMatch() {
        return this == PERFECT || this == PARTIAL;
    }

    @JsonCreator
    public static CandidateStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (CandidateStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown candidate status: " + value);
    }
}
