package com.codematch.core.gate;

import com.codematch.core.model.ContractCandidate;
import org.springframework.stereotype.Component;

/**
 * Decides whether a candidate carries enough information to attempt verification:
 * no missing sources, a compiler version, and a target address and chain.
 * Pure predicate, no side effects.
 */
@Component
public class VerifiabilityGate {

    public boolean isVerifiable(ContractCandidate candidate) {
        return candidate.getMissingSources().isEmpty()
                && candidate.hasCompilerVersion()
                && candidate.getAddress() != null
                && candidate.getChainId() != null;
    }

    /**
     * Human-readable reason the gate rejects a candidate, or {@code null} when it passes.
     */
    public String rejectionReason(ContractCandidate candidate) {
        if (!candidate.hasCompilerVersion()) {
            return "Metadata file not specifying a compiler version.";
        }
        if (!candidate.getMissingSources().isEmpty()) {
            return "Missing sources: " + String.join(", ", candidate.getMissingSources());
        }
        if (candidate.getAddress() == null || candidate.getChainId() == null) {
            return "No target address and chain assigned.";
        }
        return null;
    }
}
