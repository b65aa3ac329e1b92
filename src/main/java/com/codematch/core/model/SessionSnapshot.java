package com.codematch.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a session, safe to hand to the transport layer.
 *
 * @param sessionId   the session the view was taken from
 * @param candidates  one summary per candidate, in creation order
 * @param unusedFiles uploaded paths that no candidate claimed
 */
public record SessionSnapshot(
    String sessionId,
    List<CandidateSummary> candidates,
    List<String> unusedFiles
) {

    public static SessionSnapshot empty(String sessionId) {
        return new SessionSnapshot(sessionId, List.of(), List.of());
    }

    /**
     * @param found   resolved source paths
     * @param missing source paths still needed
     * @param invalid source paths whose content failed the metadata hash check
     */
    public record CandidateSummary(
        String verificationId,
        String name,
        String compiledPath,
        String compilerVersion,
        String address,
        String chainId,
        List<String> found,
        List<String> missing,
        List<String> invalid,
        CandidateStatus status,
        String statusMessage,
        Instant storageTimestamp
    ) {
        static CandidateSummary of(ContractCandidate c) {
            return new CandidateSummary(
                    c.getId(), c.getName(), c.getCompiledPath(), c.getCompilerVersion(),
                    c.getAddress(), c.getChainId(),
                    List.copyOf(c.getResolvedSources().keySet()),
                    List.copyOf(c.getMissingSources()),
                    List.copyOf(c.getInvalidSources()),
                    c.getStatus(), c.getStatusMessage(), c.getStorageTimestamp());
        }
    }
}
