package com.codematch.core.assembly;

import com.codematch.core.model.ContractCandidate;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Merges a freshly assembled candidate into the session's existing candidate with the same id.
 * <p>
 * Invariants kept across any sequence of merges:
 * <ul>
 *   <li>resolved and missing paths are disjoint</li>
 *   <li>a path once resolved is never missing again</li>
 *   <li>the union of resolved and missing paths never shrinks</li>
 * </ul>
 * Content from the incoming candidate wins for paths both sides resolved. The incoming
 * invalid set replaces the existing one, minus anything already resolved.
 */
public final class CandidateMerger {

    private CandidateMerger() {}

    /**
     * @return the paths that were missing on {@code existing} and are now resolved
     */
    public static Set<String> merge(ContractCandidate existing, ContractCandidate incoming) {
        if (!existing.getId().equals(incoming.getId())) {
            throw new IllegalArgumentException(
                    "Cannot merge candidate " + incoming.getId() + " into " + existing.getId());
        }

        Map<String, String> resolved = new LinkedHashMap<>(existing.getResolvedSources());
        resolved.putAll(incoming.getResolvedSources());

        Set<String> missing = new LinkedHashSet<>(existing.getMissingSources());
        missing.addAll(incoming.getMissingSources());
        missing.removeAll(resolved.keySet());

        Set<String> invalid = new LinkedHashSet<>(incoming.getInvalidSources());
        invalid.removeAll(resolved.keySet());

        Set<String> newlyResolved = new LinkedHashSet<>(existing.getMissingSources());
        newlyResolved.retainAll(resolved.keySet());

        existing.replaceSources(resolved, missing, invalid);
        return newlyResolved;
    }
}
