package com.codematch.validation;

import com.codematch.core.model.ContractCandidate;

import java.util.List;

/**
 * Result of {@link ValidationService#checkFiles}.
 *
 * @param candidates  one candidate per metadata file found
 * @param unusedPaths paths of files no candidate claimed
 */
public record CheckedFiles(
    List<ContractCandidate> candidates,
    List<String> unusedPaths
) {
    public CheckedFiles {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        unusedPaths = unusedPaths != null ? List.copyOf(unusedPaths) : List.of();
    }
}
