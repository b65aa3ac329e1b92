package com.codematch.core.assembly;

import java.util.List;

/**
 * Outcome of one assembly pass over a session's files.
 *
 * @param createdIds  ids of candidates inserted fresh
 * @param mergedIds   ids of existing candidates that were merged into
 * @param unusedPaths paths no candidate claimed
 * @param rejected    true when the validation service rejected the whole batch
 */
public record AssemblyResult(
    List<String> createdIds,
    List<String> mergedIds,
    List<String> unusedPaths,
    boolean rejected
) {

    public static AssemblyResult rejected(List<String> paths) {
        return new AssemblyResult(List.of(), List.of(), paths, true);
    }

    public int candidateCount() {
        return createdIds.size() + mergedIds.size();
    }
}
