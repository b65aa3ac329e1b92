package com.codematch.validation;

import com.codematch.core.model.ContractCandidate;
import com.codematch.core.model.SourceFile;

import java.util.List;

/**
 * Abstraction over the source-validation service: extracts compiler metadata from raw
 * files and resolves each metadata file into a contract candidate.
 * Implementations: {@link HttpValidationService}.
 */
public interface ValidationService {

    /**
     * Groups raw files into contract candidates.
     *
     * @throws com.codematch.core.error.ValidationFailureException if the batch is rejected outright
     */
    CheckedFiles checkFiles(List<SourceFile> files);

    /**
     * Re-resolves a candidate using every available file rather than the minimal set
     * its metadata names. Used when the compiler needs the fuller source set.
     *
     * @return a new candidate; the argument is not modified
     */
    ContractCandidate expandWithAllSources(ContractCandidate candidate, List<SourceFile> allFiles);

    /**
     * Best-effort resolution of still-missing sources from external registries.
     * Resolved sources are recorded on the candidate through
     * {@link ContractCandidate#resolveSource(String, String)}.
     */
    void fetchMissingSources(ContractCandidate candidate);

    default boolean isValid(ContractCandidate candidate, boolean ignoreMissing) {
        return candidate.isValid(ignoreMissing);
    }
}
