package com.codematch.core.assembly;

import com.codematch.core.error.ValidationFailureException;
import com.codematch.core.metrics.CodematchMetrics;
import com.codematch.core.model.ContractCandidate;
import com.codematch.core.model.SourceFile;
import com.codematch.core.model.VerificationSession;
import com.codematch.validation.CheckedFiles;
import com.codematch.validation.ValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a session's files into contract candidates via the {@link ValidationService}
 * and folds them into the session.
 * <p>
 * A candidate whose id already exists in the session is merged into the existing one
 * through {@link CandidateMerger}; otherwise it is inserted. If the validation service
 * rejects the batch, every file is reported unused and no candidate is touched.
 */
@Service
public class CandidateAssembler {

    private static final Logger log = LoggerFactory.getLogger(CandidateAssembler.class);

    private final ValidationService validationService;
    private final CodematchMetrics metrics;

    public CandidateAssembler(ValidationService validationService, CodematchMetrics metrics) {
        this.validationService = validationService;
        this.metrics = metrics;
    }

    public AssemblyResult assemble(VerificationSession session) {
        List<SourceFile> files = session.files().all();

        CheckedFiles checked;
        try {
            checked = validationService.checkFiles(files);
        } catch (ValidationFailureException e) {
            List<String> paths = session.files().paths();
            log.warn("Validation rejected {} files, marking all unused: {}", paths.size(), e.getMessage());
            session.replaceUnusedFiles(paths);
            metrics.recordAssembly("rejected");
            return AssemblyResult.rejected(paths);
        }

        List<String> created = new ArrayList<>();
        List<String> merged = new ArrayList<>();
        for (ContractCandidate incoming : checked.candidates()) {
            Optional<ContractCandidate> existing = session.candidate(incoming.getId());
            if (existing.isPresent()) {
                Set<String> newlyResolved = CandidateMerger.merge(existing.get(), incoming);
                log.info("Merged candidate {} ({}): {} newly resolved, {} still missing",
                        incoming.getId(), incoming.getName(), newlyResolved.size(),
                        existing.get().getMissingSources().size());
                merged.add(incoming.getId());
                metrics.recordAssembly("merged");
            } else {
                session.addCandidate(incoming);
                log.info("Created candidate {} ({}): {} resolved, {} missing",
                        incoming.getId(), incoming.getName(), incoming.getResolvedSources().size(),
                        incoming.getMissingSources().size());
                created.add(incoming.getId());
                metrics.recordAssembly("created");
            }
        }

        session.replaceUnusedFiles(checked.unusedPaths());
        return new AssemblyResult(created, merged, checked.unusedPaths(), false);
    }
}
