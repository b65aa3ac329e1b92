package com.codematch.core.engine;

import com.codematch.core.assembly.AssemblyResult;
import com.codematch.core.assembly.CandidateAssembler;
import com.codematch.core.error.AmbiguousContractException;
import com.codematch.core.error.CapacityExceededException;
import com.codematch.core.error.IncompleteCandidateException;
import com.codematch.core.error.InvalidRequestException;
import com.codematch.core.error.NotFoundException;
import com.codematch.core.gate.VerifiabilityGate;
import com.codematch.core.http.RemoteFileFetcher;
import com.codematch.core.logging.MdcContext;
import com.codematch.core.lookup.BatchAddressLookup;
import com.codematch.core.metrics.CodematchMetrics;
import com.codematch.core.model.AddressStatus;
import com.codematch.core.model.CandidateStatus;
import com.codematch.core.model.ContractCandidate;
import com.codematch.core.model.Match;
import com.codematch.core.model.SessionSnapshot;
import com.codematch.core.model.SourceFile;
import com.codematch.core.model.VerificationSession;
import com.codematch.core.orchestration.VerificationOrchestrator;
import com.codematch.core.session.SessionStore;
import com.codematch.core.target.TargetValidator;
import com.codematch.matching.VerificationService;
import com.codematch.validation.CheckedFiles;
import com.codematch.validation.ValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for every caller-facing operation: file uploads (inline or by URL), target
 * assignment, session snapshots and resets, direct and CREATE2 verification, and batch
 * status lookups.
 * <p>
 * Each call runs to completion on the calling thread. Requests against the same session
 * must be serialized by the caller.
 */
@Service
public class VerificationEngine {

    private static final Logger log = LoggerFactory.getLogger(VerificationEngine.class);

    static final String NOT_YET_VERIFIED =
            "The contract at the provided address and chain has not yet been verified.";

    private final SessionStore sessionStore;
    private final CandidateAssembler assembler;
    private final VerificationOrchestrator orchestrator;
    private final VerifiabilityGate gate;
    private final BatchAddressLookup lookup;
    private final TargetValidator targetValidator;
    private final ValidationService validationService;
    private final VerificationService verificationService;
    private final RemoteFileFetcher remoteFileFetcher;
    private final CodematchMetrics metrics;

    public VerificationEngine(SessionStore sessionStore,
                              CandidateAssembler assembler,
                              VerificationOrchestrator orchestrator,
                              VerifiabilityGate gate,
                              BatchAddressLookup lookup,
                              TargetValidator targetValidator,
                              ValidationService validationService,
                              VerificationService verificationService,
                              RemoteFileFetcher remoteFileFetcher,
                              CodematchMetrics metrics) {
        this.sessionStore = sessionStore;
        this.assembler = assembler;
        this.orchestrator = orchestrator;
        this.gate = gate;
        this.lookup = lookup;
        this.targetValidator = targetValidator;
        this.validationService = validationService;
        this.verificationService = verificationService;
        this.remoteFileFetcher = remoteFileFetcher;
        this.metrics = metrics;
    }

    /**
     * Result of an upload.
     *
     * @param newFiles number of files not already in the session
     * @param snapshot session state after assembly and verification
     */
    public record UploadResult(int newFiles, SessionSnapshot snapshot) {}

    /**
     * One requested (candidate, target) pairing.
     */
    public record TargetAssignment(String candidateId, String address, String chainId) {}

    /**
     * Stores files in the session and, when at least one file is new, re-assembles
     * candidates and attempts verification of every candidate that became verifiable.
     *
     * @throws CapacityExceededException if the session size cap would be exceeded
     */
    public UploadResult uploadFiles(String sessionId, List<SourceFile> files) {
        if (files == null || files.isEmpty()) {
            throw new InvalidRequestException("There should be files in the <files> field");
        }
        MdcContext.setSession(sessionId);
        try {
            VerificationSession session = sessionStore.getOrCreate(sessionId);
            int added;
            try {
                added = session.files().put(files);
            } catch (CapacityExceededException e) {
                metrics.recordCapacityRejection();
                log.warn("Rejected upload of {} files: {}", files.size(), e.getMessage());
                throw e;
            }
            metrics.recordFilesAdmitted(added);

            if (added == 0) {
                log.debug("Upload of {} files added nothing new", files.size());
                return new UploadResult(0, session.snapshot());
            }

            log.info("Admitted {} new files, session now holds {} files ({} bytes)",
                    added, session.files().count(), session.files().totalBytes());
            AssemblyResult assembly = assembler.assemble(session);
            log.debug("Assembly produced {} candidates, {} unused files",
                    assembly.candidateCount(), assembly.unusedPaths().size());
            orchestrator.verifyAll(session, session.candidates());
            sessionStore.save(session);
            return new UploadResult(added, session.snapshot());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Downloads the file at {@code url} and uploads it as {@link #uploadFiles} would.
     *
     * @throws InvalidRequestException if the URL cannot be fetched
     */
    public UploadResult uploadFromUrl(String sessionId, String url) {
        SourceFile file = remoteFileFetcher.fetch(url);
        return uploadFiles(sessionId, List.of(file));
    }

    /**
     * Sets the verification target of one candidate and runs a verification attempt for it.
     *
     * @return the candidate's status afterwards
     * @throws NotFoundException if the session holds no candidate with that id
     */
    public CandidateStatus attachTargetAndVerify(String sessionId, String candidateId,
                                                 String address, String chainId) {
        String normalizedAddress = targetValidator.normalizeAddress(address);
        String normalizedChain = targetValidator.normalizeChainId(chainId);
        MdcContext.setSession(sessionId);
        try {
            VerificationSession session = sessionStore.find(sessionId)
                    .orElseThrow(() -> new NotFoundException("There are currently no pending contracts."));
            ContractCandidate candidate = session.candidate(candidateId)
                    .orElseThrow(() -> new NotFoundException("Unknown contract: " + candidateId));

            candidate.assignTarget(normalizedAddress, normalizedChain);
            orchestrator.verify(session, candidate);
            sessionStore.save(session);
            return candidate.getStatus();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Batch form of {@link #attachTargetAndVerify}. Unknown candidate ids are ignored.
     *
     * @throws InvalidRequestException if the session holds no candidates, or any target is malformed
     */
    public SessionSnapshot verifyCandidates(String sessionId, List<TargetAssignment> assignments) {
        List<TargetAssignment> normalized = new ArrayList<>();
        for (TargetAssignment a : assignments) {
            normalized.add(new TargetAssignment(a.candidateId(),
                    targetValidator.normalizeAddress(a.address()),
                    targetValidator.normalizeChainId(a.chainId())));
        }

        MdcContext.setSession(sessionId);
        try {
            VerificationSession session = sessionStore.find(sessionId)
                    .filter(VerificationSession::hasCandidates)
                    .orElseThrow(() -> new InvalidRequestException("There are currently no pending contracts."));

            List<ContractCandidate> verifiable = new ArrayList<>();
            for (TargetAssignment a : normalized) {
                session.candidate(a.candidateId()).ifPresent(candidate -> {
                    candidate.assignTarget(a.address(), a.chainId());
                    if (gate.isVerifiable(candidate)) {
                        verifiable.add(candidate);
                    }
                });
            }

            orchestrator.verifyAll(session, verifiable);
            sessionStore.save(session);
            return session.snapshot();
        } finally {
            MdcContext.clear();
        }
    }

    public SessionSnapshot getSessionSnapshot(String sessionId) {
        return sessionStore.find(sessionId)
                .map(VerificationSession::snapshot)
                .orElseGet(() -> SessionSnapshot.empty(sessionId));
    }

    public void resetSession(String sessionId) {
        sessionStore.destroy(sessionId);
    }

    /**
     * Stored-result status per address across the given chains. Never calls the
     * validation service and never verifies anything.
     */
    public Map<String, AddressStatus> batchStatus(List<String> addresses, List<String> chainIds) {
        return lookup.lookup(
                targetValidator.normalizeAddresses(addresses),
                targetValidator.normalizeChainIds(chainIds));
    }

    /**
     * Verifies a set of files against one target without involving any session.
     *
     * @param chosenContract index of the contract to verify when the files describe several;
     *                       nullable
     * @return a stored match when one exists, otherwise the verdict of the attempt
     */
    public Match verifyDirect(String address, String chainId, List<SourceFile> files, Integer chosenContract) {
        String normalizedAddress = targetValidator.normalizeAddress(address);
        String normalizedChain = targetValidator.normalizeChainId(chainId);

        List<Match> stored = verificationService.findConfirmedMatches(normalizedAddress, normalizedChain);
        if (!stored.isEmpty()) {
            metrics.recordStoredMatchAdopted();
            return stored.get(0);
        }

        if (files == null || files.isEmpty()) {
            throw new NotFoundException(NOT_YET_VERIFIED);
        }

        ContractCandidate candidate = selectCandidate(files, chosenContract);
        candidate.assignTarget(normalizedAddress, normalizedChain);
        orchestrator.fetchMissingIfIncomplete(candidate);
        if (!gate.isVerifiable(candidate)) {
            throw new IncompleteCandidateException(gate.rejectionReason(candidate));
        }

        long start = System.currentTimeMillis();
        Match match = orchestrator.attempt(candidate, files);
        metrics.recordVerification(match.status(), System.currentTimeMillis() - start);
        log.info("Direct verification of {} against {} on chain {}: {}", candidate.getName(),
                normalizedAddress, normalizedChain, match.status() != null ? match.status().wireValue() : "none");
        return match;
    }

    /**
     * Verifies a set of files against the address a CREATE2 deployment would produce.
     * No session and no stored-result lookup are involved.
     *
     * @param constructorArgs ABI-encoded constructor arguments; nullable for none
     * @return the verdict, carrying the computed address
     */
    public Match verifyCreate2(String deployerAddress, String salt, List<String> constructorArgs,
                               List<SourceFile> files, Integer chosenContract) {
        String normalizedDeployer = targetValidator.normalizeAddress(deployerAddress);
        String normalizedSalt = targetValidator.normalizeSalt(salt);
        if (files == null || files.isEmpty()) {
            throw new InvalidRequestException("There should be files in the <files> field");
        }

        ContractCandidate candidate = selectCandidate(files, chosenContract);
        orchestrator.fetchMissingIfIncomplete(candidate);
        if (!candidate.getMissingSources().isEmpty()) {
            throw new IncompleteCandidateException(gate.rejectionReason(candidate));
        }

        long start = System.currentTimeMillis();
        Match match = verificationService.verifyCreate2(candidate, normalizedDeployer, normalizedSalt,
                constructorArgs != null ? constructorArgs : List.of());
        metrics.recordVerification(match.status(), System.currentTimeMillis() - start);
        log.info("CREATE2 verification of {} from deployer {} with salt {}: {} at {}", candidate.getName(),
                normalizedDeployer, normalizedSalt,
                match.status() != null ? match.status().wireValue() : "none", match.address());
        return match;
    }

    /**
     * Checks the files and picks the one candidate to verify.
     *
     * @throws IncompleteCandidateException if no candidate is found, any has invalid or missing
     *                                      sources that the files themselves cannot resolve, or the
     *                                      chosen one names no compiler version
     */
    private ContractCandidate selectCandidate(List<SourceFile> files, Integer chosenContract) {
        CheckedFiles checked = validationService.checkFiles(files);
        List<ContractCandidate> candidates = checked.candidates();
        if (candidates.isEmpty()) {
            throw new IncompleteCandidateException("No contract metadata found in the supplied files.");
        }

        List<String> errors = candidates.stream()
                .filter(c -> !validationService.isValid(c, true))
                .map(VerificationEngine::describeInvalidAndMissing)
                .toList();
        if (!errors.isEmpty()) {
            throw new IncompleteCandidateException("Invalid or missing sources in:\n" + String.join("\n", errors));
        }

        ContractCandidate candidate = choose(candidates, chosenContract);
        if (!candidate.hasCompilerVersion()) {
            throw new IncompleteCandidateException("Metadata file not specifying a compiler version.");
        }
        return candidate;
    }

    private static ContractCandidate choose(List<ContractCandidate> candidates, Integer chosenContract) {
        if (chosenContract == null) {
            if (candidates.size() == 1) {
                return candidates.get(0);
            }
            List<AmbiguousContractException.Choice> choices = new ArrayList<>();
            for (int i = 0; i < candidates.size(); i++) {
                choices.add(new AmbiguousContractException.Choice(
                        i, candidates.get(i).getName(), candidates.get(i).getCompiledPath()));
            }
            throw new AmbiguousContractException(choices);
        }
        if (chosenContract < 0 || chosenContract >= candidates.size()) {
            throw new InvalidRequestException("chosenContract out of range: " + chosenContract
                    + " (detected " + candidates.size() + " contracts)");
        }
        return candidates.get(chosenContract);
    }

    private static String describeInvalidAndMissing(ContractCandidate c) {
        List<String> paths = new ArrayList<>(c.getInvalidSources());
        paths.addAll(c.getMissingSources());
        return c.getName() + " (" + String.join(", ", paths) + ")";
    }
}
