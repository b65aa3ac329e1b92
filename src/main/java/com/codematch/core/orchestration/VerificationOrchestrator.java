package com.codematch.core.orchestration;

import com.codematch.core.gate.VerifiabilityGate;
import com.codematch.core.logging.MdcContext;
import com.codematch.core.metrics.CodematchMetrics;
import com.codematch.core.model.CandidateStatus;
import com.codematch.core.model.ContractCandidate;
import com.codematch.core.model.Match;
import com.codematch.core.model.SourceFile;
import com.codematch.core.model.VerificationSession;
import com.codematch.matching.VerificationService;
import com.codematch.validation.ValidationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives verification attempts for session candidates and records the outcome on them.
 *
 * <p>Per candidate:
 * <ol>
 *   <li>a candidate already confirmed for its current target is left alone</li>
 *   <li>best-effort fetch of missing sources</li>
 *   <li>gate check; candidates that fail are skipped</li>
 *   <li>adopt a stored perfect/partial result for the same address and chain, if any</li>
 *   <li>otherwise one primary call to the matching service, plus at most one retry with the
 *       full session file set when the verdict is {@code extra-file-input-bug}</li>
 * </ol>
 * A failed matching call is recorded as status {@code error}; it never aborts sibling candidates.
 */
@Service
public class VerificationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(VerificationOrchestrator.class);

    private final ValidationService validationService;
    private final VerificationService verificationService;
    private final VerifiabilityGate gate;
    private final CodematchMetrics metrics;

    public VerificationOrchestrator(ValidationService validationService,
                                    VerificationService verificationService,
                                    VerifiabilityGate gate,
                                    CodematchMetrics metrics) {
        this.validationService = validationService;
        this.verificationService = verificationService;
        this.gate = gate;
        this.metrics = metrics;
    }

    /**
     * Runs {@link #verify} for each candidate in turn.
     */
    public List<AttemptOutcome> verifyAll(VerificationSession session, Collection<ContractCandidate> candidates) {
        List<AttemptOutcome> outcomes = new ArrayList<>();
        for (ContractCandidate candidate : List.copyOf(candidates)) {
            outcomes.add(verify(session, candidate));
        }
        return outcomes;
    }

    /**
     * Makes one verification attempt for a candidate of the given session and updates its
     * status, status message and storage timestamp in place.
     */
    public AttemptOutcome verify(VerificationSession session, ContractCandidate candidate) {
        MdcContext.setCandidate(candidate.getId());
        try {
            if (!candidate.hasTarget()) {
                return skipped(candidate);
            }

            if (candidate.isConfirmedForTarget()) {
                log.debug("Candidate {} already {} for {} on chain {}", candidate.getId(),
                        candidate.getStatus().wireValue(), candidate.getAddress(), candidate.getChainId());
                return new AttemptOutcome(candidate.getId(), AttemptOutcome.Kind.ALREADY_CONFIRMED,
                        candidate.getStatus(), 0);
            }

            fetchMissingIfIncomplete(candidate);

            if (!gate.isVerifiable(candidate)) {
                log.debug("Candidate {} not verifiable: {}", candidate.getId(), gate.rejectionReason(candidate));
                return skipped(candidate);
            }

            if (candidate.getStatus() == CandidateStatus.PENDING) {
                candidate.setStatus(CandidateStatus.VERIFIABLE);
            }

            long start = System.currentTimeMillis();
            AtomicInteger calls = new AtomicInteger();
            try {
                List<Match> stored = verificationService.findConfirmedMatches(
                        candidate.getAddress(), candidate.getChainId());
                if (!stored.isEmpty()) {
                    candidate.recordMatch(stored.get(0));
                    metrics.recordStoredMatchAdopted();
                    log.info("Adopted stored {} match for {} on chain {}",
                            candidate.getStatus().wireValue(), candidate.getAddress(), candidate.getChainId());
                    return new AttemptOutcome(candidate.getId(), AttemptOutcome.Kind.STORED_MATCH,
                            candidate.getStatus(), 0);
                }

                Match verdict = runAttempt(candidate, session.files().all(), calls);
                candidate.recordMatch(verdict);
                metrics.recordVerification(candidate.getStatus(), System.currentTimeMillis() - start);
                log.info("Verified {} ({}) against {} on chain {}: {}",
                        candidate.getId(), candidate.getName(), candidate.getAddress(),
                        candidate.getChainId(), candidate.getStatus().wireValue());
                return new AttemptOutcome(candidate.getId(), AttemptOutcome.Kind.VERIFIED,
                        candidate.getStatus(), calls.get());
            } catch (RuntimeException e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                candidate.recordMatch(Match.error(candidate.getAddress(), candidate.getChainId(), message));
                metrics.recordVerification(candidate.getStatus(), System.currentTimeMillis() - start);
                log.warn("Verification of {} failed: {}", candidate.getId(), message);
                return new AttemptOutcome(candidate.getId(), AttemptOutcome.Kind.FAILED,
                        candidate.getStatus(), calls.get());
            }
        } finally {
            MdcContext.clearCandidate();
        }
    }

    /**
     * Runs the primary call and, when needed, the single expanded retry for a candidate that
     * already passed the gate. Failures of either call propagate.
     *
     * @param allFiles the superset of files the retry may draw sources from
     * @return the verdict of the last call made
     */
    public Match attempt(ContractCandidate candidate, List<SourceFile> allFiles) {
        return runAttempt(candidate, allFiles, new AtomicInteger());
    }

    /**
     * @param calls incremented before each matching call, so it also counts a call that throws
     */
    private Match runAttempt(ContractCandidate candidate, List<SourceFile> allFiles, AtomicInteger calls) {
        AttemptPhase phase = AttemptPhase.PRIMARY;
        ContractCandidate subject = candidate;
        Match verdict = null;
        while (phase != AttemptPhase.DONE) {
            if (phase == AttemptPhase.EXPANDED_RETRY) {
                log.info("Candidate {} needs the full source set, retrying with {} files",
                        candidate.getId(), allFiles.size());
                subject = validationService.expandWithAllSources(candidate, allFiles);
            }
            calls.incrementAndGet();
            verdict = verificationService.verify(candidate.getAddress(), candidate.getChainId(), subject);
            if (phase == AttemptPhase.EXPANDED_RETRY) {
                metrics.recordExpandedRetry(verdict.status());
            }
            phase = phase.next(verdict);
        }
        return verdict;
    }

    /**
     * Best-effort; a failure is logged and the attempt continues.
     */
    public void fetchMissingIfIncomplete(ContractCandidate candidate) {
        if (validationService.isValid(candidate, false)) {
            return;
        }
        log.info("Attempting fetching of missing sources for {} ({})", candidate.getId(), candidate.getName());
        try {
            validationService.fetchMissingSources(candidate);
        } catch (RuntimeException e) {
            log.warn("Fetching missing sources for {} failed: {}", candidate.getId(), e.getMessage(), e);
        }
    }

    private AttemptOutcome skipped(ContractCandidate candidate) {
        return new AttemptOutcome(candidate.getId(), AttemptOutcome.Kind.SKIPPED, candidate.getStatus(), 0);
    }
}
