package com.codematch.core.metrics;

import com.codematch.core.model.CandidateStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for file intake, candidate assembly and verification.
 */
@Service
public class CodematchMetrics {

    private final MeterRegistry registry;

    public CodematchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordFilesAdmitted(int count) {
        DistributionSummary.builder("codematch.files.admitted")
                .description("Files newly admitted per upload")
                .register(registry)
                .record(count);
    }

    public void recordCapacityRejection() {
        Counter.builder("codematch.files.capacity_rejections")
                .description("Uploads rejected because the session size cap would be exceeded")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "created", "merged" or "rejected"
     */
    public void recordAssembly(String outcome) {
        Counter.builder("codematch.assembly.candidates")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordVerification(CandidateStatus status, long ms) {
        String tag = status != null ? status.wireValue() : "none";
        Counter.builder("codematch.verification.outcomes")
                .tag("status", tag)
                .register(registry)
                .increment();
        Timer.builder("codematch.verification.duration")
                .tag("status", tag)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a verification answered from stored results without calling the matching service.
     */
    public void recordStoredMatchAdopted() {
        Counter.builder("codematch.verification.stored_matches")
                .register(registry)
                .increment();
    }

    public void recordExpandedRetry(CandidateStatus retryStatus) {
        Counter.builder("codematch.verification.expanded_retries")
                .description("Re-attempts with the full session source set")
                .tag("status", retryStatus != null ? retryStatus.wireValue() : "none")
                .register(registry)
                .increment();
    }

    public void recordLookupFailure() {
        Counter.builder("codematch.lookup.pair_failures")
                .description("Per (address, chain) lookups that failed and were skipped")
                .register(registry)
                .increment();
    }
}
