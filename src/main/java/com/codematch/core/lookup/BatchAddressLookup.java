package com.codematch.core.lookup;

import com.codematch.core.metrics.CodematchMetrics;
import com.codematch.core.model.AddressStatus;
import com.codematch.core.model.CandidateStatus;
import com.codematch.core.model.Match;
import com.codematch.matching.VerificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only status queries across many addresses and chains against stored results.
 * A failure for one (address, chain) pair is logged and skipped; it never aborts the batch.
 */
@Service
public class BatchAddressLookup {

    private static final Logger log = LoggerFactory.getLogger(BatchAddressLookup.class);

    private final VerificationService verificationService;
    private final CodematchMetrics metrics;

    public BatchAddressLookup(VerificationService verificationService, CodematchMetrics metrics) {
        this.verificationService = verificationService;
        this.metrics = metrics;
    }

    /**
     * @return one entry per distinct address, in request order
     */
    public Map<String, AddressStatus> lookup(List<String> addresses, List<String> chainIds) {
        Map<String, AddressStatus> results = new LinkedHashMap<>();
        for (String address : addresses) {
            if (results.containsKey(address)) {
                continue;
            }
            List<AddressStatus.ChainMatch> chains = new ArrayList<>();
            CandidateStatus best = CandidateStatus.FALSE;
            for (String chainId : chainIds) {
                try {
                    List<Match> found = verificationService.findConfirmedMatches(address, chainId);
                    if (!found.isEmpty() && found.get(0).isConfirmed()) {
                        CandidateStatus status = found.get(0).status();
                        chains.add(new AddressStatus.ChainMatch(chainId, status));
                        if (best != CandidateStatus.PERFECT) {
                            best = status;
                        }
                    }
                } catch (RuntimeException e) {
                    metrics.recordLookupFailure();
                    log.warn("Lookup of {} on chain {} failed, skipping: {}", address, chainId, e.getMessage());
                }
            }
            results.put(address, chains.isEmpty()
                    ? AddressStatus.notFound(address)
                    : new AddressStatus(address, best, List.copyOf(chains)));
        }
        return results;
    }
}
