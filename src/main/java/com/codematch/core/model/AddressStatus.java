package com.codematch.core.model;

import java.util.List;

/**
 * Batch lookup result for one address.
 *
 * @param address the normalised address
 * @param status  best confirmed status across the requested chains, or {@code FALSE}
 * @param chains  the chains with a confirmed match, in request order
 */
public record AddressStatus(
    String address,
    CandidateStatus status,
    List<ChainMatch> chains
) {

    public record ChainMatch(String chainId, CandidateStatus status) {}

    public static AddressStatus notFound(String address) {
        return new AddressStatus(address, CandidateStatus.FALSE, List.of());
    }

    public boolean isFound() {
        return status != CandidateStatus.FALSE;
    }

    public List<String> matchingChainIds() {
        return chains.stream().map(ChainMatch::chainId).toList();
    }
}
