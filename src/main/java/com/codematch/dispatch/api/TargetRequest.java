package com.codematch.dispatch.api;

/**
 * Verification target for a single contract.
 */
public record TargetRequest(
    String address,
    String chainId
) {}
