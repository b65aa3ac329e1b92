package com.codematch.dispatch.api;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/session/verify-validated.
 */
public record VerifyValidatedRequest(
    List<ContractTarget> contracts
) {

    public record ContractTarget(String verificationId, String address, String chainId) {}
}
