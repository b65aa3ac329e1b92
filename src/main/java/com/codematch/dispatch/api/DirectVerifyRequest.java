package com.codematch.dispatch.api;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/verify.
 *
 * @param address        deployed contract address
 * @param chainId        chain the contract is deployed on
 * @param files          file contents keyed by path; nullable when only a stored result is wanted
 * @param chosenContract index of the contract to verify when the files describe several; nullable
 */
public record DirectVerifyRequest(
    String address,
    String chainId,
    Map<String, String> files,
    Integer chosenContract
) {}
