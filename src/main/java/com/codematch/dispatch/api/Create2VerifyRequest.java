package com.codematch.dispatch.api;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/verify/create2.
 *
 * @param deployerAddress address of the factory that issued the CREATE2
 * @param salt            the CREATE2 salt, {@code 0x}-prefixed hex
 * @param constructorArgs ABI-encoded constructor arguments; nullable for none
 * @param files           file contents keyed by path
 * @param chosenContract  index of the contract to verify when the files describe several; nullable
 */
public record Create2VerifyRequest(
    String deployerAddress,
    String salt,
    List<String> constructorArgs,
    Map<String, String> files,
    Integer chosenContract
) {}
