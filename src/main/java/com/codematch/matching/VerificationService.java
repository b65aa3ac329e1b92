package com.codematch.matching;

import com.codematch.core.model.ContractCandidate;
import com.codematch.core.model.Match;

import java.util.List;

/**
 * Abstraction over the bytecode matching service.
 * Implementations: {@link HttpVerificationService}.
 */
public interface VerificationService {

    /**
     * Compiles the candidate and compares it with the code deployed at the target.
     *
     * @throws com.codematch.core.error.VerificationTransportException if the call itself fails
     */
    Match verify(String address, String chainId, ContractCandidate candidate);

    /**
     * Reads already-stored perfect or partial matches.
     *
     * @param chainId chain to restrict to; {@code null} for any chain
     * @return stored matches, best first; empty when none
     */
    List<Match> findConfirmedMatches(String address, String chainId);

    /**
     * Compiles the candidate and compares it with the code a CREATE2 deployment from
     * {@code deployerAddress} with {@code salt} and {@code constructorArgs} would produce.
     *
     * @return the verdict, carrying the computed contract address
     * @throws com.codematch.core.error.VerificationTransportException if the call itself fails
     */
    Match verifyCreate2(ContractCandidate candidate, String deployerAddress, String salt,
                        List<String> constructorArgs);
}
