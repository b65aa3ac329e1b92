package com.codematch.dispatch.api;

import com.codematch.core.model.SessionSnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * JSON view of a verification session.
 *
 * @param contracts one entry per contract candidate
 * @param unused    uploaded paths no contract claimed
 * @param newFiles  files newly admitted by the request; only present on uploads
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
    List<ContractResponse> contracts,
    List<String> unused,
    Integer newFiles
) {

    public record ContractResponse(
        String verificationId,
        String name,
        String compiledPath,
        String compilerVersion,
        String address,
        String chainId,
        Files files,
        String status,
        String statusMessage,
        Instant storageTimestamp
    ) {}

    public record Files(List<String> found, List<String> missing, List<String> invalid) {}

    public static SessionResponse from(SessionSnapshot snapshot) {
        return from(snapshot, null);
    }

    public static SessionResponse from(SessionSnapshot snapshot, Integer newFiles) {
        List<ContractResponse> contracts = snapshot.candidates().stream()
                .map(c -> new ContractResponse(
                        c.verificationId(), c.name(), c.compiledPath(), c.compilerVersion(),
                        c.address(), c.chainId(),
                        new Files(c.found(), c.missing(), c.invalid()),
                        c.status().wireValue(), c.statusMessage(), c.storageTimestamp()))
                .toList();
        return new SessionResponse(contracts, snapshot.unusedFiles(), newFiles);
    }
}
