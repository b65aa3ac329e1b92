package com.codematch.dispatch.api;

import com.codematch.core.engine.VerificationEngine;
import com.codematch.core.model.AddressStatus;
import com.codematch.core.model.CandidateStatus;
import com.codematch.core.model.Match;
import com.codematch.core.model.SourceFile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for session-less verification and stored-result status lookups.
 */
@RestController
@RequestMapping("/api/v1")
public class VerificationController {

    private final VerificationEngine engine;

    public VerificationController(VerificationEngine engine) {
        this.engine = engine;
    }

    /**
     * POST /api/v1/verify: Verifies the supplied files against one target.
     */
    @PostMapping("/verify")
    public ResponseEntity<Map<String, List<MatchResponse>>> verify(@RequestBody DirectVerifyRequest request) {
        List<SourceFile> files = toSourceFiles(request.files());
        Match match = engine.verifyDirect(request.address(), request.chainId(), files, request.chosenContract());
        return ResponseEntity.ok(Map.of("result", List.of(MatchResponse.from(match))));
    }

    /**
     * POST /api/v1/verify/create2: Verifies the supplied files against a CREATE2 deployment.
     */
    @PostMapping("/verify/create2")
    public ResponseEntity<Map<String, List<MatchResponse>>> verifyCreate2(@RequestBody Create2VerifyRequest request) {
        Match match = engine.verifyCreate2(request.deployerAddress(), request.salt(), request.constructorArgs(),
                toSourceFiles(request.files()), request.chosenContract());
        return ResponseEntity.ok(Map.of("result", List.of(MatchResponse.from(match))));
    }

    /**
     * GET /api/v1/check-by-addresses: Best stored status per address with the chains it matched on.
     */
    @GetMapping("/check-by-addresses")
    public ResponseEntity<List<Map<String, Object>>> checkByAddresses(@RequestParam String addresses,
                                                                      @RequestParam String chainIds) {
        Map<String, AddressStatus> statuses = engine.batchStatus(split(addresses), split(chainIds));
        List<Map<String, Object>> body = new ArrayList<>();
        for (AddressStatus status : statuses.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("address", status.address());
            entry.put("status", status.status().wireValue());
            if (status.isFound()) {
                entry.put("chainIds", status.matchingChainIds());
            }
            body.add(entry);
        }
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/check-all-by-addresses: Per-chain stored status for each address.
     */
    @GetMapping("/check-all-by-addresses")
    public ResponseEntity<List<Map<String, Object>>> checkAllByAddresses(@RequestParam String addresses,
                                                                         @RequestParam String chainIds) {
        Map<String, AddressStatus> statuses = engine.batchStatus(split(addresses), split(chainIds));
        List<Map<String, Object>> body = new ArrayList<>();
        for (AddressStatus status : statuses.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("address", status.address());
            if (status.isFound()) {
                entry.put("chainIds", status.chains().stream()
                        .map(c -> Map.of("chainId", c.chainId(), "status", c.status().wireValue()))
                        .toList());
            } else {
                entry.put("status", CandidateStatus.FALSE.wireValue());
            }
            body.add(entry);
        }
        return ResponseEntity.ok(body);
    }

    private static List<SourceFile> toSourceFiles(Map<String, String> contents) {
        List<SourceFile> files = new ArrayList<>();
        if (contents != null) {
            contents.forEach((path, content) ->
                    files.add(SourceFile.ofText(path, content != null ? content : "")));
        }
        return files;
    }

    private static List<String> split(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
