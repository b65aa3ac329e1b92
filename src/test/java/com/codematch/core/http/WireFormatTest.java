package com.codematch.core.http;

import com.codematch.core.model.CandidateStatus;
import com.codematch.core.model.ContractCandidate;
import com.codematch.core.model.Match;
import com.codematch.core.model.SourceFile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WireFormatTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("files are sent base64 encoded")
    void filesBase64() {
        JsonNode array = WireFormat.files(mapper, List.of(SourceFile.ofText("A.sol", "hi")));

        assertEquals("A.sol", array.get(0).get("path").asText());
        assertEquals("aGk=", array.get(0).get("content").asText());
    }

    @Test
    @DisplayName("candidate JSON carries metadata and source bookkeeping")
    void candidateToJson() {
        var c = new ContractCandidate("Token", "Token.sol", "0.8.19", "{\"m\":1}",
                Map.of("Token.sol", "src"), List.of("Lib.sol"), List.of("Bad.sol"));

        JsonNode node = WireFormat.candidate(mapper, c);

        assertEquals("{\"m\":1}", node.get("metadata").asText());
        assertEquals("src", node.get("sources").get("Token.sol").asText());
        assertEquals("Lib.sol", node.get("missing").get(0).asText());
        assertEquals("Bad.sol", node.get("invalid").get(0).asText());
    }

    @Test
    @DisplayName("candidate is read from JSON, missing given as object keys")
    void candidateFromJson() throws Exception {
        JsonNode node = mapper.readTree("""
                {"name":"Token","compiledPath":"Token.sol","compilerVersion":"0.8.19",
                 "metadata":"{\\"m\\":1}","sources":{"Token.sol":"src"},
                 "missing":{"Lib.sol":{"keccak256":"0x1"}}}
                """);

        ContractCandidate c = WireFormat.candidate(node);

        assertEquals("Token", c.getName());
        assertEquals(Set.of("Lib.sol"), c.getMissingSources());
        assertTrue(c.getInvalidSources().isEmpty());
    }

    @Test
    @DisplayName("contract entry without metadata is rejected")
    void candidateWithoutMetadata() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> WireFormat.candidate(mapper.readTree("{\"name\":\"Token\"}")));
    }

    @Test
    @DisplayName("match falls back to the requested target and parses timestamps")
    void matchFromJson() throws Exception {
        Match match = WireFormat.match(
                mapper.readTree("{\"status\":\"partial\",\"storageTimestamp\":\"2024-01-01T00:00:00Z\"}"),
                "0xabc", "5");

        assertEquals(CandidateStatus.PARTIAL, match.status());
        assertEquals("0xabc", match.address());
        assertEquals("5", match.chainId());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), match.storageTimestamp());
    }

    @Test
    @DisplayName("malformed timestamp is rejected")
    void malformedTimestamp() throws Exception {
        JsonNode node = mapper.readTree("{\"status\":\"perfect\",\"storageTimestamp\":\"yesterday\"}");
        assertThrows(IllegalArgumentException.class, () -> WireFormat.match(node, "0xabc", "1"));
    }
}
