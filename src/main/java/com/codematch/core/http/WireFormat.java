package com.codematch.core.http;

import com.codematch.core.model.CandidateStatus;
import com.codematch.core.model.ContractCandidate;
import com.codematch.core.model.Match;
import com.codematch.core.model.SourceFile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shapes exchanged with the validation and matching services.
 * File contents travel base64 encoded; resolved sources travel as plain text.
 */
public final class WireFormat {

    private WireFormat() {}

    public static ArrayNode files(ObjectMapper mapper, List<SourceFile> files) {
        ArrayNode array = mapper.createArrayNode();
        for (SourceFile file : files) {
            array.addObject()
                    .put("path", file.path())
                    .put("content", Base64.getEncoder().encodeToString(file.content()));
        }
        return array;
    }

    public static ObjectNode candidate(ObjectMapper mapper, ContractCandidate candidate) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", candidate.getName());
        node.put("compiledPath", candidate.getCompiledPath());
        node.put("compilerVersion", candidate.getCompilerVersion());
        node.put("metadata", candidate.getMetadataRaw());
        ObjectNode sources = node.putObject("sources");
        candidate.getResolvedSources().forEach(sources::put);
        ArrayNode missing = node.putArray("missing");
        candidate.getMissingSources().forEach(missing::add);
        ArrayNode invalid = node.putArray("invalid");
        candidate.getInvalidSources().forEach(invalid::add);
        return node;
    }

    public static ContractCandidate candidate(JsonNode node) {
        if (node == null || !node.hasNonNull("metadata")) {
            throw new IllegalArgumentException("Contract entry without metadata");
        }
        Map<String, String> sources = new LinkedHashMap<>();
        JsonNode sourcesNode = node.path("sources");
        sourcesNode.fieldNames().forEachRemaining(path -> sources.put(path, sourcesNode.get(path).asText()));
        return new ContractCandidate(
                text(node, "name"),
                text(node, "compiledPath"),
                text(node, "compilerVersion"),
                node.get("metadata").asText(),
                sources,
                strings(node.path("missing")),
                strings(node.path("invalid")));
    }

    public static Match match(JsonNode node, String address, String chainId) {
        String status = text(node, "status");
        return new Match(
                status != null ? CandidateStatus.fromWire(status) : null,
                node.hasNonNull("address") ? node.get("address").asText() : address,
                node.hasNonNull("chainId") ? node.get("chainId").asText() : chainId,
                text(node, "message"),
                instant(text(node, "storageTimestamp")));
    }

    public static Map<String, String> sourceMap(JsonNode node) {
        Map<String, String> sources = new LinkedHashMap<>();
        node.fieldNames().forEachRemaining(path -> sources.put(path, node.get(path).asText()));
        return sources;
    }

    /**
     * Accepts either a JSON array of strings or an object whose keys are the entries.
     */
    public static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> values.add(n.asText()));
        } else if (node.isObject()) {
            node.fieldNames().forEachRemaining(values::add);
        }
        return values;
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static Instant instant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed storageTimestamp: " + text, e);
        }
    }
}
