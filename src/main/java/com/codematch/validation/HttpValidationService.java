package com.codematch.validation;

import com.codematch.core.error.ValidationFailureException;
import com.codematch.core.http.JsonHttpClient;
import com.codematch.core.http.RemoteCallException;
import com.codematch.core.http.WireFormat;
import com.codematch.core.model.ContractCandidate;
import com.codematch.core.model.SourceFile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link ValidationService} backed by a remote validation service speaking JSON over HTTP.
 * <p>
 * Endpoints: {@code POST /check-files}, {@code POST /use-all-sources},
 * {@code POST /fetch-missing}. Every failure surfaces as {@link ValidationFailureException}.
 */
public class HttpValidationService implements ValidationService {

    private static final Logger log = LoggerFactory.getLogger(HttpValidationService.class);

    private final JsonHttpClient client;

    public HttpValidationService(JsonHttpClient client) {
        this.client = client;
    }

    @Override
    public CheckedFiles checkFiles(List<SourceFile> files) {
        ObjectNode body = client.mapper().createObjectNode();
        body.set("files", WireFormat.files(client.mapper(), files));

        JsonNode response = call("check-files", () -> client.post("/check-files", body));
        List<ContractCandidate> candidates = new ArrayList<>();
        try {
            for (JsonNode contract : response.path("contracts")) {
                candidates.add(WireFormat.candidate(contract));
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationFailureException("Malformed check-files response: " + e.getMessage(), e);
        }
        List<String> unused = WireFormat.strings(response.path("unused"));
        log.debug("check-files: {} files -> {} contracts, {} unused", files.size(), candidates.size(), unused.size());
        return new CheckedFiles(candidates, unused);
    }

    @Override
    public ContractCandidate expandWithAllSources(ContractCandidate candidate, List<SourceFile> allFiles) {
        ObjectNode body = client.mapper().createObjectNode();
        body.set("contract", WireFormat.candidate(client.mapper(), candidate));
        body.set("files", WireFormat.files(client.mapper(), allFiles));

        JsonNode response = call("use-all-sources", () -> client.post("/use-all-sources", body));
        try {
            return WireFormat.candidate(response.has("contract") ? response.get("contract") : response);
        } catch (IllegalArgumentException e) {
            throw new ValidationFailureException("Malformed use-all-sources response: " + e.getMessage(), e);
        }
    }

    @Override
    public void fetchMissingSources(ContractCandidate candidate) {
        ObjectNode body = client.mapper().createObjectNode();
        body.set("contract", WireFormat.candidate(client.mapper(), candidate));

        JsonNode response = call("fetch-missing", () -> client.post("/fetch-missing", body));
        Map<String, String> fetched = WireFormat.sourceMap(response.path("sources"));
        fetched.forEach(candidate::resolveSource);
        log.info("Fetched {} of {} missing sources for {}", fetched.size(),
                fetched.size() + candidate.getMissingSources().size(), candidate.getName());
    }

    private JsonNode call(String operation, RemoteCall call) {
        try {
            return call.execute();
        } catch (RemoteCallException e) {
            throw new ValidationFailureException(
                    e.isClientError() ? e.getMessage() : "Validation service " + operation + " failed: " + e.getMessage(),
                    e);
        }
    }

    @FunctionalInterface
    private interface RemoteCall {
        JsonNode execute();
    }
}
