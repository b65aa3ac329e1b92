package com.codematch.matching;

import com.codematch.core.error.VerificationTransportException;
import com.codematch.core.http.JsonHttpClient;
import com.codematch.core.http.RemoteCallException;
import com.codematch.core.http.WireFormat;
import com.codematch.core.model.ContractCandidate;
import com.codematch.core.model.Match;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link VerificationService} backed by a remote matching service speaking JSON over HTTP.
 * <p>
 * Endpoints: {@code POST /verify}, {@code POST /verify/create2} and
 * {@code GET /matches?address=&chainId=}.
 * A 404 from the matches endpoint means no stored result.
 */
public class HttpVerificationService implements VerificationService {

    private final JsonHttpClient client;

    public HttpVerificationService(JsonHttpClient client) {
        this.client = client;
    }

    @Override
    public Match verify(String address, String chainId, ContractCandidate candidate) {
        ObjectNode body = client.mapper().createObjectNode();
        body.put("address", address);
        body.put("chainId", chainId);
        body.set("contract", WireFormat.candidate(client.mapper(), candidate));

        try {
            JsonNode response = client.post("/verify", body);
            return WireFormat.match(response, address, chainId);
        } catch (RemoteCallException e) {
            throw new VerificationTransportException(e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new VerificationTransportException("Malformed verify response: " + e.getMessage(), e);
        }
    }

    @Override
    public Match verifyCreate2(ContractCandidate candidate, String deployerAddress, String salt,
                               List<String> constructorArgs) {
        ObjectNode body = client.mapper().createObjectNode();
        body.put("deployerAddress", deployerAddress);
        body.put("salt", salt);
        ArrayNode args = body.putArray("constructorArgs");
        constructorArgs.forEach(args::add);
        body.set("contract", WireFormat.candidate(client.mapper(), candidate));

        try {
            JsonNode response = client.post("/verify/create2", body);
            return WireFormat.match(response, null, null);
        } catch (RemoteCallException e) {
            throw new VerificationTransportException(e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new VerificationTransportException("Malformed create2 response: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Match> findConfirmedMatches(String address, String chainId) {
        String query = "/matches?address=" + JsonHttpClient.encode(address)
                + (chainId != null ? "&chainId=" + JsonHttpClient.encode(chainId) : "");
        JsonNode response;
        try {
            response = client.get(query);
        } catch (RemoteCallException e) {
            if (e.getStatusCode() == 404) {
                return List.of();
            }
            throw new VerificationTransportException(e.getMessage(), e);
        }

        List<Match> matches = new ArrayList<>();
        JsonNode entries = response.isArray() ? response : response.path("matches");
        try {
            for (JsonNode entry : entries) {
                Match match = WireFormat.match(entry, address, chainId);
                if (match.isConfirmed()) {
                    matches.add(match);
                }
            }
        } catch (IllegalArgumentException e) {
            throw new VerificationTransportException("Malformed matches response: " + e.getMessage(), e);
        }
        return matches;
    }
}
