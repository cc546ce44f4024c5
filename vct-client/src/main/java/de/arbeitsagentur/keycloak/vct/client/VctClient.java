package de.arbeitsagentur.keycloak.vct.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * HTTP client for a verifiable credential transparency log bound to a single endpoint.
 * <p>
 * All calls are synchronous; timeouts are those of the supplied {@link RestTemplate}.
 */
public class VctClient {
    private static final Logger LOG = LoggerFactory.getLogger(VctClient.class);
    private static final String API_PREFIX = "/ct/v1/";

    private final String endpoint;
    private final RestTemplate restTemplate;

    public VctClient(String endpoint, RestTemplate restTemplate) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        this.endpoint = stripTrailingSlash(endpoint.trim());
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
    }

    public String endpoint() {
        return endpoint;
    }

    public GetSthResponse getSth() {
        URI uri = uri("get-sth");
        return call("get STH", () -> restTemplate.getForObject(uri, GetSthResponse.class));
    }

    public AddVcResponse addVc(byte[] credential) {
        if (credential == null || credential.length == 0) {
            throw new IllegalArgumentException("credential is required");
        }
        URI uri = uri("add-vc");
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<byte[]> request = new HttpEntity<>(credential, headers);
        return call("add VC", () -> restTemplate.exchange(uri, HttpMethod.POST, request, AddVcResponse.class).getBody());
    }

    public GetSthConsistencyResponse getSthConsistency(long first, long second) {
        if (first < 0 || second < first) {
            throw new IllegalArgumentException("invalid consistency range: first=%d, second=%d".formatted(first, second));
        }
        URI uri = uri("get-sth-consistency", "first", first, "second", second);
        return call("get STH consistency", () -> restTemplate.getForObject(uri, GetSthConsistencyResponse.class));
    }

    /**
     * Fetches the entries with indexes in {@code [start, end)}.
     */
    public GetEntriesResponse getEntries(long start, long end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid entries range: start=%d, end=%d".formatted(start, end));
        }
        if (start == end) {
            return new GetEntriesResponse(List.of());
        }
        URI uri = uri("get-entries", "start", start, "end", end - 1);
        return call("get entries", () -> restTemplate.getForObject(uri, GetEntriesResponse.class));
    }

    public GetProofByHashResponse getProofByHash(String hash, long treeSize) {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("hash is required");
        }
        URI uri = uri("get-proof-by-hash", "hash", hash, "tree_size", treeSize);
        return call("get proof by hash", () -> restTemplate.getForObject(uri, GetProofByHashResponse.class));
    }

    public GetEntryAndProofResponse getEntryAndProof(long leafIndex, long treeSize) {
        if (leafIndex < 0 || leafIndex >= treeSize) {
            throw new IllegalArgumentException("leaf index %d outside tree of size %d".formatted(leafIndex, treeSize));
        }
        URI uri = uri("get-entry-and-proof", "leaf_index", leafIndex, "tree_size", treeSize);
        return call("get entry and proof", () -> restTemplate.getForObject(uri, GetEntryAndProofResponse.class));
    }

    private URI uri(String operation, Object... query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(endpoint).path(API_PREFIX + operation);
        Map<String, Object> variables = new LinkedHashMap<>();
        for (int i = 0; i < query.length; i += 2) {
            String name = (String) query[i];
            builder.queryParam(name, "{" + name + "}");
            variables.put(name, query[i + 1]);
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }

    private <T> T call(String operation, Supplier<T> request) {
        LOG.debug("{} against {}", operation, endpoint);
        T response;
        try {
            response = request.get();
        } catch (RestClientResponseException e) {
            throw new VctClientException(operation, e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new VctClientException(operation, 0, null, e);
        }
        if (response == null) {
            throw new VctClientException(operation, 0, null, new IllegalStateException("empty response body"));
        }
        return response;
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
