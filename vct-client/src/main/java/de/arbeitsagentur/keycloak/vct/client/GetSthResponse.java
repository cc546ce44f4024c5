package de.arbeitsagentur.keycloak.vct.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Signed tree head of the log.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GetSthResponse(
        @JsonProperty("tree_size") long treeSize,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("sha256_root_hash") byte[] sha256RootHash,
        @JsonProperty("tree_head_signature") byte[] treeHeadSignature
) {
}
