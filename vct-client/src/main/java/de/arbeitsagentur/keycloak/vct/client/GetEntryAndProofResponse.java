package de.arbeitsagentur.keycloak.vct.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GetEntryAndProofResponse(
        @JsonProperty("leaf_input") byte[] leafInput,
        @JsonProperty("extra_data") byte[] extraData,
        @JsonProperty("audit_path") List<byte[]> auditPath
) {
    public GetEntryAndProofResponse {
        if (auditPath == null) {
            auditPath = List.of();
        }
    }
}
