package de.arbeitsagentur.keycloak.vct.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GetProofByHashResponse(
        @JsonProperty("leaf_index") long leafIndex,
        @JsonProperty("audit_path") List<byte[]> auditPath
) {
    public GetProofByHashResponse {
        if (auditPath == null) {
            auditPath = List.of();
        }
    }
}
