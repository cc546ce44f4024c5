package de.arbeitsagentur.keycloak.vct.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GetSthConsistencyResponse(@JsonProperty("consistency") List<byte[]> consistency) {
    public GetSthConsistencyResponse {
        if (consistency == null) {
            consistency = List.of();
        }
    }
}
