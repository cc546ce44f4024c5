package de.arbeitsagentur.keycloak.vct.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GetEntriesResponse(@JsonProperty("entries") List<LeafEntry> entries) {
    public GetEntriesResponse {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
