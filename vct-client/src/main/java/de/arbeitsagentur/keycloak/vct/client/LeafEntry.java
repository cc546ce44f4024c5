package de.arbeitsagentur.keycloak.vct.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LeafEntry(
        @JsonProperty("leaf_input") byte[] leafInput,
        @JsonProperty("extra_data") byte[] extraData
) {
}
