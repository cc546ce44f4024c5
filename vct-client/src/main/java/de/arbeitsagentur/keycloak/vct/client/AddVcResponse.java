package de.arbeitsagentur.keycloak.vct.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AddVcResponse(
        @JsonProperty("svct_version") int svctVersion,
        @JsonProperty("id") byte[] id,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("extensions") String extensions,
        @JsonProperty("signature") byte[] signature
) {
}
