package de.arbeitsagentur.keycloak.vct.bdd.steps;

import de.arbeitsagentur.keycloak.vct.client.VctClient;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

public class VctClientFactory {
    private final RestTemplate restTemplate;

    public VctClientFactory(RestTemplate restTemplate) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
    }

    public VctClient create(String endpoint) {
        return new VctClient(endpoint, restTemplate);
    }
}
