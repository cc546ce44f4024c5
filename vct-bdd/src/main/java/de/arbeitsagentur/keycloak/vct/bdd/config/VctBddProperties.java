package de.arbeitsagentur.keycloak.vct.bdd.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@ConfigurationProperties(prefix = "vct.bdd")
@Validated
public record VctBddProperties(
        String endpoint,
        @NotNull Duration httpTimeout,
        @NotNull @Valid Retry retry,
        @NotBlank String fixtures
) {
    public VctBddProperties {
        if (httpTimeout == null) {
            httpTimeout = Duration.ofMinutes(1);
        }
        if (retry == null) {
            retry = new Retry(null, null);
        }
        if (fixtures == null || fixtures.isBlank()) {
            fixtures = "classpath*:testdata/*.json";
        }
    }

    public record Retry(@NotNull Duration interval, @NotNull @Min(1) Integer maxAttempts) {
        public Retry {
            if (interval == null) {
                interval = Duration.ofSeconds(1);
            }
            if (maxAttempts == null) {
                maxAttempts = 15;
            }
        }
    }
}
