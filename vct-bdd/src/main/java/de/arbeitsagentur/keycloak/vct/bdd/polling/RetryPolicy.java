package de.arbeitsagentur.keycloak.vct.bdd.polling;

import java.time.Duration;
import java.util.Objects;

/**
 * Constant interval between attempts, no jitter and no backoff.
 */
public record RetryPolicy(Duration interval, int maxAttempts) {
    public RetryPolicy {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static RetryPolicy fixed(Duration interval, int maxAttempts) {
        return new RetryPolicy(interval, maxAttempts);
    }
}
