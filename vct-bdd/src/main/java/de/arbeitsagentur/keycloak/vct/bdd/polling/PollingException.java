package de.arbeitsagentur.keycloak.vct.bdd.polling;

/**
 * Raised once every attempt of a polled condition has failed. The last failure is the cause.
 */
public class PollingException extends RuntimeException {
    private final int attempts;

    public PollingException(String description, int attempts, Throwable lastFailure) {
        super("%s: condition not met after %d attempts: %s".formatted(
                description, attempts, lastFailure != null ? lastFailure.getMessage() : "unknown"), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
