package de.arbeitsagentur.keycloak.vct.client;

/**
 * Failure of a single log call. {@link #status()} is {@code 0} when no HTTP response was received.
 */
public class VctClientException extends RuntimeException {
    private final String operation;
    private final int status;
    private final String responseBody;

    public VctClientException(String operation, int status, String responseBody, Throwable cause) {
        super(buildMessage(operation, status, responseBody, cause), cause);
        this.operation = operation;
        this.status = status;
        this.responseBody = responseBody;
    }

    public String operation() {
        return operation;
    }

    public int status() {
        return status;
    }

    public String responseBody() {
        return responseBody;
    }

    private static String buildMessage(String operation, int status, String responseBody, Throwable cause) {
        if (status == 0) {
            return "%s: %s".formatted(operation, cause != null ? cause.getMessage() : "no response");
        }
        if (responseBody == null || responseBody.isBlank()) {
            return "%s: HTTP %d".formatted(operation, status);
        }
        return "%s: HTTP %d %s".formatted(operation, status, responseBody.strip());
    }
}
