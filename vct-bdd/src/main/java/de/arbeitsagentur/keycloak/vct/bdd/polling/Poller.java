package de.arbeitsagentur.keycloak.vct.bdd.polling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Re-runs an attempt until it returns without throwing or the {@link RetryPolicy} is used up.
 * Any exception thrown by an attempt counts as an unmet condition.
 */
public class Poller {
    private static final Logger LOG = LoggerFactory.getLogger(Poller.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public Poller(RetryPolicy policy) {
        this(policy, Sleeper.THREAD);
    }

    public Poller(RetryPolicy policy, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public RetryPolicy policy() {
        return policy;
    }

    public <T> T poll(String description, Callable<T> attempt) {
        Exception lastFailure = null;
        for (int i = 1; i <= policy.maxAttempts(); i++) {
            try {
                T result = attempt.call();
                if (i > 1) {
                    LOG.debug("{} succeeded on attempt {}", description, i);
                }
                return result;
            } catch (Exception e) {
                lastFailure = e;
                LOG.debug("{} attempt {}/{} failed: {}", description, i, policy.maxAttempts(), e.getMessage());
            }
            if (i < policy.maxAttempts()) {
                try {
                    sleeper.sleep(policy.interval());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(description + ": interrupted while polling", e);
                }
            }
        }
        LOG.warn("{} gave up after {} attempts", description, policy.maxAttempts());
        throw new PollingException(description, policy.maxAttempts(), lastFailure);
    }
}
