package de.arbeitsagentur.keycloak.vct.bdd.polling;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = interval -> Thread.sleep(interval.toMillis());

    void sleep(Duration interval) throws InterruptedException;
}
