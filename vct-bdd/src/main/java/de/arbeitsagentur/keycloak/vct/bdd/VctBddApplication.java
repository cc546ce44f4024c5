package de.arbeitsagentur.keycloak.vct.bdd;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring context of the BDD steps. Cucumber boots it through {@code cucumber-spring}.
 */
@SpringBootApplication
public class VctBddApplication {
}
