package de.arbeitsagentur.keycloak.vct.bdd.fixture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-only set of credential fixtures, keyed by file name. Loaded once and never modified.
 */
public final class FixtureRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(FixtureRegistry.class);

    private final Map<String, byte[]> fixtures;

    private FixtureRegistry(Map<String, byte[]> fixtures) {
        this.fixtures = Collections.unmodifiableMap(new TreeMap<>(fixtures));
    }

    public static FixtureRegistry load(String locationPattern) throws IOException {
        PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
        Resource[] resources = resolver.getResources(locationPattern);
        Map<String, byte[]> loaded = new TreeMap<>();
        for (Resource resource : resources) {
            String name = Objects.requireNonNull(resource.getFilename());
            try (InputStream is = resource.getInputStream()) {
                if (loaded.putIfAbsent(name, is.readAllBytes()) != null) {
                    LOG.warn("Ignoring duplicate fixture {} from {}", name, resource.getDescription());
                }
            }
        }
        if (loaded.isEmpty()) {
            throw new IllegalStateException("No fixtures found at " + locationPattern);
        }
        LOG.debug("Loaded {} fixtures from {}", loaded.size(), locationPattern);
        return new FixtureRegistry(loaded);
    }

    public static FixtureRegistry of(Map<String, byte[]> fixtures) {
        Map<String, byte[]> copy = new TreeMap<>();
        fixtures.forEach((name, content) -> copy.put(name, content.clone()));
        return new FixtureRegistry(copy);
    }

    public Set<String> names() {
        return fixtures.keySet();
    }

    public byte[] read(String name) {
        String key = normalize(name);
        byte[] content = fixtures.get(key);
        if (content == null) {
            throw new IllegalArgumentException("Unknown fixture '%s', available: %s".formatted(name, names()));
        }
        return content.clone();
    }

    private static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Fixture name is required");
        }
        Path path;
        try {
            path = Path.of(name.trim()).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid fixture name '%s'".formatted(name), e);
        }
        if (path.isAbsolute() || path.startsWith("..")) {
            throw new IllegalArgumentException("Fixture name '%s' points outside the fixture set".formatted(name));
        }
        return path.toString().replace('\\', '/');
    }
}
