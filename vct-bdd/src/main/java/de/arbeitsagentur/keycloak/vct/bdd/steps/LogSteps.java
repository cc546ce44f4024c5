package de.arbeitsagentur.keycloak.vct.bdd.steps;

import de.arbeitsagentur.keycloak.vct.bdd.fixture.FixtureRegistry;
import de.arbeitsagentur.keycloak.vct.bdd.polling.Poller;
import de.arbeitsagentur.keycloak.vct.client.AddVcResponse;
import de.arbeitsagentur.keycloak.vct.client.GetEntryAndProofResponse;
import de.arbeitsagentur.keycloak.vct.client.GetProofByHashResponse;
import de.arbeitsagentur.keycloak.vct.client.GetSthResponse;
import de.arbeitsagentur.keycloak.vct.client.LeafEntry;
import de.arbeitsagentur.keycloak.vct.client.MerkleLeafHasher;
import de.arbeitsagentur.keycloak.vct.client.VctClient;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.PropertyResolver;

import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cucumber steps that drive a transparency log and check how its tree evolves.
 * <p>
 * One instance lives for one scenario. The baseline tree head is taken when connecting; the
 * polled steps compare against it and only update state after they succeed.
 */
public class LogSteps {
    private static final Logger LOG = LoggerFactory.getLogger(LogSteps.class);
    private static final Pattern SIGNED_INTEGER = Pattern.compile("0|-?[1-9][0-9]*");
    private static final Pattern UNSIGNED_INTEGER = Pattern.compile("0|[1-9][0-9]*");

    private final VctClientFactory clientFactory;
    private final FixtureRegistry fixtures;
    private final Poller poller;
    private final MerkleLeafHasher leafHasher;
    private final PropertyResolver placeholders;

    private VctClient vct;
    private GetSthResponse baseline;
    private List<LeafEntry> lastEntries;

    public LogSteps(VctClientFactory clientFactory, FixtureRegistry fixtures, Poller poller,
                    MerkleLeafHasher leafHasher, PropertyResolver placeholders) {
        this.clientFactory = clientFactory;
        this.fixtures = fixtures;
        this.poller = poller;
        this.leafHasher = leafHasher;
        this.placeholders = placeholders;
    }

    @Given("^VCT agent is running on \"([^\"]*)\"$")
    public void connect(String endpoint) {
        String resolved = placeholders.resolveRequiredPlaceholders(endpoint);
        VctClient client = clientFactory.create(resolved);
        GetSthResponse sth = client.getSth();
        this.vct = client;
        this.baseline = sth;
        LOG.info("Connected to {} at tree size {}", client.endpoint(), sth.treeSize());
    }

    @When("^Add verifiable credential \"([^\"]*)\" to Log$")
    public void addVerifiableCredential(String file) {
        byte[] credential = fixtures.read(file);
        AddVcResponse response = client().addVc(credential);
        LOG.info("Submitted {} ({} bytes), log timestamp {}", file, credential.length, response.timestamp());
    }

    @Then("^Retrieve latest signed tree head and check that tree_size is \"([^\"]*)\"$")
    public void checkTreeGrowth(String treeSize) {
        long expected = parseInteger(treeSize, SIGNED_INTEGER, "tree size");
        VctClient client = client();
        long start = baseline.treeSize();
        poller.poll("check tree size", () -> {
            GetSthResponse sth = client.getSth();
            long delta = sth.treeSize() - start;
            if (delta != expected) {
                throw new IllegalStateException("expected tree size %d, got %d".formatted(expected, delta));
            }
            return sth;
        });
    }

    @Then("^Retrieve merkle consistency proof between signed tree heads$")
    public void checkConsistencyProof() {
        VctClient client = client();
        long first = baseline.treeSize();
        poller.poll("check consistency proof", () -> {
            GetSthResponse sth = client.getSth();
            List<byte[]> consistency = client.getSthConsistency(first, sth.treeSize()).consistency();
            if (first != 0 && consistency.isEmpty()) {
                throw new IllegalStateException("no hash, expected greater than zero, got 0");
            }
            if (first == 0 && !consistency.isEmpty()) {
                throw new IllegalStateException("empty hash expected, got %d".formatted(consistency.size()));
            }
            return consistency;
        });
    }

    @Then("^Retrieve entries from log and check that len is \"([^\"]*)\"$")
    public void checkEntries(String lengths) {
        long expected = parseInteger(lengths, UNSIGNED_INTEGER, "entries length");
        VctClient client = client();
        long start = baseline.treeSize();
        this.lastEntries = poller.poll("check entries", () -> {
            GetSthResponse sth = client.getSth();
            List<LeafEntry> entries = client.getEntries(start, sth.treeSize()).entries();
            if (entries.size() != expected) {
                throw new IllegalStateException("no entries, expected %d, got %d".formatted(expected, entries.size()));
            }
            return entries;
        });
    }

    @Then("^Retrieve merkle audit proof from log by leaf hash for entry \"([^\"]*)\"$")
    public void checkAuditProofByHash(String idx) {
        LeafEntry entry = entry(parseIndex(idx));
        VctClient client = client();
        String hash = Base64.getEncoder().encodeToString(leafHasher.hashLeaf(entry.leafInput()));
        poller.poll("check audit proof by hash", () -> {
            GetSthResponse sth = client.getSth();
            GetProofByHashResponse proof = client.getProofByHash(hash, sth.treeSize());
            if (proof.auditPath().isEmpty()) {
                throw new IllegalStateException("no audit, expected greater than zero, got 0");
            }
            return proof;
        });
    }

    @Then("^Retrieve merkle audit proof from log by leaf index for entry \"([^\"]*)\"$")
    public void checkEntryAndProof(String idx) {
        int index = parseIndex(idx);
        LeafEntry entry = entry(index);
        VctClient client = client();
        long leafIndex = baseline.treeSize() + index - 1;
        poller.poll("check entry and proof", () -> {
            GetSthResponse sth = client.getSth();
            GetEntryAndProofResponse proof = client.getEntryAndProof(leafIndex, sth.treeSize());
            if (!Arrays.equals(proof.leafInput(), entry.leafInput())) {
                throw new IllegalStateException("leaf %d does not match entry %d".formatted(leafIndex, index));
            }
            if (proof.auditPath().isEmpty()) {
                throw new IllegalStateException("no audit, expected greater than zero, got 0");
            }
            return proof;
        });
    }

    public GetSthResponse baseline() {
        return baseline;
    }

    public List<LeafEntry> lastEntries() {
        return lastEntries == null ? List.of() : lastEntries;
    }

    private VctClient client() {
        if (vct == null) {
            throw new IllegalStateException("Not connected to a VCT agent");
        }
        return vct;
    }

    private LeafEntry entry(int index) {
        if (lastEntries == null) {
            throw new IllegalStateException("No entries retrieved yet");
        }
        if (index > lastEntries.size()) {
            throw new IllegalStateException("entry %d requested, but only %d entries were retrieved"
                    .formatted(index, lastEntries.size()));
        }
        return lastEntries.get(index - 1);
    }

    private static int parseIndex(String idx) {
        if (idx == null || !UNSIGNED_INTEGER.matcher(idx).matches()) {
            throw new IllegalArgumentException("parse index: not a decimal integer: \"%s\"".formatted(idx));
        }
        int index;
        try {
            index = Integer.parseInt(idx);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("parse index: " + e.getMessage(), e);
        }
        if (index < 1) {
            throw new IllegalArgumentException("parse index: entries are numbered from 1, got " + index);
        }
        return index;
    }

    private static long parseInteger(String value, Pattern format, String label) {
        if (value == null || !format.matcher(value).matches()) {
            throw new IllegalArgumentException("expected %s must be a decimal integer, got \"%s\"".formatted(label, value));
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected %s is out of range: %s".formatted(label, value), e);
        }
    }
}
