package de.arbeitsagentur.keycloak.vct.bdd.mocklog;

import de.arbeitsagentur.keycloak.vct.client.AddVcResponse;
import de.arbeitsagentur.keycloak.vct.client.GetEntriesResponse;
import de.arbeitsagentur.keycloak.vct.client.GetEntryAndProofResponse;
import de.arbeitsagentur.keycloak.vct.client.GetProofByHashResponse;
import de.arbeitsagentur.keycloak.vct.client.GetSthConsistencyResponse;
import de.arbeitsagentur.keycloak.vct.client.GetSthResponse;
import de.arbeitsagentur.keycloak.vct.client.LeafEntry;
import de.arbeitsagentur.keycloak.vct.client.Rfc6962LeafHasher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Deque;
import java.util.List;

/**
 * In-memory stand-in for a transparency log. Submissions become part of the tree only after the
 * configured merge delay. Roots and proofs are shaped like the real ones but are not RFC 6962
 * Merkle proofs.
 */
@Component
@EnableConfigurationProperties(MockLogProperties.class)
public class MockLog {
    private static final byte[] SIGNATURE = "mock-log-signature".getBytes(StandardCharsets.UTF_8);
    private static final byte[] LOG_ID = "mock-log".getBytes(StandardCharsets.UTF_8);

    private final Duration mergeDelay;
    private final List<byte[]> leaves = new ArrayList<>();
    private final List<byte[]> leafHashes = new ArrayList<>();
    private final Deque<Pending> pending = new ArrayDeque<>();

    public MockLog(MockLogProperties properties) {
        this.mergeDelay = properties.mergeDelay();
    }

    public synchronized void reset() {
        leaves.clear();
        leafHashes.clear();
        pending.clear();
    }

    public synchronized void seed(int count) {
        for (int i = 0; i < count; i++) {
            append(("{\"seed\":" + (leaves.size() + 1) + "}").getBytes(StandardCharsets.UTF_8));
        }
    }

    public synchronized AddVcResponse add(byte[] credential) {
        if (credential == null || credential.length == 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "empty credential");
        }
        Instant now = Instant.now();
        pending.addLast(new Pending(credential.clone(), now.plus(mergeDelay)));
        return new AddVcResponse(0, LOG_ID, now.toEpochMilli(), "", SIGNATURE);
    }

    public synchronized GetSthResponse sth() {
        merge();
        return new GetSthResponse(leaves.size(), Instant.now().toEpochMilli(), root(leaves.size()), SIGNATURE);
    }

    public synchronized GetSthConsistencyResponse consistency(long first, long second) {
        merge();
        if (first < 0 || first > second || second > leaves.size()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "invalid consistency range %d..%d".formatted(first, second));
        }
        if (first == 0) {
            return new GetSthConsistencyResponse(List.of());
        }
        List<byte[]> path = new ArrayList<>();
        path.add(root((int) first));
        path.addAll(leafHashes.subList((int) first, (int) second));
        return new GetSthConsistencyResponse(path);
    }

    public synchronized GetEntriesResponse entries(long start, long end) {
        merge();
        if (start < 0 || end < start || start >= leaves.size()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "invalid entries range %d..%d".formatted(start, end));
        }
        long last = Math.min(end, leaves.size() - 1L);
        List<LeafEntry> entries = new ArrayList<>();
        for (long i = start; i <= last; i++) {
            entries.add(new LeafEntry(leaves.get((int) i), new byte[0]));
        }
        return new GetEntriesResponse(entries);
    }

    public synchronized GetProofByHashResponse proofByHash(String hash, long treeSize) {
        merge();
        checkTreeSize(treeSize);
        byte[] wanted;
        try {
            wanted = Base64.getDecoder().decode(hash);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "hash is not base64", e);
        }
        for (int i = 0; i < treeSize; i++) {
            if (Arrays.equals(leafHashes.get(i), wanted)) {
                return new GetProofByHashResponse(i, auditPath(i, (int) treeSize));
            }
        }
        throw new ResponseStatusException(HttpStatus.NOT_FOUND, "leaf not found");
    }

    public synchronized GetEntryAndProofResponse entryAndProof(long leafIndex, long treeSize) {
        merge();
        checkTreeSize(treeSize);
        if (leafIndex < 0 || leafIndex >= treeSize) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "leaf index %d outside tree of size %d".formatted(leafIndex, treeSize));
        }
        return new GetEntryAndProofResponse(leaves.get((int) leafIndex), new byte[0],
                auditPath((int) leafIndex, (int) treeSize));
    }

    private void checkTreeSize(long treeSize) {
        if (treeSize < 1 || treeSize > leaves.size()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "invalid tree size " + treeSize);
        }
    }

    private List<byte[]> auditPath(int leafIndex, int treeSize) {
        List<byte[]> path = new ArrayList<>();
        for (int i = 0; i < treeSize; i++) {
            if (i != leafIndex) {
                path.add(leafHashes.get(i));
            }
        }
        path.add(root(treeSize));
        return path;
    }

    private void merge() {
        Instant now = Instant.now();
        while (!pending.isEmpty() && !pending.peekFirst().mergeAt().isAfter(now)) {
            append(pending.removeFirst().credential());
        }
    }

    private void append(byte[] leaf) {
        leaves.add(leaf);
        leafHashes.add(Rfc6962LeafHasher.INSTANCE.hashLeaf(leaf));
    }

    private byte[] root(int treeSize) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (int i = 0; i < treeSize; i++) {
                digest.update(leafHashes.get(i));
            }
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record Pending(byte[] credential, Instant mergeAt) {
    }
}
