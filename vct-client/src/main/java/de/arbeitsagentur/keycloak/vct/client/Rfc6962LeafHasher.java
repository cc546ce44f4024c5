package de.arbeitsagentur.keycloak.vct.client;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 leaf hash with the RFC 6962 leaf prefix {@code 0x00}.
 */
public final class Rfc6962LeafHasher implements MerkleLeafHasher {
    public static final Rfc6962LeafHasher INSTANCE = new Rfc6962LeafHasher();

    private static final byte LEAF_PREFIX = 0x00;

    private Rfc6962LeafHasher() {
    }

    @Override
    public byte[] hashLeaf(byte[] leafInput) {
        if (leafInput == null) {
            throw new IllegalArgumentException("leaf input is required");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(LEAF_PREFIX);
            digest.update(leafInput);
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
