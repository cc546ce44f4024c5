package de.arbeitsagentur.keycloak.vct.client;

/**
 * Computes the Merkle tree leaf hash the log uses to address an entry.
 */
@FunctionalInterface
public interface MerkleLeafHasher {
    byte[] hashLeaf(byte[] leafInput);
}
