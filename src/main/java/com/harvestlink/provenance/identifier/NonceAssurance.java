package com.harvestlink.provenance.identifier;

/**
 * How unguessable an issued nonce is.
 */
public enum NonceAssurance {
    /**
     * Drawn from a cryptographically strong random source.
     */
    STRONG,

    /**
     * Timestamp plus non-cryptographic randomness. Issued only when no
     * strong source could be obtained.
     */
    WEAK
}
