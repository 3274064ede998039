package com.harvestlink.provenance.identifier;

import lombok.Value;

import java.time.Instant;

/**
 * Result of minting an identifier: the identifier, the URL to print on
 * the code, and how strong its nonce is.
 */
@Value
public class IssuedIdentifier {
    Identifier identifier;
    String url;
    NonceAssurance assurance;
    Instant issuedAt;

    public boolean isLowerAssurance() {
        return assurance == NonceAssurance.WEAK;
    }
}
