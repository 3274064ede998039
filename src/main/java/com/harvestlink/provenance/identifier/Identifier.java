package com.harvestlink.provenance.identifier;

import lombok.Value;

/**
 * Decoded scan identifier.
 *
 * The nonce is an opaque per-issuance token. It makes every issued code
 * unique for audit purposes and is never used for authorization.
 * Legacy identifiers carry no nonce.
 */
@Value
public class Identifier {
    IdentifierKind kind;
    long id;
    String nonce;

    public static Identifier of(IdentifierKind kind, long id, String nonce) {
        if (kind == null) {
            throw new IllegalArgumentException("Identifier kind is required");
        }
        if (id < 0) {
            throw new IllegalArgumentException("Identifier id must be non-negative: " + id);
        }
        return new Identifier(kind, id, nonce);
    }

    public static Identifier legacy(IdentifierKind kind, long id) {
        return of(kind, id, null);
    }

    /**
     * Public identifiers are the nonce-bearing ones handed out on printed codes.
     */
    public boolean isPublic() {
        return nonce != null;
    }
}
