package com.harvestlink.provenance.identifier;

import java.util.Optional;

/**
 * What a scan identifier points at.
 *
 * Each kind owns its short path segment (canonical form) and its
 * verbose segment (legacy /verify/... form).
 */
public enum IdentifierKind {
    PRODUCT("p", "product"),
    BATCH("b", "batch");

    private final String shortSegment;
    private final String legacySegment;

    IdentifierKind(String shortSegment, String legacySegment) {
        this.shortSegment = shortSegment;
        this.legacySegment = legacySegment;
    }

    public String getShortSegment() {
        return shortSegment;
    }

    public String getLegacySegment() {
        return legacySegment;
    }

    public static Optional<IdentifierKind> fromShortSegment(String segment) {
        for (IdentifierKind kind : values()) {
            if (kind.shortSegment.equals(segment)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static Optional<IdentifierKind> fromLegacySegment(String segment) {
        for (IdentifierKind kind : values()) {
            if (kind.legacySegment.equals(segment)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
