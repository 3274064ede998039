package com.harvestlink.provenance.verification;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a verification result was established: the ledger alone, or the
 * off-chain store checked against ledger anchors.
 */
public enum SourceOfTruth {
    LEDGER("ledger"),
    HYBRID("hybrid");

    private final String label;

    SourceOfTruth(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
