package com.harvestlink.provenance.verification;

import com.harvestlink.provenance.identifier.IdentifierKind;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Answer to a verification request. Built fresh for every request.
 */
@Value
@Builder
public class VerificationResult {

    public static final String VERIFIED = "verified";
    public static final String NOT_FOUND_ON_LEDGER = "not found on ledger";
    public static final String UNKNOWN_IDENTIFIER = "unknown identifier";
    public static final String MALFORMED_IDENTIFIER = "malformed identifier";
    public static final String NO_ANCHORING_RECORDS = "no anchoring records";
    public static final String DATA_HASH_MISMATCH = "off-chain data does not match anchored hash";
    public static final String ANCHOR_NOT_CONFIRMED = "anchoring transaction not yet confirmed on ledger";

    boolean valid;
    IdentifierKind kind;
    Long id;
    ProvenanceRecord record;
    @Builder.Default
    List<CustodyEntry> custodyChain = List.of();
    SourceOfTruth sourceOfTruth;
    String message;
    @Builder.Default
    List<AnchorCheck> anchorChecks = List.of();

    static VerificationResult invalid(IdentifierKind kind, Long id, SourceOfTruth source, String message) {
        return VerificationResult.builder()
                .valid(false)
                .kind(kind)
                .id(id)
                .sourceOfTruth(source)
                .message(message)
                .build();
    }
}
