package com.harvestlink.provenance.offchain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "anchoring_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AnchoringRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id", nullable = false, updatable = false)
    private Long batchId;

    @Column(name = "transaction_hash", nullable = false, updatable = false)
    private String transactionHash;

    @Column(name = "block_number", nullable = false, updatable = false)
    private long blockNumber;

    @Column(name = "data_hash", nullable = false, updatable = false)
    private String dataHash;

    @Column(nullable = false)
    private boolean verified;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @PrePersist
    void onCreate() {
        this.recordedAt = Instant.now();
    }

    static AnchoringRecordEntity unverified(long batchId, String transactionHash, long blockNumber, String dataHash) {
        return new AnchoringRecordEntity(null, batchId, transactionHash, blockNumber, dataHash, false, null);
    }

    public AnchoringRecord toDomain() {
        return new AnchoringRecord(id, batchId, transactionHash, blockNumber, dataHash, verified, recordedAt);
    }
}
