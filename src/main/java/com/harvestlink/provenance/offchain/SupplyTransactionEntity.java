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

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only purchase record of an off-chain batch.
 */
@Entity
@Table(name = "supply_transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SupplyTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id", nullable = false, updatable = false)
    private Long batchId;

    @Column(nullable = false, updatable = false)
    private String buyer;

    @Column(nullable = false, updatable = false)
    private String seller;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(name = "total_price", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal totalPrice;

    @Column(nullable = false, updatable = false)
    private String status;

    @Column(name = "transaction_hash", updatable = false)
    private String transactionHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static SupplyTransactionEntity completed(long batchId, String buyer, String seller,
                                             BigDecimal quantity, BigDecimal totalPrice, String transactionHash) {
        return new SupplyTransactionEntity(null, batchId, buyer, seller, quantity, totalPrice,
                SupplyTransaction.STATUS_COMPLETED, transactionHash, null);
    }

    public SupplyTransaction toDomain() {
        return new SupplyTransaction(id, batchId, buyer, seller, quantity, totalPrice, status, transactionHash, createdAt);
    }
}
