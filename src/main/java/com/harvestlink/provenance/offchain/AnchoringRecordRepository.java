package com.harvestlink.provenance.offchain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AnchoringRecordRepository extends JpaRepository<AnchoringRecordEntity, Long> {

    List<AnchoringRecordEntity> findByBatchIdOrderByRecordedAtAscIdAsc(Long batchId);

    List<AnchoringRecordEntity> findByTransactionHashIgnoreCase(String transactionHash);

    /**
     * Flips unverified anchors of a transaction to verified. Verified records
     * are never flipped back.
     */
    @Modifying
    @Query("UPDATE AnchoringRecordEntity a SET a.verified = true "
            + "WHERE LOWER(a.transactionHash) = LOWER(:hash) AND a.verified = false")
    int confirmByTransactionHash(@Param("hash") String transactionHash);
}
