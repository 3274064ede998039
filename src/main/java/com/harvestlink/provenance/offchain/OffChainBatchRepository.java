package com.harvestlink.provenance.offchain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface OffChainBatchRepository extends JpaRepository<OffChainBatchEntity, Long> {

    Optional<OffChainBatchEntity> findByQrCode(String qrCode);

    boolean existsByBatchNumber(String batchNumber);

    /**
     * Loads a batch with its row locked until the surrounding transaction ends.
     * Purchases go through here so concurrent buyers cannot oversell.
     */
    @Query(value = """
        SELECT * FROM batches
        WHERE id = :id
        FOR UPDATE
        """, nativeQuery = true)
    Optional<OffChainBatchEntity> findByIdForUpdate(@Param("id") long id);
}
