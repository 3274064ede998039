package com.harvestlink.provenance.offchain;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SupplyTransactionRepository extends JpaRepository<SupplyTransactionEntity, Long> {

    List<SupplyTransactionEntity> findByBatchIdOrderByCreatedAtAscIdAsc(Long batchId);
}
