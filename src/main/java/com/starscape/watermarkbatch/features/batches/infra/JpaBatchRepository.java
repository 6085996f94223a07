package com.starscape.watermarkbatch.features.batches.infra;

import com.starscape.watermarkbatch.features.batches.domain.Batch;
import com.starscape.watermarkbatch.features.batches.domain.BatchRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface JpaBatchRepository extends JpaRepository<Batch, String>, BatchRepository {
    
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Batch b SET b.status = :status, b.completedAt = :completedAt, b.updatedAt = :updatedAt " +
           "WHERE b.batchId = :batchId AND b.status NOT IN ('completed', 'failed')")
    int updateStatusUnlessTerminal(
        @Param("batchId") String batchId,
        @Param("status") String status,
        @Param("completedAt") Instant completedAt,
        @Param("updatedAt") Instant updatedAt);
}
