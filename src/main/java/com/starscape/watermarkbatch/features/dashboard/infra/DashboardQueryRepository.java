package com.starscape.watermarkbatch.features.dashboard.infra;

import com.starscape.watermarkbatch.features.batches.domain.Batch;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Read-only counts and listings behind the dashboard.
 */
@Repository
public interface DashboardQueryRepository extends JpaRepository<Batch, String> {
    
    long countByStatus(String status);
    
    long countByStatusIn(Collection<String> statuses);
    
    long countByCreatedAtGreaterThanEqual(Instant since);
    
    @Query("SELECT COUNT(b) FROM Batch b WHERE b.createdAt >= :from AND b.createdAt < :to")
    long countCreatedBetween(@Param("from") Instant from, @Param("to") Instant to);
    
    long countByStatusAndCreatedAtBefore(String status, Instant before);
    
    long countByStatusAndCreatedAtGreaterThanEqual(String status, Instant since);
    
    List<Batch> findAllByOrderByCreatedAtDesc(Pageable pageable);
    
    @Query("SELECT COUNT(i) FROM BatchItem i")
    long countItems();
    
    @Query("SELECT COUNT(i) FROM BatchItem i WHERE i.status = :status")
    long countItemsByStatus(@Param("status") String status);
    
    @Query("SELECT COUNT(i) FROM BatchItem i WHERE i.status = :status AND i.processedAt >= :since")
    long countItemsProcessedSince(@Param("status") String status, @Param("since") Instant since);
}
