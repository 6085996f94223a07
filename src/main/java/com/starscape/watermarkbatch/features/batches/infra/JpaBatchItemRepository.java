package com.starscape.watermarkbatch.features.batches.infra;

import com.starscape.watermarkbatch.features.batches.domain.BatchItem;
import com.starscape.watermarkbatch.features.batches.domain.BatchItemRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaBatchItemRepository extends JpaRepository<BatchItem, String>, BatchItemRepository {
}
