package com.starscape.watermarkbatch.features.createbatch.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.watermarkbatch.common.config.BatchProcessingProperties;
import com.starscape.watermarkbatch.common.exception.BusinessException;
import com.starscape.watermarkbatch.features.batches.domain.Batch;
import com.starscape.watermarkbatch.features.batches.domain.BatchItem;
import com.starscape.watermarkbatch.features.batches.domain.BatchMode;
import com.starscape.watermarkbatch.features.batches.domain.BatchRepository;
import com.starscape.watermarkbatch.features.createbatch.api.dto.CreateBatchRequest;
import com.starscape.watermarkbatch.features.createbatch.api.dto.CreateBatchResponse;
import com.starscape.watermarkbatch.features.createbatch.api.dto.DocumentUploadRequest;
import com.starscape.watermarkbatch.features.createbatch.api.dto.DocumentUploadTarget;
import com.starscape.watermarkbatch.features.createbatch.infra.S3PresignService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Registers a new pending batch with one queued item per document and hands out upload URLs.
 * Processing is started separately once the uploads are done.
 */
@Service
public class CreateBatchHandler {
    
    private static final Logger log = LoggerFactory.getLogger(CreateBatchHandler.class);
    
    private final BatchRepository batchRepository;
    private final S3PresignService s3PresignService;
    private final BatchProcessingProperties properties;
    private final ObjectMapper objectMapper;
    private final String environment;
    private final Clock clock;
    
    public CreateBatchHandler(
            BatchRepository batchRepository,
            S3PresignService s3PresignService,
            BatchProcessingProperties properties,
            ObjectMapper objectMapper,
            @Value("${spring.profiles.active:dev}") String environment) {
        this(batchRepository, s3PresignService, properties, objectMapper, environment, Clock.systemUTC());
    }
    
    CreateBatchHandler(
            BatchRepository batchRepository,
            S3PresignService s3PresignService,
            BatchProcessingProperties properties,
            ObjectMapper objectMapper,
            String environment,
            Clock clock) {
        this.batchRepository = batchRepository;
        this.s3PresignService = s3PresignService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        // Handle multiple profiles (comma-separated) by taking the first one
        this.environment = environment != null && environment.contains(",")
            ? environment.split(",")[0].trim()
            : (environment != null ? environment : "dev");
        this.clock = clock;
    }
    
    @Transactional
    public CreateBatchResponse handle(CreateBatchRequest request) {
        BatchMode mode = BatchMode.fromValue(request.mode());
        if (mode == BatchMode.SINGLE && request.files().size() != 1) {
            throw new BusinessException(
                "SINGLE_MODE_FILE_COUNT",
                "Single mode requires exactly one document, got " + request.files().size()
            );
        }
        
        for (DocumentUploadRequest file : request.files()) {
            if (!properties.isSupportedFormat(file.mimeType())) {
                throw new BusinessException(
                    "UNSUPPORTED_MIME_TYPE",
                    String.format("Unsupported MIME type: %s. Supported formats: %s",
                        file.mimeType(),
                        String.join(", ", properties.getSupportedFormats()))
                );
            }
            if (file.bytes() > properties.getMaxFileBytes()) {
                throw new BusinessException(
                    "FILE_TOO_LARGE",
                    String.format("%s is %d bytes, maximum is %d", file.filename(), file.bytes(), properties.getMaxFileBytes())
                );
            }
        }
        
        String batchId = "bat_" + UUID.randomUUID().toString().replace("-", "");
        String batchName = request.batchName() != null && !request.batchName().isBlank()
            ? request.batchName().trim()
            : defaultBatchName();
        
        Batch batch = new Batch(batchId, batchName, mode, serializeSettings(request));
        List<DocumentUploadTarget> targets = new ArrayList<>();
        
        for (DocumentUploadRequest file : request.files()) {
            String itemId = "itm_" + UUID.randomUUID().toString().replace("-", "");
            
            // Object key: env/batchId/itemId.ext
            String objectKey = String.format("%s/%s/%s%s",
                environment, batchId, itemId, extractExtension(file.filename()));
            
            batch.addItem(new BatchItem(itemId, file.filename(), file.mimeType(), file.bytes(), objectKey));
            
            var presigned = s3PresignService.presignDocumentUpload(objectKey, file.mimeType());
            targets.add(new DocumentUploadTarget(itemId, file.filename(), presigned.method(), presigned.url(), objectKey));
        }
        
        batchRepository.save(batch);
        
        log.info("Created batch {} ({}) with {} documents, mode={}", batchId, batchName, targets.size(), mode.value());
        return new CreateBatchResponse(batchId, batchName, mode.value(), batch.getStatus(), targets);
    }
    
    private String defaultBatchName() {
        return "Batch_" + LocalDate.now(clock) + "_" + clock.millis();
    }
    
    private String serializeSettings(CreateBatchRequest request) {
        try {
            return objectMapper.writeValueAsString(request.settings());
        } catch (JsonProcessingException e) {
            throw new BusinessException("INVALID_SETTINGS", "Watermark settings could not be stored: " + e.getOriginalMessage());
        }
    }
    
    private String extractExtension(String filename) {
        int lastDot = filename.lastIndexOf('.');
        return lastDot >= 0 ? filename.substring(lastDot).toLowerCase() : "";
    }
}
