package com.starscape.watermarkbatch.features.createbatch.infra;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.PresignedPutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

import java.time.Duration;

/**
 * Issues presigned PUT URLs so clients upload documents straight to the bucket.
 */
@Service
public class S3PresignService {
    
    private final S3Presigner s3Presigner;
    private final String bucket;
    private final int presignDurationMinutes;
    
    public S3PresignService(
            S3Presigner s3Presigner,
            @Value("${aws.s3.bucket}") String bucket,
            @Value("${aws.s3.presign-duration-minutes:15}") int presignDurationMinutes) {
        this.s3Presigner = s3Presigner;
        this.bucket = bucket;
        this.presignDurationMinutes = presignDurationMinutes;
    }
    
    public PresignedUploadUrl presignDocumentUpload(String objectKey, String contentType) {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(objectKey)
                .contentType(contentType)
                .build();
        
        PutObjectPresignRequest presignRequest = PutObjectPresignRequest.builder()
                .signatureDuration(Duration.ofMinutes(presignDurationMinutes))
                .putObjectRequest(putRequest)
                .build();
        
        PresignedPutObjectRequest presigned = s3Presigner.presignPutObject(presignRequest);
        
        return new PresignedUploadUrl(
            presigned.url().toString(),
            "PUT",
            objectKey,
            presignDurationMinutes * 60
        );
    }
    
    public record PresignedUploadUrl(
        String url,
        String method,
        String key,
        int expiresInSeconds
    ) {}
}
