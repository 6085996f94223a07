package com.starscape.watermarkbatch.features.createbatch.api;

import com.starscape.watermarkbatch.features.createbatch.api.dto.CreateBatchRequest;
import com.starscape.watermarkbatch.features.createbatch.api.dto.CreateBatchResponse;
import com.starscape.watermarkbatch.features.createbatch.app.CreateBatchHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/commands")
public class CreateBatchController {
    
    private final CreateBatchHandler createBatchHandler;
    
    public CreateBatchController(CreateBatchHandler createBatchHandler) {
        this.createBatchHandler = createBatchHandler;
    }
    
    @PostMapping("/batches")
    public ResponseEntity<CreateBatchResponse> createBatch(@Valid @RequestBody CreateBatchRequest request) {
        CreateBatchResponse response = createBatchHandler.handle(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
