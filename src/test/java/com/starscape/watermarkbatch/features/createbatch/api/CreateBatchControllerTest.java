package com.starscape.watermarkbatch.features.createbatch.api;

import com.starscape.watermarkbatch.common.exception.BusinessException;
import com.starscape.watermarkbatch.features.createbatch.api.dto.CreateBatchResponse;
import com.starscape.watermarkbatch.features.createbatch.api.dto.DocumentUploadTarget;
import com.starscape.watermarkbatch.features.createbatch.app.CreateBatchHandler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CreateBatchController.class)
class CreateBatchControllerTest {
    
    @Autowired
    private MockMvc mockMvc;
    
    @MockBean
    private CreateBatchHandler createBatchHandler;
    
    @Test
    void createsBatch() throws Exception {
        when(createBatchHandler.handle(any())).thenReturn(new CreateBatchResponse(
            "bat_1", "Contracts", "batch", "pending", List.of(
                new DocumentUploadTarget("itm_1", "a.pdf", "PUT", "https://upload", "dev/bat_1/itm_1.pdf"))));
        
        mockMvc.perform(post("/commands/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(validRequest("a.pdf", 1024, 50, "#ff0000")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.batchId").value("bat_1"))
            .andExpect(jsonPath("$.items[0].presignedUrl").value("https://upload"));
    }
    
    @Test
    void rejectsInvalidSettings() throws Exception {
        mockMvc.perform(post("/commands/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(validRequest("a.pdf", 1024, 150, "red")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details['settings.opacity']").exists())
            .andExpect(jsonPath("$.details['settings.color']").exists());
        
        verifyNoInteractions(createBatchHandler);
    }
    
    @Test
    void rejectsUnsupportedExtensionAndOversizedFile() throws Exception {
        mockMvc.perform(post("/commands/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(validRequest("photo.jpg", 60_000_000L, 50, "#ff0000")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details['files[0].filename']").exists())
            .andExpect(jsonPath("$.details['files[0].bytes']").exists());
    }
    
    @Test
    void rejectsEmptyFileList() throws Exception {
        mockMvc.perform(post("/commands/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"settings":{"text":"DRAFT","opacity":30,"fontSize":"small","color":"#000000"},"files":[]}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.files").exists());
    }
    
    @Test
    void businessRuleViolationIsBadRequest() throws Exception {
        when(createBatchHandler.handle(any())).thenThrow(
            new BusinessException("SINGLE_MODE_FILE_COUNT", "Single mode requires exactly one document, got 2"));
        
        mockMvc.perform(post("/commands/batches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(validRequest("a.pdf", 1024, 50, "#ff0000")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("SINGLE_MODE_FILE_COUNT"));
    }
    
    private static String validRequest(String filename, long bytes, int opacity, String color) {
        return """
            {
              "batchName": "Contracts",
              "mode": "batch",
              "settings": {"text": "CONFIDENTIAL", "opacity": %d, "fontSize": "medium", "color": "%s"},
              "files": [{"filename": "%s", "mimeType": "application/pdf", "bytes": %d}]
            }
            """.formatted(opacity, color, filename, bytes);
    }
}
