package com.starscape.watermarkbatch;

import com.starscape.watermarkbatch.common.config.BatchProcessingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BatchProcessingProperties.class)
public class WatermarkBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatermarkBatchApplication.class, args);
    }
}
