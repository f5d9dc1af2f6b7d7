package com.auditeng.backend.config;

import com.auditeng.backend.extraction.ExtractionMetricsRecorder;
import com.auditeng.backend.extraction.ModelCostTable;
import com.auditeng.backend.extraction.ResilientExtractionClient;
import com.auditeng.backend.extraction.VisionCircuitBreakers;
import com.auditeng.backend.extraction.VisionModelClient;
import com.auditeng.backend.extractor.BatchExtractor;
import com.auditeng.backend.extractor.DocumentExtractor;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class ExtractionConfig {

    @Bean
    public CircuitBreaker visionCircuitBreaker(ExtractionProperties properties) {
        return VisionCircuitBreakers.create("vision-extraction",
                properties.circuitBreaker().failureThreshold(),
                properties.circuitBreaker().resetWindow());
    }

    @Bean
    public ResilientExtractionClient resilientExtractionClient(VisionModelClient visionModelClient,
            ExtractionProperties properties, ModelCostTable costTable, CircuitBreaker visionCircuitBreaker,
            ExtractionMetricsRecorder metricsRecorder) {
        return new ResilientExtractionClient(visionModelClient, properties, costTable, visionCircuitBreaker,
                metricsRecorder);
    }

    @Bean
    public BatchExtractor batchExtractor(ResilientExtractionClient client, List<DocumentExtractor> extractors) {
        return new BatchExtractor(client, extractors);
    }
}
