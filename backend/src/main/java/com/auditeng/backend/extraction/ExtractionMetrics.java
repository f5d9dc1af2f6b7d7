package com.auditeng.backend.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token, cost and retry accounting of one extraction call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionMetrics {
    private int inputTokens;
    private int outputTokens;
    private int totalTokens;
    private double estimatedCost;
    private long latencyMs;
    private int retryCount;
    private String modelUsed;
    private int imageCount;
    private String inputHash;
}
