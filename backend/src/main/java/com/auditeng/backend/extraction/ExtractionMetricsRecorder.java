package com.auditeng.backend.extraction;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Publishes extraction request, token and cost counters to Micrometer.
 */
@Component
public class ExtractionMetricsRecorder {

    private final MeterRegistry meterRegistry;

    public ExtractionMetricsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void record(String extraction, boolean success, ExtractionMetrics metrics) {
        String model = metrics.getModelUsed() != null ? metrics.getModelUsed() : "unknown";
        Counter.builder("auditeng_extraction_requests_total")
                .description("Vision extraction calls")
                .tag("extraction", extraction)
                .tag("model_name", model)
                .tag("status", success ? "success" : "failure")
                .register(meterRegistry)
                .increment();
        Counter.builder("auditeng_extraction_retries_total")
                .description("Vision extraction retries")
                .tag("extraction", extraction)
                .register(meterRegistry)
                .increment(metrics.getRetryCount());
        if (metrics.getTotalTokens() > 0) {
            Counter.builder("auditeng_extraction_tokens_total")
                    .description("Tokens consumed by vision extraction")
                    .tag("model_name", model)
                    .register(meterRegistry)
                    .increment(metrics.getTotalTokens());
            Counter.builder("auditeng_extraction_cost_usd_total")
                    .description("Estimated vision extraction cost in USD")
                    .tag("model_name", model)
                    .register(meterRegistry)
                    .increment(metrics.getEstimatedCost());
        }
        Timer.builder("auditeng_extraction_latency")
                .description("Vision extraction latency including retries")
                .tag("extraction", extraction)
                .register(meterRegistry)
                .record(Duration.ofMillis(metrics.getLatencyMs()));
    }

    public void recordRejected(String extraction) {
        Counter.builder("auditeng_extraction_rejected_total")
                .description("Extraction calls refused while the circuit breaker was open")
                .tag("extraction", extraction)
                .register(meterRegistry)
                .increment();
    }
}
