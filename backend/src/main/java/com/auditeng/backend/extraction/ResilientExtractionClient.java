package com.auditeng.backend.extraction;

import com.auditeng.backend.config.ExtractionProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an {@link ExtractionSpec} against the vision model with retries, exponential backoff,
 * a rate-limit fallback model and a circuit breaker. Never throws: every outcome is an
 * {@link ExtractionResult}.
 */
public class ResilientExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientExtractionClient.class);

    static final String CIRCUIT_OPEN_ERROR = "Service temporarily unavailable (circuit breaker open)";

    private final VisionModelClient visionModelClient;
    private final ExtractionProperties properties;
    private final ModelCostTable costTable;
    private final CircuitBreaker circuitBreaker;
    private final ExtractionMetricsRecorder metricsRecorder;
    private final BackoffPolicy backoffPolicy;
    private final VisionDetail detail;
    private final Sleeper sleeper;

    public ResilientExtractionClient(VisionModelClient visionModelClient, ExtractionProperties properties,
            ModelCostTable costTable, CircuitBreaker circuitBreaker, ExtractionMetricsRecorder metricsRecorder) {
        this(visionModelClient, properties, costTable, circuitBreaker, metricsRecorder, Sleeper.THREAD);
    }

    ResilientExtractionClient(VisionModelClient visionModelClient, ExtractionProperties properties,
            ModelCostTable costTable, CircuitBreaker circuitBreaker, ExtractionMetricsRecorder metricsRecorder,
            Sleeper sleeper) {
        this.visionModelClient = visionModelClient;
        this.properties = properties;
        this.costTable = costTable;
        this.circuitBreaker = circuitBreaker;
        this.metricsRecorder = metricsRecorder;
        this.backoffPolicy = new BackoffPolicy(properties.initialRetryDelay(), properties.maxRetryDelay(),
                properties.retryMultiplier());
        this.detail = VisionDetail.parse(properties.visionDetail());
        this.sleeper = sleeper;
    }

    public <I, T> ExtractionResult<T> extract(ExtractionSpec<I, T> spec, I input) {
        long start = System.currentTimeMillis();
        List<String> images = spec.images(input);
        String userPrompt = spec.buildUserPrompt(input);
        String inputHash = hashInput(userPrompt);
        List<ChatMessage> messages = List.of(
                ChatMessage.system(spec.buildSystemPrompt(input)),
                ChatMessage.user(userPrompt, images));

        if (!circuitBreaker.tryAcquirePermission()) {
            metricsRecorder.recordRejected(spec.name());
            ExtractionMetrics metrics = ExtractionMetrics.builder()
                    .modelUsed(properties.model())
                    .imageCount(images.size())
                    .inputHash(inputHash)
                    .latencyMs(System.currentTimeMillis() - start)
                    .build();
            return ExtractionResult.failure(CIRCUIT_OPEN_ERROR, metrics);
        }

        String model = properties.model();
        Exception lastError = null;
        int attemptsMade = 0;

        for (int attempt = 0; attempt <= properties.maxRetries(); attempt++) {
            if (attempt > 0) {
                Duration delay = backoffPolicy.delayBeforeRetry(attempt);
                log.warn("[EXTRACTION] {} attempt {}/{} failed ({}), retrying in {}ms",
                        spec.name(), attempt, properties.maxRetries() + 1,
                        lastError != null ? lastError.getMessage() : "unknown", delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastError = e;
                    break;
                }
            }
            attemptsMade++;
            try {
                ChatCompletion completion = visionModelClient.complete(messages, model, detail,
                        properties.maxTokens(), properties.temperature());
                T data = spec.parseResponse(completion.getContent());

                long latency = System.currentTimeMillis() - start;
                ExtractionMetrics metrics = ExtractionMetrics.builder()
                        .inputTokens(completion.getPromptTokens())
                        .outputTokens(completion.getCompletionTokens())
                        .totalTokens(completion.getPromptTokens() + completion.getCompletionTokens())
                        .estimatedCost(costTable.estimate(model, completion.getPromptTokens(),
                                completion.getCompletionTokens(), images.size(), detail))
                        .latencyMs(latency)
                        .retryCount(attempt)
                        .modelUsed(model)
                        .imageCount(images.size())
                        .inputHash(inputHash)
                        .build();
                circuitBreaker.onSuccess(latency, TimeUnit.MILLISECONDS);
                metricsRecorder.record(spec.name(), true, metrics);
                log.debug("[EXTRACTION] {} succeeded with {} in {}ms ({} tokens)",
                        spec.name(), model, latency, metrics.getTotalTokens());
                return ExtractionResult.success(data, metrics);
            } catch (VisionModelException e) {
                lastError = e;
                model = switchOnRateLimit(e.isRateLimited(), model);
            } catch (RuntimeException e) {
                lastError = e;
                model = switchOnRateLimit(VisionModelException.isRateLimitMessage(e.getMessage()), model);
            }
        }

        long latency = System.currentTimeMillis() - start;
        ExtractionMetrics metrics = ExtractionMetrics.builder()
                .latencyMs(latency)
                .retryCount(Math.max(0, attemptsMade - 1))
                .modelUsed(model)
                .imageCount(images.size())
                .inputHash(inputHash)
                .build();
        circuitBreaker.onError(latency, TimeUnit.MILLISECONDS,
                lastError != null ? lastError : new IllegalStateException("extraction failed"));
        metricsRecorder.record(spec.name(), false, metrics);

        String error = lastError != null && lastError.getMessage() != null ? lastError.getMessage() : "Unknown error";
        log.error("[EXTRACTION] {} failed after {} attempts: {}", spec.name(), attemptsMade, error);
        return ExtractionResult.failure(error, metrics);
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    private String switchOnRateLimit(boolean rateLimited, String model) {
        if (rateLimited && !model.equals(properties.fallbackModel())) {
            log.warn("[EXTRACTION] Rate limited on {}, switching to fallback model {}", model, properties.fallbackModel());
            return properties.fallbackModel();
        }
        return model;
    }

    /**
     * Short stable fingerprint of the request, for log correlation.
     */
    static String hashInput(String text) {
        String head = text.length() > 100 ? text.substring(0, 100) : text;
        int hash = 0;
        for (int i = 0; i < head.length(); i++) {
            hash = 31 * hash + head.charAt(i);
        }
        return String.format("%08x", hash);
    }
}
