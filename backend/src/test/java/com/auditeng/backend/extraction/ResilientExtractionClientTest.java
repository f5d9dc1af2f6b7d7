package com.auditeng.backend.extraction;

import com.auditeng.backend.config.ExtractionProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ResilientExtractionClientTest {

    private VisionModelClient visionModelClient;
    private SimpleMeterRegistry meterRegistry;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        visionModelClient = mock(VisionModelClient.class);
        meterRegistry = new SimpleMeterRegistry();
        sleeps = new ArrayList<>();
    }

    private ResilientExtractionClient client(int maxRetries, int failureThreshold, Duration resetWindow) {
        ExtractionProperties properties = new ExtractionProperties("gpt-4o", "gpt-4o-mini", maxRetries,
                Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10), null, "high", 4000, 0.0,
                new ExtractionProperties.CircuitBreaker(failureThreshold, resetWindow));
        CircuitBreaker breaker = VisionCircuitBreakers.create("test", failureThreshold, resetWindow);
        return new ResilientExtractionClient(visionModelClient, properties, new ModelCostTable(), breaker,
                new ExtractionMetricsRecorder(meterRegistry), sleeps::add);
    }

    private static ChatCompletion completion(String content, String model) {
        return ChatCompletion.builder().content(content).promptTokens(1000).completionTokens(200).model(model).build();
    }

    @Test
    void shouldReturnDataAndMetricsOnFirstSuccess() throws Exception {
        // Given
        when(visionModelClient.complete(anyList(), anyString(), any(), anyInt(), anyDouble()))
                .thenReturn(completion("{\"ok\":true}", "gpt-4o"));

        // When
        ExtractionResult<String> result = client(3, 5, Duration.ofSeconds(60)).extract(new EchoSpec(), "input");

        // Then
        assertTrue(result.isSuccess());
        assertEquals("{\"ok\":true}", result.getData());
        assertEquals(0, result.getMetrics().getRetryCount());
        assertEquals(1200, result.getMetrics().getTotalTokens());
        assertEquals("gpt-4o", result.getMetrics().getModelUsed());
        assertTrue(result.getMetrics().getEstimatedCost() > 0);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldRetryWithExponentialBackoffThenFail() throws Exception {
        // Given
        when(visionModelClient.complete(anyList(), anyString(), any(), anyInt(), anyDouble()))
                .thenThrow(new VisionModelException(500, "upstream error"));

        // When
        ExtractionResult<String> result = client(3, 5, Duration.ofSeconds(60)).extract(new EchoSpec(), "input");

        // Then
        assertFalse(result.isSuccess());
        assertEquals("upstream error", result.getError());
        assertEquals(3, result.getMetrics().getRetryCount());
        verify(visionModelClient, times(4)).complete(anyList(), anyString(), any(), anyInt(), anyDouble());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
        assertEquals(3.0, meterRegistry.counter("auditeng_extraction_retries_total", "extraction", "echo").count());
    }

    @Test
    void shouldSucceedAfterTransientFailures() throws Exception {
        // Given
        when(visionModelClient.complete(anyList(), anyString(), any(), anyInt(), anyDouble()))
                .thenThrow(new VisionModelException(503, "unavailable"))
                .thenThrow(new VisionModelException(503, "unavailable"))
                .thenReturn(completion("done", "gpt-4o"));

        // When
        ExtractionResult<String> result = client(3, 5, Duration.ofSeconds(60)).extract(new EchoSpec(), "input");

        // Then
        assertTrue(result.isSuccess());
        assertEquals(2, result.getMetrics().getRetryCount());
        assertEquals(2, sleeps.size());
    }

    @Test
    void shouldSwitchToFallbackModelWhenRateLimited() throws Exception {
        // Given
        when(visionModelClient.complete(anyList(), eq("gpt-4o"), any(), anyInt(), anyDouble()))
                .thenThrow(new VisionModelException(429, "Too Many Requests"));
        when(visionModelClient.complete(anyList(), eq("gpt-4o-mini"), any(), anyInt(), anyDouble()))
                .thenReturn(completion("fallback", "gpt-4o-mini"));

        // When
        ExtractionResult<String> result = client(3, 5, Duration.ofSeconds(60)).extract(new EchoSpec(), "input");

        // Then
        assertTrue(result.isSuccess());
        assertEquals("gpt-4o-mini", result.getMetrics().getModelUsed());
        assertEquals(1, result.getMetrics().getRetryCount());
        verify(visionModelClient).complete(anyList(), eq("gpt-4o"), any(), anyInt(), anyDouble());
        verify(visionModelClient).complete(anyList(), eq("gpt-4o-mini"), any(), anyInt(), anyDouble());
    }

    @Test
    void shouldRetryMalformedResponse() throws Exception {
        // Given
        when(visionModelClient.complete(anyList(), anyString(), any(), anyInt(), anyDouble()))
                .thenReturn(completion(EchoSpec.MALFORMED, "gpt-4o"))
                .thenReturn(completion("valid", "gpt-4o"));

        // When
        ExtractionResult<String> result = client(3, 5, Duration.ofSeconds(60)).extract(new EchoSpec(), "input");

        // Then
        assertTrue(result.isSuccess());
        assertEquals("valid", result.getData());
        assertEquals(1, result.getMetrics().getRetryCount());
    }

    @Test
    void shouldOpenCircuitAfterConsecutiveFailuresAndRejectWithoutCalling() throws Exception {
        // Given
        when(visionModelClient.complete(anyList(), anyString(), any(), anyInt(), anyDouble()))
                .thenThrow(new VisionModelException(500, "down"));
        ResilientExtractionClient client = client(0, 5, Duration.ofSeconds(60));

        // When
        for (int i = 0; i < 5; i++) {
            assertFalse(client.extract(new EchoSpec(), "input-" + i).isSuccess());
        }
        ExtractionResult<String> rejected = client.extract(new EchoSpec(), "input-6");

        // Then
        assertEquals(CircuitBreaker.State.OPEN, client.circuitState());
        assertFalse(rejected.isSuccess());
        assertEquals(ResilientExtractionClient.CIRCUIT_OPEN_ERROR, rejected.getError());
        verify(visionModelClient, times(5)).complete(anyList(), anyString(), any(), anyInt(), anyDouble());
        assertEquals(1.0, meterRegistry.counter("auditeng_extraction_rejected_total", "extraction", "echo").count());
    }

    @Test
    void shouldAllowTrialCallAfterResetWindowAndCloseOnSuccess() throws Exception {
        // Given
        when(visionModelClient.complete(anyList(), anyString(), any(), anyInt(), anyDouble()))
                .thenThrow(new VisionModelException(500, "down"))
                .thenThrow(new VisionModelException(500, "down"))
                .thenReturn(completion("recovered", "gpt-4o"));
        ResilientExtractionClient client = client(0, 2, Duration.ofMillis(50));
        client.extract(new EchoSpec(), "a");
        client.extract(new EchoSpec(), "b");
        assertEquals(CircuitBreaker.State.OPEN, client.circuitState());

        // When
        Thread.sleep(150);
        ExtractionResult<String> trial = client.extract(new EchoSpec(), "c");

        // Then
        assertTrue(trial.isSuccess());
        assertEquals(CircuitBreaker.State.CLOSED, client.circuitState());
    }

    @Test
    void shouldHashOnlyThePromptHead() {
        String head = "x".repeat(100);

        assertEquals(ResilientExtractionClient.hashInput(head),
                ResilientExtractionClient.hashInput(head + "different tail"));
        assertEquals(8, ResilientExtractionClient.hashInput("short").length());
    }

    private static final class EchoSpec implements ExtractionSpec<String, String> {

        static final String MALFORMED = "not json";

        @Override
        public String name() {
            return "echo";
        }

        @Override
        public String buildSystemPrompt(String input) {
            return "system";
        }

        @Override
        public String buildUserPrompt(String input) {
            return "extract " + input;
        }

        @Override
        public List<String> images(String input) {
            return List.of("https://example.com/" + input + ".jpg");
        }

        @Override
        public String parseResponse(String content) {
            if (MALFORMED.equals(content)) {
                throw new MalformedResponseException("Response is not JSON", null);
            }
            return content;
        }
    }
}
