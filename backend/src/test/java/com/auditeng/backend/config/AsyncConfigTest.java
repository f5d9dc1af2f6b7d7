package com.auditeng.backend.config;

import com.auditeng.backend.dto.IndexResult;
import com.auditeng.backend.dto.SubmitFeedbackRequest;
import com.auditeng.backend.model.Analysis;
import com.auditeng.backend.model.AnalysisStatus;
import com.auditeng.backend.model.Feedback;
import com.auditeng.backend.model.FeedbackType;
import com.auditeng.backend.model.TestType;
import com.auditeng.backend.rag.RagService;
import com.auditeng.backend.repository.FeedbackRepository;
import com.auditeng.backend.service.AnalysisEventService;
import com.auditeng.backend.service.FeedbackService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AsyncConfigTest {

    private final AsyncConfig config = new AsyncConfig();
    private final CountDownLatch release = new CountDownLatch(1);
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (executor != null) {
            executor.shutdown();
        }
    }

    /** Occupies both worker threads and every queue slot until {@link #release} opens. */
    private void saturate(ThreadPoolTaskExecutor executor) {
        int tasks = executor.getMaxPoolSize() + AsyncConfig.FEEDBACK_QUEUE_CAPACITY;
        for (int i = 0; i < tasks; i++) {
            executor.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
    }

    @Test
    void feedbackExecutor_fullQueueStillIncorporatesCorrection() {
        // Given
        executor = config.feedbackExecutor();
        saturate(executor);

        FeedbackRepository feedbackRepository = mock(FeedbackRepository.class);
        when(feedbackRepository.save(any(Feedback.class))).thenAnswer(invocation -> {
            Feedback feedback = invocation.getArgument(0);
            feedback.setId("fb-1");
            return feedback;
        });
        RagService ragService = mock(RagService.class);
        when(ragService.indexCorrection(any(), any())).thenReturn(IndexResult.indexed("k1", 5));
        FeedbackService feedbackService = new FeedbackService(feedbackRepository, ragService,
                mock(AnalysisEventService.class), executor);

        // When
        Feedback feedback = feedbackService.submit(
                Analysis.builder().id("an-1").companyId("acme").testType(TestType.GROUNDING)
                        .status(AnalysisStatus.COMPLETED).build(),
                SubmitFeedbackRequest.builder()
                        .userId("reviewer")
                        .feedbackType(FeedbackType.FIELD_CORRECTION)
                        .originalValue(Map.of("resistance_ohms", 6.2))
                        .correctedValue(Map.of("resistance_ohms", 2.6))
                        .build());

        // Then
        assertTrue(feedback.isIncorporated());
        assertEquals("k1", feedback.getEmbeddingId());
        verify(ragService).indexCorrection(any(), eq(TestType.GROUNDING));
    }

    @Test
    void feedbackExecutor_rejectsAfterShutdown() {
        // Given
        executor = config.feedbackExecutor();
        executor.shutdown();

        // When / Then
        assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> { }));
    }
}
