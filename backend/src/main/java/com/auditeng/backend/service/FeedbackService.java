package com.auditeng.backend.service;

import com.auditeng.backend.dto.IndexResult;
import com.auditeng.backend.dto.SubmitFeedbackRequest;
import com.auditeng.backend.model.Analysis;
import com.auditeng.backend.model.AnalysisEventType;
import com.auditeng.backend.model.AnalysisStatus;
import com.auditeng.backend.model.Feedback;
import com.auditeng.backend.rag.RagService;
import com.auditeng.backend.repository.FeedbackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Records reviewer corrections and feeds them back into retrieval.
 */
@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final FeedbackRepository feedbackRepository;
    private final RagService ragService;
    private final AnalysisEventService eventService;
    private final Executor executor;

    public FeedbackService(FeedbackRepository feedbackRepository,
            RagService ragService,
            AnalysisEventService eventService,
            @Qualifier("feedbackExecutor") Executor executor) {
        this.feedbackRepository = feedbackRepository;
        this.ragService = ragService;
        this.eventService = eventService;
        this.executor = executor;
    }

    /**
     * Saves the correction and schedules its indexing. Only completed analyses accept feedback.
     */
    public Feedback submit(Analysis analysis, SubmitFeedbackRequest request) {
        if (analysis.getStatus() != AnalysisStatus.COMPLETED) {
            throw new AnalysisConflictException(analysis.getId(), analysis.getStatus(),
                    "Feedback requires a completed analysis, current status: " + analysis.getStatus());
        }

        Feedback feedback = feedbackRepository.save(Feedback.builder()
                .analysisId(analysis.getId())
                .companyId(analysis.getCompanyId())
                .userId(request.getUserId())
                .feedbackType(request.getFeedbackType())
                .originalValue(request.getOriginalValue())
                .correctedValue(request.getCorrectedValue())
                .explanation(request.getExplanation())
                .build());
        log.info("[RAG] Feedback {} received for analysis {} | type={}", feedback.getId(), analysis.getId(),
                feedback.getFeedbackType());
        eventService.record(analysis.getId(), AnalysisEventType.FEEDBACK_RECEIVED,
                "Feedback: " + feedback.getFeedbackType(), feedback.getExplanation(),
                Map.of("feedbackId", feedback.getId()));

        try {
            executor.execute(() -> incorporate(feedback, analysis));
        } catch (RejectedExecutionException e) {
            log.warn("[RAG] Feedback {} not incorporated, executor rejected the task: {}", feedback.getId(),
                    e.getMessage());
        }
        return feedback;
    }

    /**
     * Indexes the correction and marks the feedback incorporated. A correction of the verdict or a false
     * positive also stops the analysis from being retrieved as an example.
     */
    void incorporate(Feedback feedback, Analysis analysis) {
        if (feedback.getFeedbackType().invalidatesResult()) {
            ragService.markAnalysisIncorrect(analysis.getId());
        }

        IndexResult indexed = ragService.indexCorrection(feedback, analysis.getTestType());
        if (!indexed.isSuccess()) {
            return;
        }
        try {
            feedback.setIncorporated(true);
            feedback.setEmbeddingId(indexed.getEmbeddingId());
            feedback.setIncorporatedAt(Instant.now());
            feedbackRepository.save(feedback);
        } catch (RuntimeException e) {
            log.error("[RAG] Failed to mark feedback {} incorporated: {}", feedback.getId(), e.getMessage());
        }
    }

    public List<Feedback> findByAnalysis(String analysisId) {
        return feedbackRepository.findByAnalysisIdOrderByCreatedAtAsc(analysisId);
    }
}
