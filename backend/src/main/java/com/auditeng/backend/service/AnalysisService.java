package com.auditeng.backend.service;

import com.auditeng.backend.dto.CreateAnalysisRequest;
import com.auditeng.backend.dto.SubmitFeedbackRequest;
import com.auditeng.backend.extractor.ImageInputs;
import com.auditeng.backend.model.Analysis;
import com.auditeng.backend.model.AnalysisEvent;
import com.auditeng.backend.model.AnalysisEventType;
import com.auditeng.backend.model.AnalysisStatus;
import com.auditeng.backend.model.DocumentImage;
import com.auditeng.backend.model.Feedback;
import com.auditeng.backend.repository.AnalysisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for auditing reports: creation, cancellation, re-analysis and feedback.
 * Processing itself runs asynchronously in {@link AnalysisPipeline}.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    static final String INTERRUPTED_ERROR = "Processing interrupted by a restart";

    private final AnalysisRepository analysisRepository;
    private final AnalysisPipeline pipeline;
    private final AnalysisTaskRegistry taskRegistry;
    private final AnalysisEventService eventService;
    private final FeedbackService feedbackService;

    public AnalysisService(AnalysisRepository analysisRepository,
            AnalysisPipeline pipeline,
            AnalysisTaskRegistry taskRegistry,
            AnalysisEventService eventService,
            FeedbackService feedbackService) {
        this.analysisRepository = analysisRepository;
        this.pipeline = pipeline;
        this.taskRegistry = taskRegistry;
        this.eventService = eventService;
        this.feedbackService = feedbackService;
    }

    /**
     * Stores a new analysis and schedules its processing.
     *
     * @return the saved analysis, PENDING unless the executor refused it
     * @throws IllegalArgumentException when no image is given or an image is not a supported payload
     */
    public Analysis createAndProcess(CreateAnalysisRequest request) {
        validateImages(request.getImages());

        Analysis analysis = analysisRepository.save(Analysis.builder()
                .companyId(request.getCompanyId())
                .userId(request.getUserId())
                .testType(request.getTestType())
                .filename(request.getFilename())
                .images(new ArrayList<>(request.getImages()))
                .reportText(request.getReportText())
                .expectedTag(request.getExpectedTag())
                .expectedSerial(request.getExpectedSerial())
                .build());
        log.info("[PIPELINE] Created analysis {} | company={} testType={} images={}", analysis.getId(),
                analysis.getCompanyId(), analysis.getTestType(), analysis.getImages().size());
        eventService.record(analysis.getId(), AnalysisEventType.CREATED, "Analysis created",
                null, Map.of("filename", String.valueOf(analysis.getFilename()), "images", analysis.getImages().size()));

        return schedule(analysis);
    }

    /**
     * Cancels a pending or processing analysis. The running pipeline stops at its next checkpoint
     * and can no longer commit a result.
     */
    public Analysis cancel(String companyId, String analysisId) {
        Analysis current = findById(companyId, analysisId);
        Instant now = Instant.now();
        Analysis cancelled = analysisRepository.updateIfStatus(analysisId, AnalysisStatus.IN_FLIGHT, null,
                        new Update()
                                .set(Analysis.STATUS, AnalysisStatus.CANCELLED)
                                .set("cancelledAt", now)
                                .set("completedAt", now))
                .orElseThrow(() -> conflict(analysisId, "cancel"));

        boolean signalled = taskRegistry.cancel(analysisId);
        log.info("[PIPELINE] Analysis {} {} -> CANCELLED | runSignalled={}", analysisId, current.getStatus(),
                signalled);
        eventService.record(analysisId, AnalysisEventType.CANCELLED, "Analysis cancelled");
        return cancelled;
    }

    /**
     * Runs a finished analysis again under a new attempt number. Results of the previous attempt
     * are cleared.
     */
    public Analysis reanalyze(String companyId, String analysisId) {
        Analysis current = findById(companyId, analysisId);
        if (taskRegistry.isRunning(analysisId)) {
            throw new AnalysisConflictException(analysisId, current.getStatus(),
                    "Analysis " + analysisId + " is already being processed");
        }

        Update reset = new Update()
                .set(Analysis.STATUS, AnalysisStatus.PENDING)
                .inc(Analysis.ATTEMPT, 1)
                .set("extraction", Map.of())
                .set("nonConformities", List.of())
                .set("tokensConsumed", 0L)
                .set("estimatedCost", 0.0)
                .set("modelsUsed", List.of())
                .set("contextEmbeddingIds", List.of())
                .unset("verdict")
                .unset("score")
                .unset("overallConfidence")
                .unset("processingTimeMs")
                .unset("startedAt")
                .unset("completedAt")
                .unset("cancelledAt")
                .unset("errorMessage");
        Analysis pending = analysisRepository.updateIfStatus(analysisId, AnalysisStatus.REANALYZABLE, null, reset)
                .orElseThrow(() -> conflict(analysisId, "reanalyze"));

        log.info("[PIPELINE] Analysis {} {} -> PENDING | attempt={}", analysisId, current.getStatus(),
                pending.getAttempt());
        eventService.record(analysisId, AnalysisEventType.REANALYZE_REQUESTED, "Re-analysis requested",
                null, Map.of("attempt", pending.getAttempt()));
        return schedule(pending);
    }

    public Feedback submitFeedback(String companyId, String analysisId, SubmitFeedbackRequest request) {
        return feedbackService.submit(findById(companyId, analysisId), request);
    }

    public Analysis findById(String companyId, String analysisId) {
        return analysisRepository.findByIdAndCompanyId(analysisId, companyId)
                .orElseThrow(() -> new AnalysisNotFoundException(analysisId));
    }

    public List<Analysis> list(String companyId) {
        return analysisRepository.findByCompanyIdOrderByCreatedAtDesc(companyId);
    }

    public List<Analysis> list(String companyId, AnalysisStatus status) {
        return analysisRepository.findByCompanyIdAndStatus(companyId, status);
    }

    public List<AnalysisEvent> getEvents(String companyId, String analysisId) {
        return eventService.getEvents(findById(companyId, analysisId).getId());
    }

    /**
     * Runs left PENDING or PROCESSING by a previous process are gone; mark them FAILED so they can be
     * re-analyzed.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void failInterruptedRuns() {
        try {
            for (Analysis stale : analysisRepository.findByStatusIn(AnalysisStatus.IN_FLIGHT)) {
                if (taskRegistry.isRunning(stale.getId())) {
                    continue;
                }
                analysisRepository.updateIfStatus(stale.getId(), AnalysisStatus.IN_FLIGHT, stale.getAttempt(),
                                new Update()
                                        .set(Analysis.STATUS, AnalysisStatus.FAILED)
                                        .set("errorMessage", INTERRUPTED_ERROR)
                                        .set("completedAt", Instant.now()))
                        .ifPresent(failed -> {
                            log.warn("[PIPELINE] Analysis {} {} -> FAILED | interrupted", failed.getId(),
                                    stale.getStatus());
                            eventService.record(failed.getId(), AnalysisEventType.FAILED, "Processing failed",
                                    INTERRUPTED_ERROR, null);
                        });
            }
        } catch (RuntimeException e) {
            log.error("[PIPELINE] Failed to recover interrupted analyses: {}", e.getMessage());
        }
    }

    private Analysis schedule(Analysis analysis) {
        try {
            taskRegistry.submit(analysis.getId(), analysis.getAttempt(),
                    token -> pipeline.run(analysis.getId(), token));
            return analysis;
        } catch (RejectedExecutionException | AnalysisConflictException e) {
            log.error("[PIPELINE] Analysis {} could not be scheduled: {}", analysis.getId(), e.getMessage());
            String message = e instanceof RejectedExecutionException ? "Processing queue is full" : e.getMessage();
            eventService.record(analysis.getId(), AnalysisEventType.FAILED, "Processing failed", message, null);
            return analysisRepository.updateIfStatus(analysis.getId(), EnumSet.of(AnalysisStatus.PENDING),
                            analysis.getAttempt(),
                            new Update()
                                    .set(Analysis.STATUS, AnalysisStatus.FAILED)
                                    .set("errorMessage", message)
                                    .set("completedAt", Instant.now()))
                    .orElse(analysis);
        }
    }

    private AnalysisConflictException conflict(String analysisId, String operation) {
        AnalysisStatus status = analysisRepository.findById(analysisId).map(Analysis::getStatus).orElse(null);
        return new AnalysisConflictException(analysisId, status,
                "Cannot " + operation + " analysis " + analysisId + " in status " + status);
    }

    static void validateImages(List<DocumentImage> images) {
        if (images == null || images.isEmpty()) {
            throw new IllegalArgumentException("At least one image is required");
        }
        for (int i = 0; i < images.size(); i++) {
            DocumentImage image = images.get(i);
            if (image == null || image.getType() == null) {
                throw new IllegalArgumentException("Image " + i + " has no type");
            }
            if (!ImageInputs.isValid(image.getData())) {
                throw new IllegalArgumentException("Image " + i
                        + " is not an http(s) URL, an image data URL or base64");
            }
        }
    }
}
