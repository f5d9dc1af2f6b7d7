package com.auditeng.backend.service;

import com.auditeng.backend.dto.EnhancedPrompt;
import com.auditeng.backend.dto.IndexResult;
import com.auditeng.backend.extractor.BatchExtractionResult;
import com.auditeng.backend.extractor.BatchExtractor;
import com.auditeng.backend.extractor.EquipmentIdentification;
import com.auditeng.backend.extractor.ExtractionRequest;
import com.auditeng.backend.extractor.ImageExtraction;
import com.auditeng.backend.model.Analysis;
import com.auditeng.backend.model.AnalysisEventType;
import com.auditeng.backend.model.AnalysisStatus;
import com.auditeng.backend.model.DocumentImage;
import com.auditeng.backend.model.FieldNames;
import com.auditeng.backend.model.Inconsistency;
import com.auditeng.backend.model.NormalizedExtraction;
import com.auditeng.backend.rag.RagPromptEnhancer;
import com.auditeng.backend.rag.RagService;
import com.auditeng.backend.repository.AnalysisRepository;
import com.auditeng.backend.rules.EvaluationResult;
import com.auditeng.backend.rules.RulesEngine;
import com.auditeng.backend.validation.ConsistencyValidator;
import com.auditeng.backend.validation.ConsolidatedEvidence;
import com.auditeng.backend.validation.EvidenceConsolidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs one analysis end to end: retrieval, extraction, cross-validation, rules and indexing.
 * Every lifecycle write is a compare-and-set on status and attempt, so a cancelled analysis or a
 * superseded run is never overwritten.
 */
@Component
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final AnalysisRepository analysisRepository;
    private final AnalysisEventService eventService;
    private final RagPromptEnhancer promptEnhancer;
    private final BatchExtractor batchExtractor;
    private final EvidenceConsolidator consolidator;
    private final ConsistencyValidator validator;
    private final RulesEngine rulesEngine;
    private final RagService ragService;

    public AnalysisPipeline(AnalysisRepository analysisRepository,
            AnalysisEventService eventService,
            RagPromptEnhancer promptEnhancer,
            BatchExtractor batchExtractor,
            EvidenceConsolidator consolidator,
            ConsistencyValidator validator,
            RulesEngine rulesEngine,
            RagService ragService) {
        this.analysisRepository = analysisRepository;
        this.eventService = eventService;
        this.promptEnhancer = promptEnhancer;
        this.batchExtractor = batchExtractor;
        this.consolidator = consolidator;
        this.validator = validator;
        this.rulesEngine = rulesEngine;
        this.ragService = ragService;
    }

    public void run(String analysisId, CancellationToken token) {
        long start = System.currentTimeMillis();
        int attempt = token.attempt();

        Optional<Analysis> started = analysisRepository.updateIfStatus(analysisId,
                EnumSet.of(AnalysisStatus.PENDING), attempt,
                new Update().set(Analysis.STATUS, AnalysisStatus.PROCESSING).set("startedAt", Instant.now()));
        if (started.isEmpty()) {
            log.info("[PIPELINE] Analysis {} attempt {} no longer pending, run skipped", analysisId, attempt);
            return;
        }
        Analysis analysis = started.get();
        log.info("[PIPELINE] Analysis {} PENDING -> PROCESSING | attempt={} images={} testType={}",
                analysisId, attempt, analysis.getImages().size(), analysis.getTestType());
        eventService.record(analysisId, AnalysisEventType.PROCESSING, "Processing started",
                null, Map.of("attempt", attempt));

        try {
            process(analysis, token, start);
        } catch (RuntimeException e) {
            log.error("[PIPELINE] Analysis {} failed: {}", analysisId, e.getMessage(), e);
            fail(analysisId, attempt, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void process(Analysis analysis, CancellationToken token, long start) {
        String analysisId = analysis.getId();
        if (stop(analysisId, token)) {
            return;
        }

        EnhancedPrompt enhanced = promptEnhancer.enhance(analysis.getTestType(), analysis.getReportText(),
                analysis.getCompanyId());
        List<ExtractionRequest> requests = buildRequests(analysis, enhanced);

        BatchExtractionResult batch = batchExtractor.extract(analysisId, requests, token::isCancelled);
        if (batch.isCancelled() || stop(analysisId, token)) {
            return;
        }
        eventService.record(analysisId, AnalysisEventType.EXTRACTED,
                "Extracted " + batch.getSuccessfulImages() + "/" + batch.getTotalImages() + " images",
                null, Map.of(
                        "tokens", batch.getTotalTokens(),
                        "cost", batch.getTotalCost(),
                        "models", batch.getModelsUsed()));

        if (batch.getSuccessfulImages() == 0) {
            String reasons = batch.errors().stream()
                    .map(ImageExtraction::getError)
                    .distinct()
                    .collect(Collectors.joining("; "));
            fail(analysisId, token.attempt(), "No image could be extracted: " + reasons);
            return;
        }

        ConsolidatedEvidence evidence = consolidator.consolidate(analysis.getTestType(), batch);
        List<Inconsistency> inconsistencies = validator.validate(evidence);
        NormalizedExtraction merged = withEquipment(evidence.merged(), batch.getMergedEquipment());
        EvaluationResult evaluation = rulesEngine.evaluate(analysis.getTestType(), merged, inconsistencies);

        if (stop(analysisId, token)) {
            return;
        }

        Update complete = new Update()
                .set(Analysis.STATUS, AnalysisStatus.COMPLETED)
                .set("extraction", merged.asMap())
                .set("nonConformities", evaluation.getNonConformities())
                .set("verdict", evaluation.getVerdict())
                .set("score", evaluation.getScore())
                .set("overallConfidence", merged.averageConfidence())
                .set("tokensConsumed", batch.getTotalTokens())
                .set("estimatedCost", batch.getTotalCost())
                .set("processingTimeMs", System.currentTimeMillis() - start)
                .set("modelsUsed", batch.getModelsUsed())
                .set("contextEmbeddingIds", enhanced.getEmbeddingIds())
                .set("completedAt", Instant.now())
                .unset("errorMessage");
        Optional<Analysis> committed = analysisRepository.updateIfStatus(analysisId,
                EnumSet.of(AnalysisStatus.PROCESSING), token.attempt(), complete);
        if (committed.isEmpty()) {
            log.info("[PIPELINE] Analysis {} attempt {} result discarded: cancelled or superseded",
                    analysisId, token.attempt());
            return;
        }

        Analysis result = committed.get();
        log.info("[PIPELINE] Analysis {} PROCESSING -> COMPLETED | verdict={} score={} nonConformities={} tokens={}",
                analysisId, result.getVerdict(), result.getScore(), result.getNonConformities().size(),
                result.getTokensConsumed());
        eventService.record(analysisId, AnalysisEventType.COMPLETED, "Verdict " + result.getVerdict(),
                null, Map.of("score", result.getScore(), "nonConformities", result.getNonConformities().size()));

        IndexResult indexed = ragService.indexAnalysis(result);
        if (indexed.isSuccess()) {
            eventService.record(analysisId, AnalysisEventType.INDEXED, "Indexed for retrieval",
                    null, Map.of("embeddingId", indexed.getEmbeddingId()));
        }
    }

    static List<ExtractionRequest> buildRequests(Analysis analysis, EnhancedPrompt enhanced) {
        return analysis.getImages().stream()
                .map(image -> toRequest(analysis, image, enhanced))
                .collect(Collectors.toList());
    }

    private static ExtractionRequest toRequest(Analysis analysis, DocumentImage image, EnhancedPrompt enhanced) {
        return ExtractionRequest.builder()
                .image(image.getData())
                .imageType(image.getType())
                .testType(analysis.getTestType())
                .pageNumber(image.getPageNumber())
                .expectedTag(analysis.getExpectedTag())
                .expectedSerial(analysis.getExpectedSerial())
                .contextAddition(enhanced.getSystemPromptAddition())
                .userHints(enhanced.getUserPromptAddition())
                .build();
    }

    /**
     * The batch-level tag and serial replace the per-source merge when they were found.
     */
    static NormalizedExtraction withEquipment(NormalizedExtraction merged, EquipmentIdentification equipment) {
        NormalizedExtraction result = merged;
        if (equipment.getTag() != null && equipment.getTag().isPresent()) {
            result = result.with(FieldNames.EQUIPMENT_TAG, equipment.getTag());
        }
        if (equipment.getSerial() != null && equipment.getSerial().isPresent()) {
            result = result.with(FieldNames.EQUIPMENT_SERIAL, equipment.getSerial());
        }
        return result;
    }

    private boolean stop(String analysisId, CancellationToken token) {
        if (token.isCancelled()) {
            log.info("[PIPELINE] Analysis {} attempt {} cancelled, stopping", analysisId, token.attempt());
            return true;
        }
        return false;
    }

    private void fail(String analysisId, int attempt, String message) {
        Update failed = new Update()
                .set(Analysis.STATUS, AnalysisStatus.FAILED)
                .set("errorMessage", message)
                .set("completedAt", Instant.now());
        Optional<Analysis> updated = analysisRepository.updateIfStatus(analysisId, AnalysisStatus.IN_FLIGHT,
                attempt, failed);
        if (updated.isPresent()) {
            log.warn("[PIPELINE] Analysis {} -> FAILED | attempt={} error={}", analysisId, attempt, message);
            eventService.record(analysisId, AnalysisEventType.FAILED, "Processing failed", message, null);
        } else {
            log.info("[PIPELINE] Analysis {} attempt {} failure discarded: cancelled or superseded",
                    analysisId, attempt);
        }
    }
}
