package com.auditeng.backend.rag;

import com.auditeng.backend.config.RagProperties;
import com.auditeng.backend.dto.IndexResult;
import com.auditeng.backend.dto.RagContext;
import com.auditeng.backend.dto.SearchQuery;
import com.auditeng.backend.dto.SearchResult;
import com.auditeng.backend.model.Analysis;
import com.auditeng.backend.model.ContentType;
import com.auditeng.backend.model.ExtractedField;
import com.auditeng.backend.model.Feedback;
import com.auditeng.backend.model.KnowledgeEmbedding;
import com.auditeng.backend.model.NonConformity;
import com.auditeng.backend.model.TestType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Retrieval over past analyses, reviewer corrections and technical standards, and indexing of new knowledge.
 * Failures here never propagate: searches degrade to no results and indexing reports a failed {@link IndexResult}.
 */
@Service
public class RagService {

    private static final Logger log = LoggerFactory.getLogger(RagService.class);

    static final double ANALYSIS_MIN_SIMILARITY = 0.65;
    static final double CORRECTION_MIN_SIMILARITY = 0.60;
    static final double STANDARD_MIN_SIMILARITY = 0.55;

    static final double ANALYSES_BUDGET_SHARE = 0.50;
    static final double CORRECTIONS_BUDGET_SHARE = 0.75;

    private static final int MAX_HIGHLIGHTED_FIELDS = 20;

    private final VoyageEmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final RagProperties properties;
    private final ObjectMapper objectMapper;

    public RagService(VoyageEmbeddingService embeddingService, VectorStore vectorStore,
            RagProperties properties, ObjectMapper objectMapper) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    // ========== SEARCH ==========

    /**
     * Entries ranked by cosine similarity to the query, at or above the similarity floor.
     */
    public List<SearchResult> search(SearchQuery query) {
        try {
            return search(embeddingService.embedQuery(query.getQuery()), query);
        } catch (RuntimeException e) {
            log.error("[RAG] Search failed: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    private List<SearchResult> search(EmbeddingResult embedding, SearchQuery query) {
        int limit = query.getLimit() != null ? query.getLimit() : properties.defaultLimit();
        double minSimilarity = query.getMinSimilarity() != null
                ? query.getMinSimilarity() : properties.defaultMinSimilarity();
        VectorFilter filter = VectorFilter.builder()
                .contentTypes(query.getContentTypes())
                .testType(query.getTestType())
                .verdict(query.getVerdict())
                .companyId(query.getCompanyId())
                .embeddingModel(embedding.getModel())
                .build();

        return vectorStore.nearest(embedding.getEmbedding(), limit, filter).stream()
                .filter(hit -> hit.similarity() >= minSimilarity)
                .map(RagService::toResult)
                .collect(Collectors.toList());
    }

    // ========== CONTEXT ==========

    public RagContext buildContext(String query, TestType testType, String companyId) {
        return buildContext(query, testType, companyId, properties.maxContextTokens());
    }

    /**
     * Selects similar analyses, corrections and standards for a prompt. Each category is filled greedily
     * until its cumulative share of the budget is reached: analyses up to 50%, with corrections up to 75%,
     * with standards up to 100%.
     */
    public RagContext buildContext(String query, TestType testType, String companyId, int maxTokens) {
        EmbeddingResult embedding;
        try {
            embedding = embeddingService.embedQuery(query);
        } catch (RuntimeException e) {
            log.error("[RAG] Could not embed context query: {}", e.getMessage());
            return RagContext.empty();
        }

        List<SearchResult> analyses = safeSearch(embedding, SearchQuery.builder()
                .contentTypes(List.of(ContentType.ANALYSIS_RESULT))
                .testType(testType)
                .companyId(companyId)
                .limit(properties.maxSimilarAnalyses())
                .minSimilarity(ANALYSIS_MIN_SIMILARITY)
                .build());
        List<SearchResult> corrections = safeSearch(embedding, SearchQuery.builder()
                .contentTypes(List.of(ContentType.MANUAL_CORRECTION))
                .testType(testType)
                .companyId(companyId)
                .limit(properties.maxCorrections())
                .minSimilarity(CORRECTION_MIN_SIMILARITY)
                .build());
        List<SearchResult> standards = safeSearch(embedding, SearchQuery.builder()
                .contentTypes(List.of(ContentType.TECHNICAL_STANDARD, ContentType.BEST_PRACTICE))
                .testType(testType)
                .companyId(companyId)
                .limit(properties.maxStandards())
                .minSimilarity(STANDARD_MIN_SIMILARITY)
                .build());

        int[] tokens = {0};
        List<SearchResult> selectedAnalyses = fill(analyses, tokens, (int) (maxTokens * ANALYSES_BUDGET_SHARE));
        List<SearchResult> selectedCorrections = fill(corrections, tokens, (int) (maxTokens * CORRECTIONS_BUDGET_SHARE));
        List<SearchResult> selectedStandards = fill(standards, tokens, maxTokens);

        log.info("[RAG] Context built: analyses={} corrections={} standards={} tokens={}",
                selectedAnalyses.size(), selectedCorrections.size(), selectedStandards.size(), tokens[0]);
        return RagContext.builder()
                .similarAnalyses(selectedAnalyses)
                .corrections(selectedCorrections)
                .standards(selectedStandards)
                .totalTokens(tokens[0])
                .build();
    }

    private List<SearchResult> safeSearch(EmbeddingResult embedding, SearchQuery query) {
        try {
            return search(embedding, query);
        } catch (RuntimeException e) {
            log.error("[RAG] Search for {} failed: {}", query.getContentTypes(), e.getMessage());
            return new ArrayList<>();
        }
    }

    private static List<SearchResult> fill(List<SearchResult> candidates, int[] tokens, int ceiling) {
        List<SearchResult> selected = new ArrayList<>();
        for (SearchResult candidate : candidates) {
            int cost = estimateTokens(candidate.getContent());
            if (tokens[0] + cost > ceiling) {
                break;
            }
            selected.add(candidate);
            tokens[0] += cost;
        }
        return selected;
    }

    /** Rough token count: one token per four characters, rounded up. */
    public static int estimateTokens(String text) {
        return text == null ? 0 : (text.length() + 3) / 4;
    }

    /**
     * Renders a context as a system-prompt section. Empty context renders as an empty string.
     */
    public String formatContextForPrompt(RagContext context) {
        if (context == null || context.isEmpty()) {
            return "";
        }
        StringBuilder prompt = new StringBuilder("## KNOWLEDGE FROM PREVIOUS AUDITS\n");
        if (!context.getSimilarAnalyses().isEmpty()) {
            prompt.append("\n### Similar past analyses (reference examples)\n");
            appendResults(prompt, context.getSimilarAnalyses(), true);
        }
        if (!context.getCorrections().isEmpty()) {
            prompt.append("\n### Reviewer corrections (do not repeat these mistakes)\n");
            appendResults(prompt, context.getCorrections(), false);
        }
        if (!context.getStandards().isEmpty()) {
            prompt.append("\n### Applicable technical standards\n");
            appendResults(prompt, context.getStandards(), false);
        }
        return prompt.toString().trim();
    }

    private static void appendResults(StringBuilder prompt, List<SearchResult> results, boolean withVerdict) {
        int n = 1;
        for (SearchResult result : results) {
            prompt.append('[').append(n++).append("] ");
            prompt.append(String.format(Locale.ROOT, "(similarity %.2f", result.getSimilarity()));
            if (withVerdict && result.getVerdict() != null) {
                prompt.append(", verdict ").append(result.getVerdict());
            }
            prompt.append(")\n").append(result.getContent()).append("\n\n");
        }
    }

    // ========== INDEXING ==========

    /**
     * Stores a completed analysis as ANALYSIS_RESULT knowledge.
     */
    public IndexResult indexAnalysis(Analysis analysis) {
        try {
            String content = buildAnalysisContent(analysis);
            EmbeddingResult embedding = embeddingService.embedDocument(content);

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("filename", analysis.getFilename());
            metadata.put("score", analysis.getScore());
            metadata.put("nonConformityCodes", analysis.getNonConformities().stream()
                    .map(NonConformity::getCode).collect(Collectors.toList()));
            metadata.put("severities", analysis.getNonConformities().stream()
                    .map(nc -> nc.getSeverity().name()).collect(Collectors.toList()));

            KnowledgeEmbedding saved = vectorStore.insert(KnowledgeEmbedding.builder()
                    .companyId(analysis.getCompanyId())
                    .analysisId(analysis.getId())
                    .contentType(ContentType.ANALYSIS_RESULT)
                    .testType(analysis.getTestType())
                    .verdict(analysis.getVerdict())
                    .content(content)
                    .embedding(embedding.getEmbedding())
                    .embeddingModel(embedding.getModel())
                    .metadata(metadata)
                    .build());
            log.info("[RAG] Indexed analysis {} as {}", analysis.getId(), saved.getId());
            return IndexResult.indexed(saved.getId(), embedding.getTokensUsed());
        } catch (RuntimeException e) {
            log.error("[RAG] Failed to index analysis {}: {}", analysis.getId(), e.getMessage());
            return IndexResult.failed(e.getMessage());
        }
    }

    static String buildAnalysisContent(Analysis analysis) {
        StringBuilder content = new StringBuilder();
        content.append(analysis.getTestType()).append(" Analysis - Verdict: ").append(analysis.getVerdict());
        if (analysis.getScore() != null) {
            content.append(" (score ").append(analysis.getScore()).append(')');
        }
        content.append('\n');
        if (analysis.getFilename() != null) {
            content.append("File: ").append(analysis.getFilename()).append('\n');
        }

        List<Map.Entry<String, ExtractedField<?>>> highlights = analysis.getExtraction().entrySet().stream()
                .filter(e -> e.getValue() != null && e.getValue().isPresent())
                .limit(MAX_HIGHLIGHTED_FIELDS)
                .collect(Collectors.toList());
        if (!highlights.isEmpty()) {
            content.append("\nExtracted data:\n");
            for (Map.Entry<String, ExtractedField<?>> field : highlights) {
                content.append("- ").append(field.getKey()).append(": ").append(field.getValue().getValue())
                        .append(String.format(Locale.ROOT, " (confidence %.2f)", field.getValue().getConfidence()))
                        .append('\n');
            }
        }

        content.append('\n');
        if (analysis.getNonConformities().isEmpty()) {
            content.append("No non-conformities found.");
        } else {
            content.append("Non-conformities:\n");
            for (NonConformity nc : analysis.getNonConformities()) {
                content.append("- [").append(nc.getSeverity()).append("] ").append(nc.getCode())
                        .append(": ").append(nc.getDescription()).append('\n');
            }
        }
        return content.toString().trim();
    }

    /**
     * Stores a reviewer correction as MANUAL_CORRECTION knowledge.
     */
    public IndexResult indexCorrection(Feedback feedback, TestType testType) {
        try {
            String content = buildCorrectionContent(feedback, testType);
            EmbeddingResult embedding = embeddingService.embedDocument(content);

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("feedbackId", feedback.getId());
            metadata.put("feedbackType", feedback.getFeedbackType().name());

            KnowledgeEmbedding saved = vectorStore.insert(KnowledgeEmbedding.builder()
                    .companyId(feedback.getCompanyId())
                    .analysisId(feedback.getAnalysisId())
                    .contentType(ContentType.MANUAL_CORRECTION)
                    .testType(testType)
                    .content(content)
                    .embedding(embedding.getEmbedding())
                    .embeddingModel(embedding.getModel())
                    .metadata(metadata)
                    .build());
            log.info("[RAG] Indexed correction {} for analysis {}", feedback.getId(), feedback.getAnalysisId());
            return IndexResult.indexed(saved.getId(), embedding.getTokensUsed());
        } catch (RuntimeException | JsonProcessingException e) {
            log.error("[RAG] Failed to index correction {}: {}", feedback.getId(), e.getMessage());
            return IndexResult.failed(e.getMessage());
        }
    }

    String buildCorrectionContent(Feedback feedback, TestType testType) throws JsonProcessingException {
        StringBuilder content = new StringBuilder();
        content.append("CORRECTION for ").append(testType).append(" Analysis\n");
        content.append("Type: ").append(feedback.getFeedbackType()).append("\n\n");
        content.append("Original (INCORRECT):\n")
                .append(objectMapper.writeValueAsString(feedback.getOriginalValue())).append("\n\n");
        content.append("Corrected (CORRECT):\n")
                .append(objectMapper.writeValueAsString(feedback.getCorrectedValue()));
        if (feedback.getExplanation() != null && !feedback.getExplanation().isBlank()) {
            content.append("\n\nExplanation: ").append(feedback.getExplanation());
        }
        return content.toString();
    }

    /**
     * Stores a global standard or best practice, one entry per applicable test type.
     */
    public List<IndexResult> indexStandard(StandardDocument standard) {
        List<IndexResult> results = new ArrayList<>();
        String content = "[" + standard.getName() + "] " + standard.getSection() + "\n\n" + standard.getContent();
        ContentType contentType = standard.getContentType() != null ? standard.getContentType() : ContentType.TECHNICAL_STANDARD;
        for (TestType testType : standard.getTestTypes()) {
            try {
                EmbeddingResult embedding = embeddingService.embedDocument(content);
                KnowledgeEmbedding saved = vectorStore.insert(KnowledgeEmbedding.builder()
                        .contentType(contentType)
                        .testType(testType)
                        .content(content)
                        .embedding(embedding.getEmbedding())
                        .embeddingModel(embedding.getModel())
                        .metadata(Map.of("standard", standard.getName(), "section", standard.getSection()))
                        .build());
                results.add(IndexResult.indexed(saved.getId(), embedding.getTokensUsed()));
            } catch (RuntimeException e) {
                log.error("[RAG] Failed to index standard {} for {}: {}", standard.getName(), testType, e.getMessage());
                results.add(IndexResult.failed(e.getMessage()));
            }
        }
        return results;
    }

    // ========== FEEDBACK LOOP ==========

    public void trackUsage(Collection<String> embeddingIds) {
        if (embeddingIds == null || embeddingIds.isEmpty()) {
            return;
        }
        try {
            vectorStore.incrementUseCount(embeddingIds);
        } catch (RuntimeException e) {
            log.warn("[RAG] Failed to track usage of {} entries: {}", embeddingIds.size(), e.getMessage());
        }
    }

    /**
     * Flags the ANALYSIS_RESULT entries of an analysis as incorrect so they stop being retrieved.
     */
    public int markAnalysisIncorrect(String analysisId) {
        try {
            List<KnowledgeEmbedding> entries = vectorStore.findByAnalysisId(analysisId, ContentType.ANALYSIS_RESULT);
            entries.forEach(entry -> vectorStore.markIncorrect(entry.getId()));
            log.info("[RAG] Marked {} entries of analysis {} as incorrect", entries.size(), analysisId);
            return entries.size();
        } catch (RuntimeException e) {
            log.warn("[RAG] Failed to mark analysis {} incorrect: {}", analysisId, e.getMessage());
            return 0;
        }
    }

    private static SearchResult toResult(ScoredEmbedding hit) {
        KnowledgeEmbedding entry = hit.entry();
        return SearchResult.builder()
                .id(entry.getId())
                .analysisId(entry.getAnalysisId())
                .content(entry.getContent())
                .contentType(entry.getContentType())
                .testType(entry.getTestType())
                .verdict(entry.getVerdict())
                .similarity(hit.similarity())
                .metadata(entry.getMetadata() != null ? entry.getMetadata() : new HashMap<>())
                .build();
    }
}
