package com.auditeng.backend.rag;

import com.auditeng.backend.dto.EnhancedPrompt;
import com.auditeng.backend.dto.RagContext;
import com.auditeng.backend.dto.SearchResult;
import com.auditeng.backend.model.TestType;
import com.auditeng.backend.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Enriches extraction prompts with knowledge retrieved for the report being audited.
 */
@Component
public class RagPromptEnhancer {

    private static final Logger log = LoggerFactory.getLogger(RagPromptEnhancer.class);

    static final int MAX_QUERY_TEXT = 500;
    static final int MAX_CONTEXT_TOKENS = 3000;
    static final int MAX_COMMON_CODES = 3;

    private final RagService ragService;
    private final Executor executor;

    public RagPromptEnhancer(RagService ragService, @Qualifier("backgroundExecutor") Executor executor) {
        this.ragService = ragService;
        this.executor = executor;
    }

    /**
     * Builds prompt additions for a report. Retrieval failures produce an empty enhancement.
     */
    public EnhancedPrompt enhance(TestType testType, String reportText, String companyId) {
        String text = reportText != null ? reportText : "";
        String query = testType + " analysis: " + (text.length() > MAX_QUERY_TEXT ? text.substring(0, MAX_QUERY_TEXT) : text);

        RagContext context;
        try {
            context = ragService.buildContext(query, testType, companyId, MAX_CONTEXT_TOKENS);
        } catch (RuntimeException e) {
            log.warn("[RAG] Prompt enhancement skipped: {}", e.getMessage());
            return EnhancedPrompt.empty();
        }
        if (context.isEmpty()) {
            return EnhancedPrompt.empty();
        }

        List<String> ids = context.embeddingIds();
        trackUsageAsync(ids);

        return EnhancedPrompt.builder()
                .systemPromptAddition(ragService.formatContextForPrompt(context))
                .userPromptAddition(buildHints(context))
                .similarAnalysesCount(context.getSimilarAnalyses().size())
                .correctionsCount(context.getCorrections().size())
                .standardsCount(context.getStandards().size())
                .contextTokens(context.getTotalTokens())
                .embeddingIds(ids)
                .build();
    }

    static String buildHints(RagContext context) {
        List<String> hints = new ArrayList<>();

        boolean anyRejected = context.getSimilarAnalyses().stream()
                .anyMatch(result -> result.getVerdict() == Verdict.REJECTED);
        if (anyRejected) {
            hints.add("Similar reports were REJECTED in past audits; check the critical items carefully.");
        }

        List<String> commonCodes = commonNonConformityCodes(context.getSimilarAnalyses());
        if (!commonCodes.isEmpty()) {
            hints.add("Most common non-conformities in similar reports: " + String.join(", ", commonCodes) + ".");
        }

        if (!context.getCorrections().isEmpty()) {
            hints.add("Reviewers corrected " + context.getCorrections().size()
                    + " similar analyses; follow the corrections in the system context.");
        }
        return hints.isEmpty() ? "" : "## HINTS FROM PAST AUDITS\n- " + String.join("\n- ", hints);
    }

    static List<String> commonNonConformityCodes(List<SearchResult> analyses) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (SearchResult result : analyses) {
            Object codes = result.getMetadata().get("nonConformityCodes");
            if (codes instanceof List<?> list) {
                for (Object code : list) {
                    if (code != null) {
                        counts.merge(code.toString(), 1, Integer::sum);
                    }
                }
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(MAX_COMMON_CODES)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public static String buildEnhancedSystemPrompt(String basePrompt, EnhancedPrompt enhanced) {
        if (enhanced == null || enhanced.getSystemPromptAddition().isBlank()) {
            return basePrompt;
        }
        return basePrompt + "\n\n" + enhanced.getSystemPromptAddition();
    }

    public static String buildEnhancedUserPrompt(String basePrompt, EnhancedPrompt enhanced) {
        if (enhanced == null || enhanced.getUserPromptAddition().isBlank()) {
            return basePrompt;
        }
        return basePrompt + "\n\n" + enhanced.getUserPromptAddition();
    }

    private void trackUsageAsync(List<String> ids) {
        try {
            executor.execute(() -> ragService.trackUsage(ids));
        } catch (RejectedExecutionException e) {
            log.warn("[RAG] Usage tracking rejected: {}", e.getMessage());
        }
    }
}
