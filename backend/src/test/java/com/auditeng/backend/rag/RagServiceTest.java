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
import com.auditeng.backend.model.FeedbackType;
import com.auditeng.backend.model.KnowledgeEmbedding;
import com.auditeng.backend.model.NonConformity;
import com.auditeng.backend.model.Severity;
import com.auditeng.backend.model.TestType;
import com.auditeng.backend.model.Verdict;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RagServiceTest {

    private static final String COMPANY = "acme";

    private VoyageEmbeddingService embeddingService;
    private InMemoryVectorStore vectorStore;
    private RagService ragService;

    @BeforeEach
    void setUp() {
        embeddingService = mock(VoyageEmbeddingService.class);
        vectorStore = new InMemoryVectorStore();
        ragService = new RagService(embeddingService, vectorStore, RagProperties.defaults(), new ObjectMapper());

        EmbeddingResult unit = EmbeddingResult.builder().embedding(List.of(1.0, 0.0)).tokensUsed(10).build();
        when(embeddingService.embedQuery(anyString())).thenReturn(unit);
        when(embeddingService.embedDocument(anyString())).thenReturn(unit);
    }

    /** A unit vector whose cosine similarity to the query vector [1, 0] is exactly {@code similarity}. */
    private static List<Double> at(double similarity) {
        return List.of(similarity, Math.sqrt(1 - similarity * similarity));
    }

    private KnowledgeEmbedding store(ContentType type, String companyId, double similarity, String content) {
        return vectorStore.insert(KnowledgeEmbedding.builder()
                .companyId(companyId)
                .contentType(type)
                .testType(TestType.GROUNDING)
                .verdict(type == ContentType.ANALYSIS_RESULT ? Verdict.APPROVED : null)
                .content(content)
                .embedding(at(similarity))
                .build());
    }

    // ========== CONTEXT ==========

    @Test
    void buildContext_appliesPerCategorySimilarityFloors() {
        // Given
        store(ContentType.ANALYSIS_RESULT, COMPANY, 0.64, "weak analysis");
        store(ContentType.ANALYSIS_RESULT, COMPANY, 0.66, "close analysis");
        store(ContentType.MANUAL_CORRECTION, COMPANY, 0.59, "weak correction");
        store(ContentType.MANUAL_CORRECTION, COMPANY, 0.61, "close correction");
        store(ContentType.TECHNICAL_STANDARD, null, 0.54, "weak standard");
        store(ContentType.BEST_PRACTICE, null, 0.56, "close practice");

        // When
        RagContext context = ragService.buildContext("grounding", TestType.GROUNDING, COMPANY, 4000);

        // Then
        assertEquals(List.of("close analysis"), contents(context.getSimilarAnalyses()));
        assertEquals(List.of("close correction"), contents(context.getCorrections()));
        assertEquals(List.of("close practice"), contents(context.getStandards()));
        verify(embeddingService, times(1)).embedQuery(anyString());
    }

    @Test
    void buildContext_stopsAnalysesAtHalfTheBudget() {
        // Given ten analyses of 2000 tokens each
        String big = "x".repeat(8000);
        for (int i = 0; i < 10; i++) {
            store(ContentType.ANALYSIS_RESULT, COMPANY, 0.90 + i * 0.005, big);
        }

        // When
        RagContext context = ragService.buildContext("grounding", TestType.GROUNDING, COMPANY, 4000);

        // Then
        assertEquals(1, context.getSimilarAnalyses().size());
        assertEquals(2000, context.getTotalTokens());
    }

    @Test
    void buildContext_fillsCategoriesInOrderWithinCumulativeShares() {
        // Given analysis 400 tokens, correction 400 tokens, standard 300 tokens with a 1000 token budget
        store(ContentType.ANALYSIS_RESULT, COMPANY, 0.90, "a".repeat(1600));
        store(ContentType.MANUAL_CORRECTION, COMPANY, 0.90, "c".repeat(1600));
        store(ContentType.TECHNICAL_STANDARD, null, 0.90, "s".repeat(1200));

        // When
        RagContext context = ragService.buildContext("grounding", TestType.GROUNDING, COMPANY, 1000);

        // Then the correction would end at 800 > 750 and is skipped; the standard fits in the remainder
        assertEquals(1, context.getSimilarAnalyses().size());
        assertTrue(context.getCorrections().isEmpty());
        assertEquals(1, context.getStandards().size());
        assertEquals(700, context.getTotalTokens());
    }

    @Test
    void buildContext_mostSimilarFirst() {
        // Given
        store(ContentType.ANALYSIS_RESULT, COMPANY, 0.70, "second");
        store(ContentType.ANALYSIS_RESULT, COMPANY, 0.95, "first");
        store(ContentType.ANALYSIS_RESULT, COMPANY, 0.67, "third");

        // When
        RagContext context = ragService.buildContext("grounding", TestType.GROUNDING, COMPANY, 4000);

        // Then
        assertEquals(List.of("first", "second", "third"), contents(context.getSimilarAnalyses()));
        assertTrue(context.getSimilarAnalyses().get(0).getSimilarity() > 0.94);
    }

    @Test
    void buildContext_embeddingFailureGivesEmptyContext() {
        // Given
        store(ContentType.ANALYSIS_RESULT, COMPANY, 0.90, "analysis");
        when(embeddingService.embedQuery(anyString())).thenThrow(new IllegalStateException("voyage down"));

        // When
        RagContext context = ragService.buildContext("grounding", TestType.GROUNDING, COMPANY, 4000);

        // Then
        assertTrue(context.isEmpty());
        assertEquals(0, context.getTotalTokens());
    }

    // ========== SEARCH ==========

    @Test
    void search_tenantSeesOwnAndGlobalEntriesOnly() {
        // Given
        store(ContentType.ANALYSIS_RESULT, COMPANY, 0.90, "own");
        store(ContentType.ANALYSIS_RESULT, "other-co", 0.95, "foreign");
        store(ContentType.TECHNICAL_STANDARD, null, 0.80, "global");

        // When
        List<SearchResult> results = ragService.search(SearchQuery.builder()
                .query("grounding")
                .companyId(COMPANY)
                .minSimilarity(0.0)
                .build());

        // Then
        assertEquals(List.of("own", "global"), contents(results));
    }

    @Test
    void search_withoutCompanySeesOnlyGlobalEntries() {
        // Given
        store(ContentType.ANALYSIS_RESULT, COMPANY, 0.90, "own");
        store(ContentType.TECHNICAL_STANDARD, null, 0.80, "global");

        // When
        List<SearchResult> results = ragService.search(SearchQuery.builder()
                .query("grounding")
                .minSimilarity(0.0)
                .build());

        // Then
        assertEquals(List.of("global"), contents(results));
    }

    @Test
    void search_defaultFloorAndLimitComeFromProperties() {
        // Given seven entries above 0.70 and one below
        for (int i = 0; i < 7; i++) {
            store(ContentType.TECHNICAL_STANDARD, null, 0.75 + i * 0.02, "standard " + i);
        }
        store(ContentType.TECHNICAL_STANDARD, null, 0.69, "below floor");

        // When
        List<SearchResult> results = ragService.search(SearchQuery.builder().query("grounding").build());

        // Then
        assertEquals(5, results.size());
        assertFalse(contents(results).contains("below floor"));
        assertEquals("standard 6", results.get(0).getContent());
    }

    @Test
    void search_filtersByContentTypeAndVerdict() {
        // Given
        store(ContentType.ANALYSIS_RESULT, COMPANY, 0.90, "approved analysis");
        vectorStore.insert(KnowledgeEmbedding.builder()
                .companyId(COMPANY)
                .contentType(ContentType.ANALYSIS_RESULT)
                .testType(TestType.GROUNDING)
                .verdict(Verdict.REJECTED)
                .content("rejected analysis")
                .embedding(at(0.85))
                .build());
        store(ContentType.MANUAL_CORRECTION, COMPANY, 0.95, "correction");

        // When
        List<SearchResult> results = ragService.search(SearchQuery.builder()
                .query("grounding")
                .companyId(COMPANY)
                .contentTypes(List.of(ContentType.ANALYSIS_RESULT))
                .verdict(Verdict.REJECTED)
                .minSimilarity(0.0)
                .build());

        // Then
        assertEquals(List.of("rejected analysis"), contents(results));
    }

    @Test
    void search_embeddingFailureReturnsEmptyList() {
        // Given
        when(embeddingService.embedQuery(anyString())).thenThrow(new IllegalStateException("timeout"));

        // When
        List<SearchResult> results = ragService.search(SearchQuery.builder().query("grounding").build());

        // Then
        assertTrue(results.isEmpty());
    }

    @Test
    void search_comparesOnlyEntriesOfTheQueryModel() {
        // Given
        vectorStore.insert(KnowledgeEmbedding.builder()
                .companyId(COMPANY)
                .contentType(ContentType.ANALYSIS_RESULT)
                .content("voyage entry")
                .embedding(at(0.90))
                .embeddingModel("voyage-3-lite")
                .build());
        vectorStore.insert(KnowledgeEmbedding.builder()
                .companyId(COMPANY)
                .contentType(ContentType.ANALYSIS_RESULT)
                .content("local entry")
                .embedding(at(0.95))
                .embeddingModel(LocalEmbeddings.MODEL)
                .build());
        when(embeddingService.embedQuery(anyString())).thenReturn(EmbeddingResult.builder()
                .embedding(List.of(1.0, 0.0)).model("voyage-3-lite").build());

        // When
        List<SearchResult> results = ragService.search(SearchQuery.builder()
                .query("grounding").companyId(COMPANY).minSimilarity(0.0).build());

        // Then
        assertEquals(List.of("voyage entry"), contents(results));
    }

    // ========== INDEXING ==========

    @Test
    void indexAnalysis_storesResultWithCodesAndVerdict() {
        // Given
        Analysis analysis = completedAnalysis("an-1");

        // When
        IndexResult result = ragService.indexAnalysis(analysis);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(10, result.getTokensUsed());
        List<KnowledgeEmbedding> stored = vectorStore.findByAnalysisId("an-1", ContentType.ANALYSIS_RESULT);
        assertEquals(1, stored.size());
        KnowledgeEmbedding entry = stored.get(0);
        assertEquals(result.getEmbeddingId(), entry.getId());
        assertEquals(COMPANY, entry.getCompanyId());
        assertEquals(Verdict.REJECTED, entry.getVerdict());
        assertEquals(TestType.GROUNDING, entry.getTestType());
        assertEquals(List.of("GND-001"), entry.getMetadata().get("nonConformityCodes"));
        assertEquals(List.of("CRITICAL"), entry.getMetadata().get("severities"));
        assertTrue(entry.isWasCorrect());
    }

    @Test
    void indexAnalysis_embeddingFailureReportsFailure() {
        // Given
        when(embeddingService.embedDocument(anyString())).thenThrow(new IllegalStateException("quota"));

        // When
        IndexResult result = ragService.indexAnalysis(completedAnalysis("an-2"));

        // Then
        assertFalse(result.isSuccess());
        assertEquals("quota", result.getError());
        assertEquals(0, vectorStore.countByContentType(ContentType.ANALYSIS_RESULT));
    }

    @Test
    void indexAnalysis_recordsEmbeddingModel() {
        // Given
        when(embeddingService.embedDocument(anyString())).thenReturn(EmbeddingResult.builder()
                .embedding(List.of(1.0, 0.0)).tokensUsed(12).model("voyage-3-lite").build());

        // When
        IndexResult result = ragService.indexAnalysis(completedAnalysis("an-4"));

        // Then
        assertTrue(result.isSuccess());
        assertEquals("voyage-3-lite",
                vectorStore.findByAnalysisId("an-4", ContentType.ANALYSIS_RESULT).get(0).getEmbeddingModel());
    }

    @Test
    void indexAnalysis_providerOutageStoresNothing() {
        // Given
        when(embeddingService.embedDocument(anyString())).thenThrow(
                new EmbeddingUnavailableException("Voyage AI embedding failed: connection refused", null));

        // When
        IndexResult result = ragService.indexAnalysis(completedAnalysis("an-5"));

        // Then
        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("connection refused"));
        assertTrue(vectorStore.findByAnalysisId("an-5", ContentType.ANALYSIS_RESULT).isEmpty());
    }

    @Test
    void buildAnalysisContent_listsPresentFieldsAndNonConformities() {
        // Given
        Analysis analysis = completedAnalysis("an-3");

        // When
        String content = RagService.buildAnalysisContent(analysis);

        // Then
        assertTrue(content.startsWith("GROUNDING Analysis - Verdict: REJECTED (score 49)"));
        assertTrue(content.contains("File: report.pdf"));
        assertTrue(content.contains("- resistance_ohms: 6.2 (confidence 0.90)"));
        assertFalse(content.contains("equipment_serial"));
        assertTrue(content.contains("- [CRITICAL] GND-001: Resistance above 5 ohm"));
    }

    @Test
    void buildAnalysisContent_noNonConformities() {
        // Given
        Analysis analysis = Analysis.builder()
                .id("an-4")
                .testType(TestType.MEGGER)
                .verdict(Verdict.APPROVED)
                .score(95)
                .build();

        // When
        String content = RagService.buildAnalysisContent(analysis);

        // Then
        assertTrue(content.endsWith("No non-conformities found."));
        assertFalse(content.contains("Extracted data"));
    }

    @Test
    void indexCorrection_storesOriginalAndCorrectedValues() {
        // Given
        Feedback feedback = Feedback.builder()
                .id("fb-1")
                .analysisId("an-1")
                .companyId(COMPANY)
                .feedbackType(FeedbackType.VERDICT_CORRECTION)
                .originalValue(Map.of("verdict", "REJECTED"))
                .correctedValue(Map.of("verdict", "APPROVED"))
                .explanation("The 6.2 reading was the pre-treatment value")
                .build();

        // When
        IndexResult result = ragService.indexCorrection(feedback, TestType.GROUNDING);

        // Then
        assertTrue(result.isSuccess());
        KnowledgeEmbedding entry = vectorStore.findByAnalysisId("an-1", ContentType.MANUAL_CORRECTION).get(0);
        assertEquals(COMPANY, entry.getCompanyId());
        assertTrue(entry.getContent().startsWith("CORRECTION for GROUNDING Analysis"));
        assertTrue(entry.getContent().contains("Original (INCORRECT):\n{\"verdict\":\"REJECTED\"}"));
        assertTrue(entry.getContent().contains("Corrected (CORRECT):\n{\"verdict\":\"APPROVED\"}"));
        assertTrue(entry.getContent().endsWith("Explanation: The 6.2 reading was the pre-treatment value"));
        assertEquals("VERDICT_CORRECTION", entry.getMetadata().get("feedbackType"));
    }

    @Test
    void indexStandard_storesOneGlobalEntryPerTestType() {
        // Given
        StandardDocument standard = StandardDocument.builder()
                .name("Calibration Certificate Validity")
                .section("General")
                .content("Instruments must carry a valid calibration certificate.")
                .contentType(ContentType.BEST_PRACTICE)
                .testTypes(List.of(TestType.GROUNDING, TestType.MEGGER, TestType.THERMOGRAPHY))
                .build();

        // When
        List<IndexResult> results = ragService.indexStandard(standard);

        // Then
        assertEquals(3, results.size());
        assertTrue(results.stream().allMatch(IndexResult::isSuccess));
        assertEquals(3, vectorStore.countByContentType(ContentType.BEST_PRACTICE));
        List<SearchResult> found = ragService.search(SearchQuery.builder()
                .query("calibration")
                .companyId("any-company")
                .testType(TestType.MEGGER)
                .minSimilarity(0.0)
                .build());
        assertEquals(1, found.size());
        assertTrue(found.get(0).getContent().startsWith("[Calibration Certificate Validity] General"));
    }

    // ========== FEEDBACK LOOP ==========

    @Test
    void markAnalysisIncorrect_excludesEntryFromRetrieval() {
        // Given
        ragService.indexAnalysis(completedAnalysis("an-5"));
        SearchQuery query = SearchQuery.builder().query("grounding").companyId(COMPANY).minSimilarity(0.0).build();
        assertEquals(1, ragService.search(query).size());

        // When
        int marked = ragService.markAnalysisIncorrect("an-5");

        // Then
        assertEquals(1, marked);
        assertTrue(ragService.search(query).isEmpty());
        KnowledgeEmbedding entry = vectorStore.findByAnalysisId("an-5", ContentType.ANALYSIS_RESULT).get(0);
        assertFalse(entry.isWasCorrect());
    }

    @Test
    void markAnalysisIncorrect_unknownAnalysisMarksNothing() {
        assertEquals(0, ragService.markAnalysisIncorrect("missing"));
    }

    @Test
    void trackUsage_incrementsUseCount() {
        // Given
        KnowledgeEmbedding first = store(ContentType.TECHNICAL_STANDARD, null, 0.9, "first");
        KnowledgeEmbedding second = store(ContentType.TECHNICAL_STANDARD, null, 0.9, "second");

        // When
        ragService.trackUsage(List.of(first.getId(), second.getId()));
        ragService.trackUsage(List.of(first.getId()));

        // Then
        assertEquals(2, first.getUseCount());
        assertEquals(1, second.getUseCount());
    }

    // ========== FORMATTING ==========

    @Test
    void formatContextForPrompt_emptyContextRendersNothing() {
        assertEquals("", ragService.formatContextForPrompt(RagContext.empty()));
    }

    @Test
    void formatContextForPrompt_rendersSectionsWithSimilarityAndVerdict() {
        // Given
        RagContext context = RagContext.builder()
                .similarAnalyses(List.of(SearchResult.builder()
                        .content("past analysis").similarity(0.812).verdict(Verdict.REJECTED).build()))
                .standards(List.of(SearchResult.builder().content("IEEE 81 limit").similarity(0.6).build()))
                .build();

        // When
        String prompt = ragService.formatContextForPrompt(context);

        // Then
        assertTrue(prompt.startsWith("## KNOWLEDGE FROM PREVIOUS AUDITS"));
        assertTrue(prompt.contains("[1] (similarity 0.81, verdict REJECTED)\npast analysis"));
        assertTrue(prompt.contains("### Applicable technical standards\n[1] (similarity 0.60)\nIEEE 81 limit"));
        assertFalse(prompt.contains("Reviewer corrections"));
    }

    @Test
    void estimateTokens_roundsUp() {
        assertEquals(0, RagService.estimateTokens(null));
        assertEquals(0, RagService.estimateTokens(""));
        assertEquals(1, RagService.estimateTokens("abc"));
        assertEquals(1, RagService.estimateTokens("abcd"));
        assertEquals(2, RagService.estimateTokens("abcde"));
    }

    private static Analysis completedAnalysis(String id) {
        Map<String, ExtractedField<?>> extraction = new LinkedHashMap<>();
        extraction.put("resistance_ohms", ExtractedField.of(6.2, 0.9, "report_page_1"));
        extraction.put("equipment_serial", ExtractedField.notFound("illegible"));
        return Analysis.builder()
                .id(id)
                .companyId(COMPANY)
                .testType(TestType.GROUNDING)
                .filename("report.pdf")
                .verdict(Verdict.REJECTED)
                .score(49)
                .extraction(extraction)
                .nonConformities(List.of(NonConformity.builder()
                        .code("GND-001")
                        .severity(Severity.CRITICAL)
                        .description("Resistance above 5 ohm")
                        .build()))
                .build();
    }

    private static List<String> contents(List<SearchResult> results) {
        return results.stream().map(SearchResult::getContent).collect(Collectors.toList());
    }
}
