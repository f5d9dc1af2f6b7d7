package com.auditeng.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retrieval settings.
 *
 * @param embeddingModel       Voyage model used for documents and queries
 * @param embeddingDimensions  vector size the Voyage model returns, also used by the local embedding
 * @param defaultLimit         results returned by a search without a limit
 * @param defaultMinSimilarity floor applied by a search without one
 * @param maxContextTokens     default prompt budget of a built context
 * @param maxSimilarAnalyses   cap on similar analyses per context
 * @param maxCorrections       cap on corrections per context
 * @param maxStandards         cap on standards and best practices per context
 * @param vectorStore          {@code atlas} or {@code memory}
 * @param vectorIndex          Atlas vector search index name
 * @param seedStandards        index the bundled standards catalog on startup when none are stored
 */
@ConfigurationProperties(prefix = "auditeng.rag")
public record RagProperties(
        String embeddingModel,
        Integer embeddingDimensions,
        Integer defaultLimit,
        Double defaultMinSimilarity,
        Integer maxContextTokens,
        Integer maxSimilarAnalyses,
        Integer maxCorrections,
        Integer maxStandards,
        String vectorStore,
        String vectorIndex,
        Boolean seedStandards
) {

    public RagProperties {
        embeddingModel = embeddingModel != null ? embeddingModel : "voyage-3-lite";
        embeddingDimensions = embeddingDimensions != null ? embeddingDimensions : 512;
        defaultLimit = defaultLimit != null ? defaultLimit : 5;
        defaultMinSimilarity = defaultMinSimilarity != null ? defaultMinSimilarity : 0.70;
        maxContextTokens = maxContextTokens != null ? maxContextTokens : 4000;
        maxSimilarAnalyses = maxSimilarAnalyses != null ? maxSimilarAnalyses : 3;
        maxCorrections = maxCorrections != null ? maxCorrections : 2;
        maxStandards = maxStandards != null ? maxStandards : 2;
        vectorStore = vectorStore != null ? vectorStore : "atlas";
        vectorIndex = vectorIndex != null ? vectorIndex : "knowledge_vector_index";
        seedStandards = seedStandards != null ? seedStandards : Boolean.TRUE;
    }

    public static RagProperties defaults() {
        return new RagProperties(null, null, null, null, null, null, null, null, null, null, null);
    }
}
