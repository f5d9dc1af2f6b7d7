package com.auditeng.backend.rag;

import com.auditeng.backend.model.KnowledgeEmbedding;

/**
 * Search hit with its cosine similarity to the query.
 */
public record ScoredEmbedding(KnowledgeEmbedding entry, double similarity) {
}
