package com.auditeng.backend.rag;

import com.auditeng.backend.model.ContentType;
import com.auditeng.backend.model.KnowledgeEmbedding;

import java.util.Collection;
import java.util.List;

/**
 * Storage of knowledge embeddings with nearest-neighbour search.
 */
public interface VectorStore {

    KnowledgeEmbedding insert(KnowledgeEmbedding entry);

    /**
     * Up to {@code k} entries matching {@code filter}, most similar first.
     */
    List<ScoredEmbedding> nearest(List<Double> query, int k, VectorFilter filter);

    void incrementUseCount(Collection<String> ids);

    /**
     * Flags an entry as having taught the wrong lesson. The entry is kept.
     */
    void markIncorrect(String id);

    List<KnowledgeEmbedding> findByAnalysisId(String analysisId, ContentType contentType);

    long countByContentType(ContentType contentType);
}
