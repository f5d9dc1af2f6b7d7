package com.auditeng.backend.repository;

import com.auditeng.backend.model.ContentType;
import com.auditeng.backend.model.KnowledgeEmbedding;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for knowledge embeddings used by retrieval.
 */
@Repository
public interface KnowledgeEmbeddingRepository extends MongoRepository<KnowledgeEmbedding, String> {

    List<KnowledgeEmbedding> findByAnalysisIdAndContentType(String analysisId, ContentType contentType);

    long countByContentType(ContentType contentType);
}
