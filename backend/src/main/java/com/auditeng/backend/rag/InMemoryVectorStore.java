package com.auditeng.backend.rag;

import com.auditeng.backend.model.ContentType;
import com.auditeng.backend.model.KnowledgeEmbedding;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Exact cosine scan over entries held in memory.
 */
@Component
@ConditionalOnProperty(name = "auditeng.rag.vector-store", havingValue = "memory")
public class InMemoryVectorStore implements VectorStore {

    private final Map<String, KnowledgeEmbedding> entries = new ConcurrentHashMap<>();

    @Override
    public KnowledgeEmbedding insert(KnowledgeEmbedding entry) {
        if (entry.getId() == null) {
            entry.setId(UUID.randomUUID().toString());
        }
        Instant now = Instant.now();
        if (entry.getCreatedAt() == null) {
            entry.setCreatedAt(now);
        }
        entry.setUpdatedAt(now);
        entries.put(entry.getId(), entry);
        return entry;
    }

    @Override
    public List<ScoredEmbedding> nearest(List<Double> query, int k, VectorFilter filter) {
        return entries.values().stream()
                .filter(filter::matches)
                .map(entry -> new ScoredEmbedding(entry, VectorMath.cosineSimilarity(query, entry.getEmbedding())))
                .sorted(Comparator.comparingDouble(ScoredEmbedding::similarity).reversed())
                .limit(k)
                .collect(Collectors.toList());
    }

    @Override
    public void incrementUseCount(Collection<String> ids) {
        for (String id : ids) {
            entries.computeIfPresent(id, (key, entry) -> {
                entry.setUseCount(entry.getUseCount() + 1);
                return entry;
            });
        }
    }

    @Override
    public void markIncorrect(String id) {
        entries.computeIfPresent(id, (key, entry) -> {
            entry.setWasCorrect(false);
            entry.setUpdatedAt(Instant.now());
            return entry;
        });
    }

    @Override
    public List<KnowledgeEmbedding> findByAnalysisId(String analysisId, ContentType contentType) {
        return entries.values().stream()
                .filter(e -> Objects.equals(analysisId, e.getAnalysisId()) && e.getContentType() == contentType)
                .collect(Collectors.toList());
    }

    @Override
    public long countByContentType(ContentType contentType) {
        return entries.values().stream().filter(e -> e.getContentType() == contentType).count();
    }
}
