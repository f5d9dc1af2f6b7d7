package com.auditeng.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Knowledge entry with a vector embedding for similarity search.
 * A null companyId marks a global entry visible to every tenant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "knowledge_embeddings")
public class KnowledgeEmbedding {

    @Id
    private String id;

    @Indexed
    private String companyId;

    @Indexed
    private String analysisId;

    private ContentType contentType;

    private TestType testType;

    private Verdict verdict;

    private String content;

    @Builder.Default
    private List<Double> embedding = new ArrayList<>();

    /** Model that produced {@link #embedding}. */
    @Indexed
    private String embeddingModel;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * False once feedback showed the entry taught the wrong lesson. Never deleted.
     */
    @Builder.Default
    private boolean wasCorrect = true;

    @Builder.Default
    private int useCount = 0;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
