package com.auditeng.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * User correction of a completed analysis. Incorporated once it has been indexed for retrieval.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "feedback")
public class Feedback {

    @Id
    private String id;

    @Indexed
    private String analysisId;

    @Indexed
    private String companyId;

    private String userId;

    private FeedbackType feedbackType;

    @Builder.Default
    private Map<String, Object> originalValue = new HashMap<>();

    @Builder.Default
    private Map<String, Object> correctedValue = new HashMap<>();

    private String explanation;

    @Builder.Default
    private boolean incorporated = false;

    private String embeddingId;

    @CreatedDate
    private Instant createdAt;

    private Instant incorporatedAt;
}
