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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Analysis document: one audit run over a scanned compliance report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "analyses")
public class Analysis {

    public static final String STATUS = "status";
    public static final String ATTEMPT = "attempt";
    public static final String COMPANY_ID = "companyId";

    @Id
    private String id;

    @Indexed
    private String companyId;

    private String userId;

    private TestType testType;

    @Builder.Default
    private AnalysisStatus status = AnalysisStatus.PENDING;

    /**
     * Incremented on every re-analysis. Results from a run of an older attempt are discarded.
     */
    @Builder.Default
    private int attempt = 1;

    // Input
    private String filename;

    @Builder.Default
    private List<DocumentImage> images = new ArrayList<>();

    /**
     * Text already available for the report (OCR or uploader notes). Used as the retrieval query.
     */
    private String reportText;

    private String expectedTag;
    private String expectedSerial;

    // Results
    @Builder.Default
    private Map<String, ExtractedField<?>> extraction = new LinkedHashMap<>();

    @Builder.Default
    private List<NonConformity> nonConformities = new ArrayList<>();

    private Verdict verdict;
    private Integer score;
    private Double overallConfidence;

    // Accounting
    @Builder.Default
    private long tokensConsumed = 0;

    @Builder.Default
    private double estimatedCost = 0.0;

    private Long processingTimeMs;

    @Builder.Default
    private List<String> modelsUsed = new ArrayList<>();

    @Builder.Default
    private List<String> contextEmbeddingIds = new ArrayList<>();

    // Timing
    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    private Instant startedAt;
    private Instant completedAt;
    private Instant cancelledAt;

    private String errorMessage;

    public NormalizedExtraction extractionView() {
        return NormalizedExtraction.of(extraction);
    }
}
