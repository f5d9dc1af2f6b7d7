package com.auditeng.backend.dto;

import com.auditeng.backend.model.ContentType;
import com.auditeng.backend.model.TestType;
import com.auditeng.backend.model.Verdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Similarity search request. Null filters match everything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchQuery {
    private String query;

    @Builder.Default
    private List<ContentType> contentTypes = new ArrayList<>();

    private TestType testType;
    private Verdict verdict;

    /** Tenant whose entries are visible in addition to global ones. */
    private String companyId;

    private Integer limit;
    private Double minSimilarity;
}
