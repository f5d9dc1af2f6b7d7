package com.auditeng.backend.dto;

import com.auditeng.backend.model.ContentType;
import com.auditeng.backend.model.TestType;
import com.auditeng.backend.model.Verdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {
    private String id;
    private String analysisId;
    private String content;
    private ContentType contentType;
    private TestType testType;
    private Verdict verdict;
    private double similarity;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
