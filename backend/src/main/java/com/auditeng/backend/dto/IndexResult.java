package com.auditeng.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexResult {
    private boolean success;
    private String embeddingId;
    private int tokensUsed;
    private String error;

    public static IndexResult indexed(String embeddingId, int tokensUsed) {
        return IndexResult.builder().success(true).embeddingId(embeddingId).tokensUsed(tokensUsed).build();
    }

    public static IndexResult failed(String error) {
        return IndexResult.builder().success(false).error(error).build();
    }
}
