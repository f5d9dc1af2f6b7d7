package com.auditeng.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompt additions derived from retrieved knowledge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnhancedPrompt {

    @Builder.Default
    private String systemPromptAddition = "";

    @Builder.Default
    private String userPromptAddition = "";

    private int similarAnalysesCount;
    private int correctionsCount;
    private int standardsCount;
    private int contextTokens;

    @Builder.Default
    private List<String> embeddingIds = new ArrayList<>();

    public static EnhancedPrompt empty() {
        return EnhancedPrompt.builder().build();
    }
}
