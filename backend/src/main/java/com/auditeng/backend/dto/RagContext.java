package com.auditeng.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Retrieved knowledge selected for one prompt within a token budget.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RagContext {

    @Builder.Default
    private List<SearchResult> similarAnalyses = new ArrayList<>();

    @Builder.Default
    private List<SearchResult> corrections = new ArrayList<>();

    @Builder.Default
    private List<SearchResult> standards = new ArrayList<>();

    private int totalTokens;

    public static RagContext empty() {
        return RagContext.builder().build();
    }

    public boolean isEmpty() {
        return similarAnalyses.isEmpty() && corrections.isEmpty() && standards.isEmpty();
    }

    public List<String> embeddingIds() {
        return Stream.of(similarAnalyses, corrections, standards)
                .flatMap(List::stream)
                .map(SearchResult::getId)
                .collect(Collectors.toList());
    }
}
