package com.auditeng.backend.rag;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingResult {

    @Builder.Default
    private List<Double> embedding = new ArrayList<>();

    private int tokensUsed;

    /** Model that produced the vector; vectors of different models are never compared. */
    private String model;
}
