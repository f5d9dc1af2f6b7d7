package com.auditeng.backend.rules;

import com.auditeng.backend.model.NonConformity;
import com.auditeng.backend.model.Verdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of evaluating one report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationResult {

    @Builder.Default
    private List<NonConformity> nonConformities = new ArrayList<>();

    private Verdict verdict;
    private int score;
}
