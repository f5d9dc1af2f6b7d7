package com.auditeng.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rule violation recorded against an analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NonConformity {
    private String code;
    private Severity severity;
    private String description;
    private String evidence;
    private String correctiveAction;

    public static NonConformity fromInconsistency(Inconsistency inconsistency) {
        String evidence = null;
        if (inconsistency.getExpected() != null || inconsistency.getFound() != null) {
            evidence = "expected " + inconsistency.getExpected() + ", found " + inconsistency.getFound();
        }
        return NonConformity.builder()
                .code(inconsistency.getCode())
                .severity(inconsistency.getSeverity())
                .description(inconsistency.getMessage())
                .evidence(evidence)
                .correctiveAction("Review the " + inconsistency.getField() + " reported in each document and correct the divergent source")
                .build();
    }
}
