package com.auditeng.backend.model;

import java.util.Collection;

/**
 * Final compliance decision for one analysis.
 */
public enum Verdict {
    APPROVED,
    APPROVED_WITH_COMMENTS,
    REJECTED;

    /**
     * Derives the verdict from a non-conformity list: any CRITICAL rejects, any other
     * finding approves with comments, an empty list approves.
     */
    public static Verdict from(Collection<NonConformity> nonConformities) {
        if (nonConformities == null || nonConformities.isEmpty()) {
            return APPROVED;
        }
        boolean critical = nonConformities.stream()
                .anyMatch(nc -> nc.getSeverity() == Severity.CRITICAL);
        return critical ? REJECTED : APPROVED_WITH_COMMENTS;
    }
}
