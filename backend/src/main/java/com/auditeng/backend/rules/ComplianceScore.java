package com.auditeng.backend.rules;

import com.auditeng.backend.model.NonConformity;
import com.auditeng.backend.model.Severity;
import com.auditeng.backend.model.Verdict;

import java.util.List;

/**
 * Quality score in [0, 100] with non-overlapping bands per verdict:
 * APPROVED 85..100, APPROVED_WITH_COMMENTS 60..84, REJECTED 0..59.
 */
public final class ComplianceScore {

    private ComplianceScore() {
    }

    /**
     * @param confidence mean extraction confidence in [0, 1], raises the score inside the APPROVED band
     */
    public static int score(Verdict verdict, List<NonConformity> nonConformities, double confidence) {
        long critical = count(nonConformities, Severity.CRITICAL);
        long major = count(nonConformities, Severity.MAJOR);
        long minor = count(nonConformities, Severity.MINOR);
        switch (verdict) {
            case APPROVED:
                return 85 + (int) Math.round(15 * Math.max(0.0, Math.min(1.0, confidence)));
            case APPROVED_WITH_COMMENTS:
                return (int) Math.max(60, 84 - 6 * major - 2 * minor);
            default:
                return (int) Math.max(0, 59 - 10 * critical - 3 * major - minor);
        }
    }

    private static long count(List<NonConformity> nonConformities, Severity severity) {
        return nonConformities.stream().filter(nc -> nc.getSeverity() == severity).count();
    }
}
