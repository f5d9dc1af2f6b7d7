package com.auditeng.backend.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an analysis.
 */
public enum AnalysisStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /** Statuses a unit of work may still be running in. */
    public static final Set<AnalysisStatus> IN_FLIGHT = EnumSet.of(PENDING, PROCESSING);

    /** Statuses from which a re-analysis may be requested. */
    public static final Set<AnalysisStatus> REANALYZABLE = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }
}
