package com.auditeng.backend.model;

/**
 * Types of events in an analysis activity trail.
 */
public enum AnalysisEventType {
    CREATED,
    PROCESSING,
    EXTRACTED, // Batch extraction finished
    COMPLETED,
    FAILED,
    CANCELLED,
    REANALYZE_REQUESTED,
    INDEXED, // Result stored for loop learning
    FEEDBACK_RECEIVED
}
