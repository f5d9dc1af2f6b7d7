package com.auditeng.backend.model;

/**
 * Kind of knowledge stored for retrieval.
 */
public enum ContentType {
    ANALYSIS_RESULT, // Completed analysis with extraction and verdict
    MANUAL_CORRECTION, // User correction of a past analysis
    TECHNICAL_STANDARD, // NBR, IEEE, NETA limits and formulas
    BEST_PRACTICE // Domain guidelines
}
