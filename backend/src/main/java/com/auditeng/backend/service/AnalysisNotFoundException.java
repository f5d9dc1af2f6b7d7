package com.auditeng.backend.service;

/**
 * Thrown when an analysis does not exist or belongs to another company.
 */
public class AnalysisNotFoundException extends RuntimeException {

    public AnalysisNotFoundException(String analysisId) {
        super("Analysis not found: " + analysisId);
    }
}
