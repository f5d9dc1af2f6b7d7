package com.auditeng.backend.service;

import com.auditeng.backend.model.AnalysisStatus;

/**
 * Thrown when an operation is requested for an analysis in the wrong lifecycle state.
 */
public class AnalysisConflictException extends IllegalStateException {

    private final String analysisId;
    private final AnalysisStatus status;

    public AnalysisConflictException(String analysisId, AnalysisStatus status, String message) {
        super(message);
        this.analysisId = analysisId;
        this.status = status;
    }

    public String getAnalysisId() {
        return analysisId;
    }

    public AnalysisStatus getStatus() {
        return status;
    }
}
