package com.auditeng.backend.model;

/**
 * Kind of correction a user submits against a completed analysis.
 */
public enum FeedbackType {
    VERDICT_CORRECTION,
    FIELD_CORRECTION,
    FALSE_POSITIVE,
    FALSE_NEGATIVE;

    /**
     * Whether this feedback means the stored analysis result taught the wrong lesson.
     */
    public boolean invalidatesResult() {
        return this == VERDICT_CORRECTION || this == FALSE_POSITIVE;
    }
}
