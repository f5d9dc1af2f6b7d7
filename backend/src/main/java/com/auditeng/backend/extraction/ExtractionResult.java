package com.auditeng.backend.extraction;

import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one extraction call. Never thrown: failures carry an error message instead of data.
 */
@Getter
@ToString
public final class ExtractionResult<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final ExtractionMetrics metrics;

    private ExtractionResult(boolean success, T data, String error, ExtractionMetrics metrics) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.metrics = metrics;
    }

    public static <T> ExtractionResult<T> success(T data, ExtractionMetrics metrics) {
        return new ExtractionResult<>(true, data, null, metrics);
    }

    public static <T> ExtractionResult<T> failure(String error, ExtractionMetrics metrics) {
        return new ExtractionResult<>(false, null, error, metrics);
    }
}
