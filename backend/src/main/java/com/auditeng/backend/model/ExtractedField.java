package com.auditeng.backend.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.springframework.data.annotation.PersistenceCreator;

/**
 * One value read from a document together with how sure the model was and where it came from.
 * A field without a value always carries zero confidence and the {@code not_found} source.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ExtractedField<T> {

    public static final String NOT_FOUND = "not_found";
    public static final String EXTRACTED = "extracted";

    private final T value;
    private final double confidence;
    private final String source;
    private final String reason;

    @PersistenceCreator
    ExtractedField(T value, double confidence, String source, String reason) {
        this.value = value;
        this.confidence = confidence;
        this.source = source;
        this.reason = reason;
    }

    public static <T> ExtractedField<T> of(T value, double confidence, String source) {
        if (value == null) {
            return notFound(null);
        }
        double clamped = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        return new ExtractedField<>(value, clamped, source == null ? EXTRACTED : source, null);
    }

    public static <T> ExtractedField<T> notFound(String reason) {
        return new ExtractedField<>(null, 0.0, NOT_FOUND, reason);
    }

    public boolean isPresent() {
        return value != null;
    }
}
