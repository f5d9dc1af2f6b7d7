package com.auditeng.backend.extraction;

import java.util.Locale;

/**
 * Image detail level requested from the vision model.
 */
public enum VisionDetail {
    LOW,
    HIGH,
    AUTO;

    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static VisionDetail parse(String value) {
        if (value == null || value.isBlank()) {
            return HIGH;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
