package com.auditeng.backend.validation;

/**
 * Independent places a value can be read from in one report. Declaration order is merge priority.
 */
public enum EvidenceSource {
    REPORT("report"),
    DATA_TABLE("table"),
    PHOTO("photo"),
    THERMAL_IMAGE("thermal"),
    CERTIFICATE("certificate"),
    INSTRUMENT("instrument");

    private final String label;

    EvidenceSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
