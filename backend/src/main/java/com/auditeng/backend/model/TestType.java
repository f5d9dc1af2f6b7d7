package com.auditeng.backend.model;

/**
 * Kind of electrical test a compliance report documents.
 */
public enum TestType {
    GROUNDING,
    MEGGER,
    THERMOGRAPHY
}
