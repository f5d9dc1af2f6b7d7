package com.auditeng.backend.model;

/**
 * Severity of a non-conformity or cross-source inconsistency.
 */
public enum Severity {
    CRITICAL,
    MAJOR,
    MINOR
}
