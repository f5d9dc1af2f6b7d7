package com.auditeng.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Mismatch between two or more evidence sources found by the consistency validator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Inconsistency {
    private String code;
    private Severity severity;
    private String field;
    private String expected;
    private String found;
    private String message;
}
