package com.auditeng.backend.rules;

import com.auditeng.backend.model.NonConformity;
import com.auditeng.backend.model.NormalizedExtraction;
import com.auditeng.backend.model.TestType;

import java.util.List;

/**
 * Checks specific to one test type.
 */
public interface TestTypeRules {

    TestType testType();

    List<NonConformity> evaluate(NormalizedExtraction extraction);
}
