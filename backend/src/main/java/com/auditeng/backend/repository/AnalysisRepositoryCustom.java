package com.auditeng.backend.repository;

import com.auditeng.backend.model.Analysis;
import com.auditeng.backend.model.AnalysisStatus;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Collection;
import java.util.Optional;

/**
 * Atomic status transitions for analyses.
 */
public interface AnalysisRepositoryCustom {

    /**
     * Applies {@code update} only if the analysis is currently in one of {@code expected}
     * and, when {@code attempt} is non-null, still on that attempt.
     *
     * @return the updated analysis, or empty when the guard did not match
     */
    Optional<Analysis> updateIfStatus(String id, Collection<AnalysisStatus> expected, Integer attempt, Update update);
}
