package com.auditeng.backend.repository;

import com.auditeng.backend.model.AnalysisEvent;
import com.auditeng.backend.model.AnalysisEventType;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for analysis events.
 */
@Repository
public interface AnalysisEventRepository extends MongoRepository<AnalysisEvent, String> {

    List<AnalysisEvent> findByAnalysisIdOrderByCreatedAtAsc(String analysisId);

    List<AnalysisEvent> findByAnalysisIdAndTypeOrderByCreatedAtAsc(String analysisId, AnalysisEventType type);
}
