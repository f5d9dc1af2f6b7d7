package com.auditeng.backend.repository;

import com.auditeng.backend.model.Feedback;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FeedbackRepository extends MongoRepository<Feedback, String> {

    List<Feedback> findByAnalysisIdOrderByCreatedAtAsc(String analysisId);
}
