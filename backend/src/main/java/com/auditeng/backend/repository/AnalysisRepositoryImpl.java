package com.auditeng.backend.repository;

import com.auditeng.backend.model.Analysis;
import com.auditeng.backend.model.AnalysisStatus;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

class AnalysisRepositoryImpl implements AnalysisRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    AnalysisRepositoryImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<Analysis> updateIfStatus(String id, Collection<AnalysisStatus> expected, Integer attempt,
            Update update) {
        Criteria criteria = Criteria.where("_id").is(id).and(Analysis.STATUS).in(expected);
        if (attempt != null) {
            criteria = criteria.and(Analysis.ATTEMPT).is(attempt);
        }
        // findAndModify bypasses auditing
        update.set("updatedAt", Instant.now());
        Analysis updated = mongoTemplate.findAndModify(
                Query.query(criteria),
                update,
                FindAndModifyOptions.options().returnNew(true),
                Analysis.class);
        return Optional.ofNullable(updated);
    }
}
