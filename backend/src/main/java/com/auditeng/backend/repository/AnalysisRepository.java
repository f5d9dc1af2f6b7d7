package com.auditeng.backend.repository;

import com.auditeng.backend.model.Analysis;
import com.auditeng.backend.model.AnalysisStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisRepository extends MongoRepository<Analysis, String>, AnalysisRepositoryCustom {

    Optional<Analysis> findByIdAndCompanyId(String id, String companyId);

    List<Analysis> findByCompanyIdOrderByCreatedAtDesc(String companyId);

    List<Analysis> findByCompanyIdAndStatus(String companyId, AnalysisStatus status);

    List<Analysis> findByStatusIn(Collection<AnalysisStatus> statuses);
}
