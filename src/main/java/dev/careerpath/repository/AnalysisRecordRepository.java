package dev.careerpath.repository;

import dev.careerpath.entity.AnalysisRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for stored analyses.
 */
@Repository
public interface AnalysisRecordRepository extends JpaRepository<AnalysisRecord, Long> {

    boolean existsByTransitionId(String transitionId);

    Optional<AnalysisRecord> findByTransitionId(String transitionId);
}
