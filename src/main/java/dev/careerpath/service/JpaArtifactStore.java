package dev.careerpath.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careerpath.entity.AnalysisRecord;
import dev.careerpath.model.ArtifactBundle;
import dev.careerpath.repository.AnalysisRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Artifact store backed by SQLite through Spring Data JPA.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaArtifactStore implements ArtifactStore {

    private final AnalysisRecordRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public void save(ArtifactBundle bundle) {
        String transitionId = bundle.transition().getId();
        if (repository.existsByTransitionId(transitionId)) {
            throw new IllegalStateException("Analysis already stored for transition " + transitionId);
        }

        AnalysisRecord record = AnalysisRecord.builder()
                .transitionId(transitionId)
                .currentRole(bundle.transition().getCurrentRole())
                .targetRole(bundle.transition().getTargetRole())
                .overallScore(bundle.readinessScore().overallScore())
                .storyCount(bundle.scrapedCount())
                .skillGapCount(bundle.skillGaps().size())
                .fallbackPlan(bundle.plan().fallback())
                .completedAt(LocalDateTime.now())
                .bundleJson(toJson(bundle))
                .build();

        repository.save(record);
        log.info("Stored analysis for transition {}", transitionId);
    }

    @Override
    public boolean exists(String transitionId) {
        return repository.existsByTransitionId(transitionId);
    }

    private String toJson(ArtifactBundle bundle) {
        try {
            return objectMapper.writeValueAsString(bundle);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize artifact bundle", e);
        }
    }
}
