package dev.careerpath.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Stored result of a completed analysis. Written once per transition.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "analyses", indexes = {
        @Index(name = "idx_transition_id", columnList = "transitionId"),
        @Index(name = "idx_completed_at", columnList = "completedAt")
})
public class AnalysisRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String transitionId;

    @Column(nullable = false, length = 100)
    private String currentRole;

    @Column(nullable = false, length = 100)
    private String targetRole;

    @Column(nullable = false)
    private int overallScore;

    @Column(nullable = false)
    private int storyCount;

    @Column(nullable = false)
    private int skillGapCount;

    @Column(nullable = false)
    private boolean fallbackPlan;

    @Column(nullable = false)
    private LocalDateTime completedAt;

    /**
     * Full artifact bundle as JSON.
     */
    @Lob
    @Column(nullable = false, columnDefinition = "TEXT")
    private String bundleJson;
}
