package dev.careerpath.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Identity of one analysis run. Only {@code complete} changes after creation.
 */
@Data
@Builder
public class Transition {
    private String id;
    private String currentRole;
    private String targetRole;
    private Instant createdAt;
    private boolean complete;
}
