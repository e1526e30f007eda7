package dev.careerpath.service;

import dev.careerpath.model.ArtifactBundle;

/**
 * Write-once storage for completed artifact bundles, keyed by transition id.
 */
public interface ArtifactStore {

    /**
     * Persist a completed bundle.
     *
     * @throws IllegalStateException if a bundle for the same transition was already stored
     */
    void save(ArtifactBundle bundle);

    boolean exists(String transitionId);
}
