package dev.careerpath.pipeline;

import java.time.Instant;

/**
 * Progress notification for one stage.
 *
 * @param artifact the committed stage output on COMPLETED, otherwise null
 * @param category set on FAILED only
 */
public record StageEvent(
        Stage stage,
        StageStatus status,
        Instant timestamp,
        Object artifact,
        FailureCategory category) {

    public static StageEvent started(Stage stage) {
        return new StageEvent(stage, StageStatus.STARTED, Instant.now(), null, null);
    }

    public static StageEvent completed(Stage stage, Object artifact) {
        return new StageEvent(stage, StageStatus.COMPLETED, Instant.now(), artifact, null);
    }

    public static StageEvent failed(Stage stage, FailureCategory category) {
        return new StageEvent(stage, StageStatus.FAILED, Instant.now(), null, category);
    }

    public static StageEvent cancelled(Stage stage) {
        return new StageEvent(stage, StageStatus.CANCELLED, Instant.now(), null, null);
    }
}
