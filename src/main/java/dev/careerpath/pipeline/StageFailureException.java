package dev.careerpath.pipeline;

import lombok.Getter;

/**
 * Terminal failure of a run, tagged with the stage that failed and a generic category.
 */
@Getter
public class StageFailureException extends RuntimeException {

    private final Stage stage;
    private final FailureCategory category;

    public StageFailureException(Stage stage, FailureCategory category, Throwable cause) {
        super("Stage " + stage.value() + " failed: " + category, cause);
        this.stage = stage;
        this.category = category;
    }
}
