package dev.careerpath.pipeline;

/**
 * Signals that a run was cancelled by its owner. Not a failure.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String runId) {
        super("Run " + runId + " was cancelled");
    }
}
