package dev.careerpath.pipeline;

public class UnknownRunException extends IllegalArgumentException {

    public UnknownRunException(String runId) {
        super("Unknown run: " + runId);
    }
}
