package com.commitpulse.pipeline.orchestrator;

/**
 * A pipeline stage failed and the run was aborted. Output produced so far
 * must not be treated as a complete result.
 */
public class PipelineException extends Exception {

    private final String stage;

    public PipelineException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public PipelineException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message + ": " + describe(cause), cause);
        this.stage = stage;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public String getStage() {
        return stage;
    }
}
