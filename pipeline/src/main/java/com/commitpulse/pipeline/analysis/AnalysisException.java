package com.commitpulse.pipeline.analysis;

/**
 * A read query failed, typically because the store was never loaded.
 */
public class AnalysisException extends Exception {

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
