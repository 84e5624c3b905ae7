package com.commitpulse.pipeline.loader;

/**
 * Schema or write failure during a load. The store content is undefined
 * afterwards and the run has to be repeated.
 */
public class LoadException extends Exception {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
