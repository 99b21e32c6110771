package com.moviz.pipeline;

/**
 * Fatal pipeline failure. Aborts the run before any table is handed to storage.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
