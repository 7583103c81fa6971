package com.aquawatch.core.error;

/**
 * Base type for failures that abort a pipeline run for one site.
 */
public abstract class PipelineException extends RuntimeException {
    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short stable identifier used in API responses and failure events.
     */
    public abstract String errorType();
}
