package com.aquawatch.core.error;

/**
 * Missing endpoint, model or site. Surfaced to the caller immediately and never retried.
 */
public class ConfigurationException extends PipelineException {
    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "configuration";
    }
}
