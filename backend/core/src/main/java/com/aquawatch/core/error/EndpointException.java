package com.aquawatch.core.error;

public class EndpointException extends PipelineException {
    public EndpointException(String message) {
        super(message);
    }

    public EndpointException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "endpoint";
    }
}
