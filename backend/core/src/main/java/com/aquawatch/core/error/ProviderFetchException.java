package com.aquawatch.core.error;

public class ProviderFetchException extends PipelineException {
    public ProviderFetchException(String message) {
        super(message);
    }

    public ProviderFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "provider_fetch";
    }
}
