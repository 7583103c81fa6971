package com.aquawatch.core.error;

public class NoPredictionParsedException extends PipelineException {
    public NoPredictionParsedException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "no_prediction";
    }
}
