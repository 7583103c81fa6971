package com.aquawatch.core.error;

public class DocumentParseException extends PipelineException {
    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "document_parse";
    }
}
