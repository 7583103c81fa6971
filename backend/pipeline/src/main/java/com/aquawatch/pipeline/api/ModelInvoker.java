package com.aquawatch.pipeline.api;

@FunctionalInterface
public interface ModelInvoker {
    /**
     * Sends a CSV payload to the named endpoint. A blank {@code targetModel} lets the endpoint pick its default.
     */
    byte[] invoke(String endpoint, byte[] payload, String targetModel);
}
