package com.aquawatch.core.model;

/**
 * Which rung of the fetch ladder produced a batch of raw documents.
 */
public enum SourceTier {
    DAILY_30D,
    INSTANTANEOUS,
    PLACEHOLDER;

    public boolean isPlaceholder() {
        return this == PLACEHOLDER;
    }
}
