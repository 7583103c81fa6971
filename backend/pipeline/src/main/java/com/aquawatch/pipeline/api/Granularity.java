package com.aquawatch.pipeline.api;

public enum Granularity {
    DAILY_30D,
    INSTANTANEOUS
}
