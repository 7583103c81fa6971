package com.aquawatch.pipeline.detect;

public record Decision(double observed, double predicted, double percentChange, boolean anomalous) {
}
