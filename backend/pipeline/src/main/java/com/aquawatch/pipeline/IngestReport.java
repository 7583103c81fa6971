package com.aquawatch.pipeline;

import com.aquawatch.core.model.SourceTier;

public record IngestReport(String datasetKey, SourceTier sourceTier, int datasetBytes) {
}
