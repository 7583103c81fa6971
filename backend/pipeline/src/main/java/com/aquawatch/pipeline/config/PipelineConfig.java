package com.aquawatch.pipeline.config;

import java.util.Objects;

public record PipelineConfig(
        String inferenceEndpoint,
        String targetModel,
        String defaultParameterCode,
        String datasetKeyPrefix,
        AnomalyPolicy anomalyPolicy
) {
    public static final String DEFAULT_PARAMETER_CODE = "00060";
    public static final String DEFAULT_DATASET_PREFIX = "processed/";

    public PipelineConfig {
        defaultParameterCode = isBlank(defaultParameterCode) ? DEFAULT_PARAMETER_CODE : defaultParameterCode;
        datasetKeyPrefix = isBlank(datasetKeyPrefix) ? DEFAULT_DATASET_PREFIX : datasetKeyPrefix;
        anomalyPolicy = Objects.requireNonNullElse(anomalyPolicy, AnomalyPolicy.DEFAULT);
    }

    public boolean hasInferenceEndpoint() {
        return !isBlank(inferenceEndpoint);
    }

    public boolean hasTargetModel() {
        return !isBlank(targetModel);
    }

    public String parameterOrDefault(String parameterCode) {
        return isBlank(parameterCode) ? defaultParameterCode : parameterCode.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
