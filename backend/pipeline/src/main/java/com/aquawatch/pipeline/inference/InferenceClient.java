package com.aquawatch.pipeline.inference;

import com.aquawatch.core.error.EndpointException;
import com.aquawatch.core.error.NoPredictionParsedException;
import com.aquawatch.pipeline.api.ModelInvoker;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Sends feature-only CSV to the prediction endpoint and reads a single value back.
 */
public class InferenceClient {
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern SEPARATORS = Pattern.compile("[\\[\\]\\r\\n\\t ,]");

    private final ModelInvoker modelInvoker;
    private final String endpoint;

    public InferenceClient(ModelInvoker modelInvoker, String endpoint) {
        this.modelInvoker = Objects.requireNonNull(modelInvoker, "modelInvoker is required");
        this.endpoint = endpoint;
    }

    public byte[] invoke(byte[] featureCsv, String targetModel) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new EndpointException("Inference endpoint not configured");
        }
        if (targetModel == null || targetModel.isBlank()) {
            throw new EndpointException("Target model not configured");
        }
        try {
            return modelInvoker.invoke(endpoint, featureCsv, targetModel);
        } catch (EndpointException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EndpointException("Invoke endpoint " + endpoint + " failed", e);
        }
    }

    /**
     * Drops the first comma-separated field (the label) of every non-blank row.
     * Single-field rows are passed through unchanged.
     */
    public static String stripLabelColumn(String labelledCsv) {
        StringBuilder features = new StringBuilder();
        for (String line : labelledCsv.split("\n")) {
            String row = line.strip();
            if (row.isEmpty()) {
                continue;
            }
            String[] columns = row.split(",", -1);
            String[] kept = columns.length > 1 ? Arrays.copyOfRange(columns, 1, columns.length) : columns;
            features.append(String.join(",", kept)).append('\n');
        }
        return features.toString();
    }

    /**
     * Reads the model output as a list of numbers in any of the shapes endpoints emit
     * ({@code [66.5]}, one per line, comma or whitespace separated) and returns the LAST numeric
     * token. Models may emit one value per input row and only the terminal value is the prediction
     * for the most recent state, so neither the first value nor an average is used.
     */
    public static double parsePrediction(byte[] output) {
        String text = new String(output, StandardCharsets.UTF_8).strip();
        if (text.isEmpty()) {
            throw new NoPredictionParsedException("Empty prediction output");
        }
        Double last = null;
        for (String token : SEPARATORS.matcher(text).replaceAll(",").split(",")) {
            String candidate = token.strip();
            if (!candidate.isEmpty() && NUMBER.matcher(candidate).matches()) {
                last = Double.parseDouble(candidate);
            }
        }
        if (last == null) {
            throw new NoPredictionParsedException("No numeric predictions parsed from output: " + abbreviate(text));
        }
        return last;
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
