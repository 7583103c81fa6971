package com.aquawatch.pipeline;

import com.aquawatch.core.bus.EventBus;
import com.aquawatch.core.error.ConfigurationException;
import com.aquawatch.core.error.DocumentParseException;
import com.aquawatch.core.error.PipelineException;
import com.aquawatch.core.events.PipelineFailed;
import com.aquawatch.core.model.Observation;
import com.aquawatch.core.model.PredictionResult;
import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.pipeline.config.AnomalyPolicy;
import com.aquawatch.pipeline.config.PipelineConfig;
import com.aquawatch.pipeline.dataset.DatasetAccumulator;
import com.aquawatch.pipeline.detect.AnomalyDecider;
import com.aquawatch.pipeline.detect.Decision;
import com.aquawatch.pipeline.encode.EncodedDocument;
import com.aquawatch.pipeline.encode.FeatureEncoder;
import com.aquawatch.pipeline.inference.InferenceClient;
import com.aquawatch.pipeline.source.FetchResult;
import com.aquawatch.pipeline.source.TimeSeriesSource;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetch, encode, infer and decide for one site, plus the batch encode-and-append path used by ingest.
 */
public class AnomalyPipeline {
    private static final Logger LOGGER = Logger.getLogger(AnomalyPipeline.class.getName());

    private final TimeSeriesSource source;
    private final FeatureEncoder encoder;
    private final DatasetAccumulator accumulator;
    private final InferenceClient inferenceClient;
    private final AnomalyDecider decider;
    private final PipelineConfig config;
    private final EventBus eventBus;
    private final Clock clock;

    public AnomalyPipeline(
            TimeSeriesSource source,
            FeatureEncoder encoder,
            DatasetAccumulator accumulator,
            InferenceClient inferenceClient,
            AnomalyDecider decider,
            PipelineConfig config,
            EventBus eventBus,
            Clock clock
    ) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.encoder = Objects.requireNonNull(encoder, "encoder is required");
        this.accumulator = Objects.requireNonNull(accumulator, "accumulator is required");
        this.inferenceClient = Objects.requireNonNull(inferenceClient, "inferenceClient is required");
        this.decider = Objects.requireNonNull(decider, "decider is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public PredictionResult processInferAndDetect(String siteId, String parameterCode) {
        return processInferAndDetect(siteId, parameterCode, decider.defaultPolicy());
    }

    public PredictionResult processInferAndDetect(String siteId, String parameterCode, AnomalyPolicy policy) {
        String site = siteId == null ? "" : siteId.trim();
        if (site.isEmpty()) {
            throw new ConfigurationException("Site id required");
        }
        if (!config.hasInferenceEndpoint()) {
            throw new ConfigurationException("Inference endpoint not configured");
        }
        if (!config.hasTargetModel()) {
            throw new ConfigurationException("Target model not configured");
        }
        String parameter = config.parameterOrDefault(parameterCode);

        FetchResult fetched = source.fetchLatest(List.of(site), parameter);
        RawSeriesDocument document = fetched.first()
                .orElseThrow(() -> new DocumentParseException("No data returned for site " + site));

        EncodedDocument encoded = encoder.encode(document);
        Observation latest = encoded.latestObservation()
                .orElseThrow(() -> new DocumentParseException("No observations found for site " + site));
        String labelledCsv = encoded.toCsv();

        String datasetKey = config.datasetKeyPrefix() + site + "/" + clock.instant().getEpochSecond() + ".csv";
        persistBestEffort(datasetKey, labelledCsv);

        byte[] features = InferenceClient.stripLabelColumn(labelledCsv).getBytes(StandardCharsets.UTF_8);
        byte[] output = inferenceClient.invoke(features, config.targetModel());
        LOGGER.info("Prediction output for site " + site + ": " + new String(output, StandardCharsets.UTF_8).strip());
        double predicted = InferenceClient.parsePrediction(output);

        Decision decision = decider.decide(latest.value(), predicted, policy);
        return PredictionResult.of(
                site,
                decision.observed(),
                decision.predicted(),
                decision.percentChange(),
                decision.anomalous(),
                datasetKey,
                fetched.tier()
        );
    }

    /**
     * Runs {@link #processInferAndDetect} for each non-blank site. A failing site is reported in its
     * outcome and does not stop the others.
     */
    public List<SiteCheckOutcome> checkSites(List<String> siteIds, String parameterCode, AnomalyPolicy policy) {
        List<SiteCheckOutcome> outcomes = new ArrayList<>();
        for (String siteId : siteIds) {
            String site = siteId == null ? "" : siteId.trim();
            if (site.isEmpty()) {
                continue;
            }
            try {
                outcomes.add(SiteCheckOutcome.success(processInferAndDetect(site, parameterCode, policy)));
            } catch (PipelineException e) {
                outcomes.add(fail(site, e.errorType(), e));
            } catch (RuntimeException e) {
                outcomes.add(fail(site, "internal", e));
            }
        }
        return outcomes;
    }

    /**
     * Encodes every present document and appends the rows to the dataset at {@code datasetKey}.
     * Returns the full dataset content after the append.
     */
    public byte[] encodeAndAccumulate(List<Optional<RawSeriesDocument>> documents, String datasetKey) {
        if (datasetKey == null || datasetKey.isBlank()) {
            throw new ConfigurationException("Dataset key required");
        }
        byte[] encoded = encoder.encodeBatch(documents);
        return accumulator.append(datasetKey, encoded);
    }

    /**
     * Fetches the sites through the fallback ladder, then {@link #encodeAndAccumulate}.
     */
    public IngestReport ingest(List<String> siteIds, String parameterCode, String datasetKey) {
        if (datasetKey == null || datasetKey.isBlank()) {
            throw new ConfigurationException("Dataset key required");
        }
        FetchResult fetched = source.fetch(siteIds, config.parameterOrDefault(parameterCode));
        byte[] dataset = encodeAndAccumulate(fetched.documents(), datasetKey);
        return new IngestReport(datasetKey, fetched.tier(), dataset.length);
    }

    /**
     * The parameter code a run uses when the caller passes {@code parameterCode}.
     */
    public String parameterOrDefault(String parameterCode) {
        return config.parameterOrDefault(parameterCode);
    }

    private void persistBestEffort(String datasetKey, String labelledCsv) {
        try {
            accumulator.append(datasetKey, labelledCsv.getBytes(StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to persist dataset snapshot " + datasetKey + "; continuing", e);
        }
    }

    private SiteCheckOutcome fail(String site, String errorType, RuntimeException error) {
        LOGGER.log(Level.WARNING, "Anomaly flow failed for site " + site, error);
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        eventBus.publish(new PipelineFailed(clock.instant(), site, errorType, message));
        return SiteCheckOutcome.failure(site, errorType, message);
    }
}
