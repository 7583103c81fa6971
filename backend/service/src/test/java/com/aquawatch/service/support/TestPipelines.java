package com.aquawatch.service.support;

import com.aquawatch.core.bus.EventBus;
import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.core.model.SourceTier;
import com.aquawatch.core.model.WeatherReading;
import com.aquawatch.pipeline.AnomalyPipeline;
import com.aquawatch.pipeline.api.BlobStore;
import com.aquawatch.pipeline.api.ModelInvoker;
import com.aquawatch.pipeline.config.AnomalyPolicy;
import com.aquawatch.pipeline.config.PipelineConfig;
import com.aquawatch.pipeline.dataset.DatasetAccumulator;
import com.aquawatch.pipeline.detect.AnomalyDecider;
import com.aquawatch.pipeline.encode.FeatureEncoder;
import com.aquawatch.pipeline.inference.InferenceClient;
import com.aquawatch.pipeline.source.FetchStrategy;
import com.aquawatch.pipeline.source.PlaceholderFetchStrategy;
import com.aquawatch.pipeline.source.TimeSeriesSource;

import java.time.Clock;
import java.util.List;

/**
 * Pipelines wired with in-process fakes: every site id resolves to the bundled Vermilion River
 * document, except ids starting with {@code broken} which resolve to malformed JSON.
 */
public final class TestPipelines {
    public static final PipelineConfig CONFIG =
            new PipelineConfig("flow-endpoint", "model-03339000.tar.gz", null, null, AnomalyPolicy.DEFAULT);

    private TestPipelines() {
    }

    public static AnomalyPipeline create(ModelInvoker invoker, BlobStore blobStore, EventBus eventBus, Clock clock) {
        return new AnomalyPipeline(
                new TimeSeriesSource(List.of(new CannedStrategy()), eventBus, clock),
                new FeatureEncoder((lat, lon) -> new WeatherReading(80, "F", "5 mph", "S"), eventBus, clock),
                new DatasetAccumulator(blobStore),
                new InferenceClient(invoker, CONFIG.inferenceEndpoint()),
                new AnomalyDecider(AnomalyPolicy.DEFAULT),
                CONFIG,
                eventBus,
                clock
        );
    }

    private static final class CannedStrategy implements FetchStrategy {
        private final RawSeriesDocument vermilion = PlaceholderFetchStrategy.fromClasspath()
                .fetch(List.of("any"), "00060")
                .get(0);

        @Override
        public SourceTier tier() {
            return SourceTier.INSTANTANEOUS;
        }

        @Override
        public List<RawSeriesDocument> fetch(List<String> siteIds, String parameterCode) {
            return siteIds.stream()
                    .map(id -> id.startsWith("broken") ? new RawSeriesDocument("{\"value\":") : vermilion)
                    .toList();
        }
    }
}
