package com.aquawatch.service;

import com.aquawatch.core.bus.EventBus;
import com.aquawatch.core.events.AnomalyDetected;
import com.aquawatch.core.events.PipelineFailed;
import com.aquawatch.pipeline.AnomalyPipeline;
import com.aquawatch.pipeline.dataset.DatasetAccumulator;
import com.aquawatch.pipeline.detect.AnomalyDecider;
import com.aquawatch.pipeline.encode.FeatureEncoder;
import com.aquawatch.pipeline.inference.InferenceClient;
import com.aquawatch.pipeline.source.PlaceholderFetchStrategy;
import com.aquawatch.pipeline.source.ProviderFetchStrategy;
import com.aquawatch.pipeline.source.TimeSeriesSource;
import com.aquawatch.service.alert.AlertPublisher;
import com.aquawatch.service.alert.AnomalyAlertNotifier;
import com.aquawatch.service.alert.WebhookAlertPublisher;
import com.aquawatch.service.api.ApiServer;
import com.aquawatch.service.config.ConfigLoader;
import com.aquawatch.service.config.ServiceConfig;
import com.aquawatch.service.http.HttpClientFactory;
import com.aquawatch.service.inference.HttpModelInvoker;
import com.aquawatch.service.runtime.IngestScheduler;
import com.aquawatch.service.store.EventCodec;
import com.aquawatch.service.store.FileBlobStore;
import com.aquawatch.service.store.JsonlEventStore;
import com.aquawatch.service.usgs.UsgsWaterClient;
import com.aquawatch.service.weather.NoaaWeatherClient;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        ServiceConfig config = ConfigLoader.load(Path.of("config"), System.getenv());
        Path dataDir = Path.of(config.dataDir());
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(dataDir.resolve("events.jsonl"));
        EventCodec.subscribe(eventBus, List.of(AnomalyDetected.class, PipelineFailed.class), eventStore::append);

        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(5), System.getenv());
        ServiceConfig.ProviderSettings providers = config.providers();
        ExecutorService fetchExecutor = Executors.newFixedThreadPool(providers.fetchConcurrency());
        UsgsWaterClient usgs = new UsgsWaterClient(httpClient, providers.usgsBaseUrl(), providers.timeout(), clock, fetchExecutor);
        TimeSeriesSource source = new TimeSeriesSource(List.of(
                ProviderFetchStrategy.dailyWindow(usgs),
                ProviderFetchStrategy.instantaneous(usgs),
                PlaceholderFetchStrategy.fromClasspath()
        ), eventBus, clock);

        NoaaWeatherClient weather = new NoaaWeatherClient(
                httpClient, providers.noaaBaseUrl(), providers.timeout(), providers.noaaUserAgent());
        ServiceConfig.InferenceSettings inference = config.inference();
        if (inference.baseUrl().isBlank()) {
            LOGGER.warning("INFERENCE_BASE_URL not set; anomaly checks will fail until it is configured");
        }
        InferenceClient inferenceClient = new InferenceClient(
                new HttpModelInvoker(httpClient, inference.baseUrl(), inference.timeout()),
                inference.endpoint()
        );

        AnomalyPipeline pipeline = new AnomalyPipeline(
                source,
                new FeatureEncoder(weather, eventBus, clock),
                new DatasetAccumulator(new FileBlobStore(dataDir.resolve("blobs"))),
                inferenceClient,
                new AnomalyDecider(config.anomaly()),
                config.pipelineConfig(),
                eventBus,
                clock
        );
        AnomalyAlertNotifier notifier = new AnomalyAlertNotifier(alertPublisher(config, httpClient), eventBus, clock);

        IngestScheduler ingestScheduler = new IngestScheduler(pipeline, config.ingest(), eventBus, clock);
        ApiServer apiServer = new ApiServer(
                config.port(),
                pipeline,
                notifier,
                eventStore,
                config.anomaly(),
                config.maxSitesPerCheck(),
                clock
        );
        apiServer.start();
        ingestScheduler.start();
        LOGGER.info("AquaWatch backend started on port " + apiServer.actualPort());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            ingestScheduler.shutdown();
            apiServer.stop();
            fetchExecutor.shutdownNow();
            shutdownLatch.countDown();
        }));
        shutdownLatch.await();
    }

    static AlertPublisher alertPublisher(ServiceConfig config, HttpClient httpClient) {
        String webhook = config.alertWebhookUrl();
        if (webhook == null || webhook.isBlank()) {
            LOGGER.info("ALERT_WEBHOOK_URL not set; alerts are written to the log only");
            return (subject, message) -> LOGGER.warning(subject + "\n" + message);
        }
        return new WebhookAlertPublisher(httpClient, URI.create(webhook), config.providers().timeout());
    }
}
