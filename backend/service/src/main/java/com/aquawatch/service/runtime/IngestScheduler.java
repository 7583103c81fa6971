package com.aquawatch.service.runtime;

import com.aquawatch.core.bus.EventBus;
import com.aquawatch.core.error.PipelineException;
import com.aquawatch.core.events.PipelineFailed;
import com.aquawatch.pipeline.AnomalyPipeline;
import com.aquawatch.pipeline.IngestReport;
import com.aquawatch.service.config.ServiceConfig;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically fetches the configured sites and appends their rows to the training dataset.
 * Runs never overlap because a single scheduler thread drives them.
 */
public class IngestScheduler {
    private static final Logger LOGGER = Logger.getLogger(IngestScheduler.class.getName());

    private final AnomalyPipeline pipeline;
    private final ServiceConfig.IngestSettings settings;
    private final EventBus eventBus;
    private final Clock clock;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "ingest-scheduler");
        thread.setDaemon(true);
        return thread;
    });

    public IngestScheduler(AnomalyPipeline pipeline, ServiceConfig.IngestSettings settings, EventBus eventBus, Clock clock) {
        this(pipeline, settings, eventBus, clock, 1000);
    }

    IngestScheduler(
            AnomalyPipeline pipeline,
            ServiceConfig.IngestSettings settings,
            EventBus eventBus,
            Clock clock,
            long minIntervalMillis
    ) {
        this.pipeline = pipeline;
        this.settings = settings;
        this.eventBus = eventBus;
        this.clock = clock;
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        if (!settings.enabled() || settings.sites().isEmpty()) {
            LOGGER.info("Scheduled ingest disabled");
            return;
        }
        long intervalMillis = Math.max(minIntervalMillis, settings.interval().toMillis());
        timerExecutor.scheduleAtFixedRate(this::runOnce, 0, intervalMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Scheduled ingest every " + settings.interval() + " for sites " + settings.sites());
    }

    public Optional<IngestReport> runOnce() {
        try {
            IngestReport report = pipeline.ingest(settings.sites(), settings.parameterCode(), settings.datasetKey());
            LOGGER.info("Ingest appended to " + report.datasetKey() + " from tier " + report.sourceTier()
                    + " (" + report.datasetBytes() + " bytes total)");
            return Optional.of(report);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Scheduled ingest failed", e);
            String errorType = e instanceof PipelineException pipelineError ? pipelineError.errorType() : "internal";
            eventBus.publish(new PipelineFailed(clock.instant(), String.join(",", settings.sites()), errorType,
                    String.valueOf(e.getMessage())));
            return Optional.empty();
        }
    }

    public void shutdown() {
        timerExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
