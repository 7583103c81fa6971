package com.aquawatch.service.runtime;

import com.aquawatch.core.bus.EventBus;
import com.aquawatch.core.events.PipelineFailed;
import com.aquawatch.core.model.SourceTier;
import com.aquawatch.pipeline.AnomalyPipeline;
import com.aquawatch.pipeline.IngestReport;
import com.aquawatch.service.config.ServiceConfig;
import com.aquawatch.service.store.FileBlobStore;
import com.aquawatch.service.support.TestPipelines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestSchedulerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dataDir;

    private IngestScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    @Test
    void runOnceAppendsEverySiteToTheDataset() throws Exception {
        EventBus bus = new EventBus();
        scheduler = new IngestScheduler(pipeline(bus), settings(true, List.of("03339000", "05420500")), bus, CLOCK);

        Optional<IngestReport> report = scheduler.runOnce();

        assertTrue(report.isPresent());
        assertEquals(SourceTier.INSTANTANEOUS, report.get().sourceTier());
        List<String> rows = Files.readAllLines(dataDir.resolve("processed/dataset.csv"), StandardCharsets.UTF_8);
        assertEquals(2, rows.size());
        assertEquals("72.300000,1756052100,40.101083,-87.597611,80", rows.get(0));
    }

    @Test
    void failedRunIsReportedAndSwallowed() {
        EventBus bus = new EventBus();
        List<PipelineFailed> failures = new CopyOnWriteArrayList<>();
        bus.subscribe(PipelineFailed.class, failures::add);
        scheduler = new IngestScheduler(pipeline(bus), settings(true, List.of("broken-1")), bus, CLOCK);

        assertTrue(scheduler.runOnce().isEmpty());
        assertEquals(1, failures.size());
        assertEquals("broken-1", failures.get(0).siteId());
        assertEquals("document_parse", failures.get(0).errorType());
    }

    @Test
    void startRunsImmediatelyWhenEnabled() throws Exception {
        EventBus bus = new EventBus();
        scheduler = new IngestScheduler(pipeline(bus), settings(true, List.of("03339000")), bus, CLOCK, 10);

        scheduler.start();

        Path dataset = dataDir.resolve("processed/dataset.csv");
        long deadline = System.currentTimeMillis() + 5_000;
        while (!Files.exists(dataset) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(Files.exists(dataset));
    }

    @Test
    void disabledOrSitelessScheduleNeverRuns() throws Exception {
        EventBus bus = new EventBus();
        IngestScheduler disabled = new IngestScheduler(pipeline(bus), settings(false, List.of("03339000")), bus, CLOCK, 10);
        IngestScheduler noSites = new IngestScheduler(pipeline(bus), settings(true, List.of()), bus, CLOCK, 10);

        disabled.start();
        noSites.start();
        Thread.sleep(100);
        disabled.shutdown();
        noSites.shutdown();

        assertTrue(Files.notExists(dataDir.resolve("processed/dataset.csv")));
    }

    private AnomalyPipeline pipeline(EventBus bus) {
        return TestPipelines.create(
                (endpoint, payload, model) -> "1".getBytes(StandardCharsets.UTF_8),
                new FileBlobStore(dataDir),
                bus,
                CLOCK
        );
    }

    private static ServiceConfig.IngestSettings settings(boolean enabled, List<String> sites) {
        return new ServiceConfig.IngestSettings(enabled, Duration.ofHours(6), sites, "00060", null);
    }
}
