package com.aquawatch.pipeline.encode;

import com.aquawatch.core.bus.EventBus;
import com.aquawatch.core.events.PointsSkipped;
import com.aquawatch.core.model.FeatureRow;
import com.aquawatch.core.model.Observation;
import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.core.model.WeatherReading;
import com.aquawatch.pipeline.api.WeatherLookup;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns raw provider documents into headerless CSV feature rows
 * {@code value,epoch_seconds,latitude,longitude,temperature}. Weather is looked up once per series.
 */
public class FeatureEncoder {
    private static final Logger LOGGER = Logger.getLogger(FeatureEncoder.class.getName());

    private final WeatherLookup weatherLookup;
    private final EventBus eventBus;
    private final Clock clock;

    public FeatureEncoder(WeatherLookup weatherLookup, EventBus eventBus, Clock clock) {
        this.weatherLookup = Objects.requireNonNull(weatherLookup, "weatherLookup is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public EncodedDocument encode(RawSeriesDocument document) {
        List<FeatureRow> rows = new ArrayList<>();
        Observation latest = null;
        for (ParsedSeries series : SeriesParser.parse(document)) {
            reportLeniency(series);
            int temperature = temperatureFor(series);
            Observation seriesLatest = null;
            for (Observation observation : series.observations()) {
                rows.add(FeatureRow.from(observation, temperature));
                if (seriesLatest == null || observation.timestamp().isAfter(seriesLatest.timestamp())) {
                    seriesLatest = observation;
                }
            }
            if (latest == null) {
                latest = seriesLatest;
            }
        }
        return new EncodedDocument(rows, Optional.ofNullable(latest));
    }

    /**
     * Encodes each present document independently and joins the blocks with exactly one newline.
     */
    public byte[] encodeBatch(List<Optional<RawSeriesDocument>> documents) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Optional<RawSeriesDocument> document : documents) {
            if (document.isEmpty() || document.get().isBlank()) {
                continue;
            }
            byte[] block = encode(document.get()).toCsv().getBytes(StandardCharsets.UTF_8);
            if (block.length == 0) {
                continue;
            }
            byte[] written = out.toByteArray();
            if (written.length > 0 && written[written.length - 1] != '\n') {
                out.write('\n');
            }
            out.writeBytes(block);
        }
        return out.toByteArray();
    }

    private int temperatureFor(ParsedSeries series) {
        try {
            WeatherReading reading = weatherLookup.currentFor(series.latitude(), series.longitude());
            return reading == null ? 0 : reading.temperature();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Weather lookup failed for site " + series.siteId()
                    + " at " + series.latitude() + "," + series.longitude() + "; using temperature 0", e);
            return 0;
        }
    }

    private void reportLeniency(ParsedSeries series) {
        if (series.skippedTimestamps() == 0 && series.zeroedValues() == 0) {
            return;
        }
        LOGGER.warning("Site " + series.siteId() + ": dropped " + series.skippedTimestamps()
                + " point(s) with unparsable timestamps, read " + series.zeroedValues()
                + " non-numeric value(s) as 0.0");
        eventBus.publish(new PointsSkipped(clock.instant(), series.siteId(), series.skippedTimestamps(), series.zeroedValues()));
    }
}
