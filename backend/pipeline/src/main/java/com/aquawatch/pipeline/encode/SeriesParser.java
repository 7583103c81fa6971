package com.aquawatch.pipeline.encode;

import com.aquawatch.core.error.DocumentParseException;
import com.aquawatch.core.model.Observation;
import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads WaterML-style JSON ({@code value.timeSeries[].values[].value[]}) into observations.
 * <p>
 * Points whose {@code dateTime} is not an RFC 3339 instant (seconds and offset required) are dropped.
 * Values are scanned leniently: the longest leading decimal prefix is used and anything
 * without one becomes {@code 0.0}. Both cases are counted so callers can report them.
 */
public final class SeriesParser {
    // RFC 3339 date-time: seconds and offset are mandatory, the fraction is not.
    static final DateTimeFormatter RFC_3339 = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendOffset("+HH:MM", "Z")
            .toFormatter(Locale.ROOT)
            .withChronology(IsoChronology.INSTANCE)
            .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern LEADING_DECIMAL =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private SeriesParser() {
    }

    public static List<ParsedSeries> parse(RawSeriesDocument document) {
        JsonNode root;
        try {
            root = JsonUtils.readTree(document.body());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DocumentParseException("Failed to parse provider document", e);
        }
        JsonNode timeSeries = root.path("value").path("timeSeries");
        List<ParsedSeries> parsed = new ArrayList<>();
        for (JsonNode series : timeSeries) {
            parsed.add(parseSeries(series));
        }
        return parsed;
    }

    private static ParsedSeries parseSeries(JsonNode series) {
        JsonNode sourceInfo = series.path("sourceInfo");
        String siteId = sourceInfo.path("siteCode").path(0).path("value").asText("");
        JsonNode location = sourceInfo.path("geoLocation").path("geogLocation");
        double latitude = location.path("latitude").asDouble(0.0);
        double longitude = location.path("longitude").asDouble(0.0);
        String unit = series.path("variable").path("unit").path("unitCode").asText("");

        List<Observation> observations = new ArrayList<>();
        int skippedTimestamps = 0;
        int zeroedValues = 0;
        for (JsonNode block : series.path("values")) {
            for (JsonNode point : block.path("value")) {
                Optional<Instant> timestamp = parseInstant(point.path("dateTime").asText(""));
                if (timestamp.isEmpty()) {
                    skippedTimestamps++;
                    continue;
                }
                String rawValue = point.path("value").asText("");
                Optional<Double> value = scanDecimal(rawValue);
                if (value.isEmpty()) {
                    zeroedValues++;
                }
                observations.add(new Observation(
                        siteId,
                        timestamp.get(),
                        value.orElse(0.0),
                        unit,
                        latitude,
                        longitude
                ));
            }
        }
        return new ParsedSeries(siteId, unit, latitude, longitude, observations, skippedTimestamps, zeroedValues);
    }

    static Optional<Instant> parseInstant(String raw) {
        try {
            return Optional.of(OffsetDateTime.parse(raw, RFC_3339).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static Optional<Double> scanDecimal(String raw) {
        Matcher matcher = LEADING_DECIMAL.matcher(raw.strip());
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(Double.parseDouble(matcher.group()));
    }
}
