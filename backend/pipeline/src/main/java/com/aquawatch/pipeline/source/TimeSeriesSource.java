package com.aquawatch.pipeline.source;

import com.aquawatch.core.bus.EventBus;
import com.aquawatch.core.error.ConfigurationException;
import com.aquawatch.core.error.ProviderFetchException;
import com.aquawatch.core.events.SeriesFetched;
import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.core.model.SourceTier;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fetches raw documents for a batch of sites by walking an ordered list of strategies and
 * stopping at the first one that succeeds for the whole batch.
 */
public class TimeSeriesSource {
    private static final Logger LOGGER = Logger.getLogger(TimeSeriesSource.class.getName());

    private final List<FetchStrategy> ladder;
    private final EventBus eventBus;
    private final Clock clock;

    public TimeSeriesSource(List<FetchStrategy> ladder, EventBus eventBus, Clock clock) {
        if (ladder.isEmpty()) {
            throw new IllegalArgumentException("At least one fetch strategy is required");
        }
        this.ladder = List.copyOf(ladder);
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public FetchResult fetch(List<String> siteIds, String parameterCode) {
        return walk(ladder, siteIds, parameterCode);
    }

    /**
     * Same as {@link #fetch} but skips the daily window tier. Daily values carry local dates
     * without an offset, so they never yield a latest observation.
     */
    public FetchResult fetchLatest(List<String> siteIds, String parameterCode) {
        List<FetchStrategy> latestLadder = ladder.stream()
                .filter(strategy -> strategy.tier() != SourceTier.DAILY_30D)
                .toList();
        if (latestLadder.isEmpty()) {
            throw new ConfigurationException("No fetch tier serves latest values");
        }
        return walk(latestLadder, siteIds, parameterCode);
    }

    private FetchResult walk(List<FetchStrategy> strategies, List<String> siteIds, String parameterCode) {
        if (siteIds == null || siteIds.isEmpty()) {
            throw new ConfigurationException("At least one site id is required");
        }
        List<String> requested = new ArrayList<>();
        List<Integer> slots = new ArrayList<>();
        for (int i = 0; i < siteIds.size(); i++) {
            String siteId = siteIds.get(i) == null ? "" : siteIds.get(i).trim();
            if (!siteId.isEmpty()) {
                requested.add(siteId);
                slots.add(i);
            }
        }

        List<String> failedTiers = new ArrayList<>();
        ProviderFetchException lastFailure = null;
        for (FetchStrategy strategy : strategies) {
            List<RawSeriesDocument> fetched;
            try {
                fetched = requested.isEmpty() ? List.of() : strategy.fetch(requested, parameterCode);
                if (fetched.size() != requested.size()) {
                    throw new ProviderFetchException("Expected " + requested.size() + " documents from "
                            + strategy.tier() + " but received " + fetched.size());
                }
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Fetch tier " + strategy.tier() + " failed for sites " + requested
                        + "; trying next tier", e);
                failedTiers.add(strategy.tier().name());
                lastFailure = e instanceof ProviderFetchException pfe
                        ? pfe
                        : new ProviderFetchException("Fetch tier " + strategy.tier() + " failed", e);
                continue;
            }
            if (strategy.tier().isPlaceholder()) {
                LOGGER.warning("All provider tiers failed for sites " + requested
                        + "; substituting placeholder document. Results are NOT live data.");
            }
            eventBus.publish(new SeriesFetched(clock.instant(), requested, parameterCode, strategy.tier(), List.copyOf(failedTiers)));
            return new FetchResult(align(siteIds.size(), slots, fetched), strategy.tier());
        }
        throw lastFailure;
    }

    private static List<Optional<RawSeriesDocument>> align(int size, List<Integer> slots, List<RawSeriesDocument> fetched) {
        List<Optional<RawSeriesDocument>> aligned = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            aligned.add(Optional.empty());
        }
        for (int i = 0; i < slots.size(); i++) {
            RawSeriesDocument document = fetched.get(i);
            aligned.set(slots.get(i), document == null || document.isBlank() ? Optional.empty() : Optional.of(document));
        }
        return aligned;
    }
}
