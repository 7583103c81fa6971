package com.aquawatch.pipeline.support;

import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.core.model.SourceTier;
import com.aquawatch.pipeline.source.FetchStrategy;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

public class StubFetchStrategy implements FetchStrategy {
    private final SourceTier tier;
    private final Function<List<String>, List<RawSeriesDocument>> behavior;
    private final List<List<String>> calls = new CopyOnWriteArrayList<>();

    public StubFetchStrategy(SourceTier tier, Function<List<String>, List<RawSeriesDocument>> behavior) {
        this.tier = tier;
        this.behavior = behavior;
    }

    public static StubFetchStrategy failing(SourceTier tier, RuntimeException failure) {
        return new StubFetchStrategy(tier, ids -> {
            throw failure;
        });
    }

    public static StubFetchStrategy returning(SourceTier tier, RawSeriesDocument document) {
        return new StubFetchStrategy(tier, ids -> ids.stream().map(id -> document).toList());
    }

    @Override
    public SourceTier tier() {
        return tier;
    }

    @Override
    public List<RawSeriesDocument> fetch(List<String> siteIds, String parameterCode) {
        calls.add(List.copyOf(siteIds));
        return behavior.apply(siteIds);
    }

    public List<List<String>> calls() {
        return List.copyOf(calls);
    }
}
