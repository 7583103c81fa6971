package com.aquawatch.pipeline.source;

import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.core.model.SourceTier;
import com.aquawatch.pipeline.api.Granularity;
import com.aquawatch.pipeline.api.TimeSeriesProvider;

import java.util.List;
import java.util.Objects;

public final class ProviderFetchStrategy implements FetchStrategy {
    private final TimeSeriesProvider provider;
    private final Granularity granularity;
    private final SourceTier tier;

    private ProviderFetchStrategy(TimeSeriesProvider provider, Granularity granularity, SourceTier tier) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.granularity = granularity;
        this.tier = tier;
    }

    public static ProviderFetchStrategy dailyWindow(TimeSeriesProvider provider) {
        return new ProviderFetchStrategy(provider, Granularity.DAILY_30D, SourceTier.DAILY_30D);
    }

    public static ProviderFetchStrategy instantaneous(TimeSeriesProvider provider) {
        return new ProviderFetchStrategy(provider, Granularity.INSTANTANEOUS, SourceTier.INSTANTANEOUS);
    }

    @Override
    public SourceTier tier() {
        return tier;
    }

    @Override
    public List<RawSeriesDocument> fetch(List<String> siteIds, String parameterCode) {
        return provider.fetch(siteIds, parameterCode, granularity);
    }
}
