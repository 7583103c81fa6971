package com.aquawatch.pipeline.api;

import com.aquawatch.core.model.WeatherReading;

@FunctionalInterface
public interface WeatherLookup {
    WeatherReading currentFor(double latitude, double longitude);
}
