package com.aquawatch.core.model;

public record WeatherReading(int temperature, String unit, String windSpeed, String windDirection) {
}
