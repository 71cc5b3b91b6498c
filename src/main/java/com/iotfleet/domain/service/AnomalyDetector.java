package com.iotfleet.domain.service;

import com.iotfleet.domain.model.Anomaly;
import com.iotfleet.domain.model.SensorReading;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Threshold check for a single reading.
 *
 * Temperature is checked first; a reading raises at most one anomaly. Both comparisons are
 * strict, so a reading exactly at a threshold is normal.
 */
public class AnomalyDetector {

    public static final double DEFAULT_MAX_TEMPERATURE = 50.0;
    public static final double DEFAULT_MIN_HUMIDITY = 10.0;

    private final double maxTemperature;
    private final double minHumidity;
    private final String temperatureReason;
    private final String humidityReason;

    public AnomalyDetector(double maxTemperature, double minHumidity) {
        this.maxTemperature = maxTemperature;
        this.minHumidity = minHumidity;
        this.temperatureReason = "Temperature exceeds " + plain(maxTemperature) + "°C";
        this.humidityReason = "Humidity below " + plain(minHumidity) + "%";
    }

    public static AnomalyDetector defaults() {
        return new AnomalyDetector(DEFAULT_MAX_TEMPERATURE, DEFAULT_MIN_HUMIDITY);
    }

    public Optional<Anomaly> evaluate(SensorReading reading) {
        if (!reading.isComplete()) {
            throw new IllegalArgumentException("Reading " + reading.getId() + " is missing a measurement");
        }
        if (reading.getTemperature() > maxTemperature) {
            return Optional.of(new Anomaly(Anomaly.Kind.HIGH_TEMPERATURE, temperatureReason));
        }
        if (reading.getHumidity() < minHumidity) {
            return Optional.of(new Anomaly(Anomaly.Kind.LOW_HUMIDITY, humidityReason));
        }
        return Optional.empty();
    }

    public double maxTemperature() {
        return maxTemperature;
    }

    public double minHumidity() {
        return minHumidity;
    }

    // 50.0 -> "50", 12.5 -> "12.5"
    private static String plain(double threshold) {
        return BigDecimal.valueOf(threshold).stripTrailingZeros().toPlainString();
    }
}
