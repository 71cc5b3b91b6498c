package com.iotfleet.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Alert raised for an anomalous reading. Measurements are copied from the reading as-is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SensorAlert {

    @JsonProperty("sensor_id")
    private String sensorId;

    @JsonProperty("ts")
    private Long timestamp;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("temperature")
    private Float temperature;

    @JsonProperty("humidity")
    private Float humidity;

    public static SensorAlert from(SensorReading reading, String reason) {
        return SensorAlert.builder()
                .sensorId(reading.getId())
                .timestamp(reading.getTimestamp())
                .reason(reason)
                .temperature(reading.getTemperature())
                .humidity(reading.getHumidity())
                .build();
    }
}
