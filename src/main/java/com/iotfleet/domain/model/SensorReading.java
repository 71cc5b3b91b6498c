package com.iotfleet.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One measurement from a fleet sensor, as carried on the raw topic.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SensorReading {

    @JsonProperty("id")
    private String id;

    /** Epoch millis. */
    @JsonProperty("ts")
    private Long timestamp;

    @NotNull
    @JsonProperty("temperature")
    private Float temperature;

    @NotNull
    @JsonProperty("humidity")
    private Float humidity;

    /** Both measurements present; readings without them cannot be evaluated. */
    @JsonIgnore
    public boolean isComplete() {
        return temperature != null && humidity != null;
    }
}
