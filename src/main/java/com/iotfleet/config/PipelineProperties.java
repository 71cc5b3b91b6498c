package com.iotfleet.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Pipeline settings under {@code app.pipeline}. Broker connection, group id and producer
 * acks stay under {@code spring.kafka}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    @Valid
    private Topics topics = new Topics();

    @Valid
    private Consumer consumer = new Consumer();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Anomaly anomaly = new Anomaly();

    @Valid
    private Simulator simulator = new Simulator();

    @Data
    public static class Topics {
        @NotBlank
        private String input = "sensor.raw";
        @NotBlank
        private String alert = "sensor.alert";
        @NotBlank
        private String deadLetter = "sensor.raw.dlt";
    }

    @Data
    public static class Consumer {
        @Min(1)
        private int workerPoolSize = 10;
        /** range, roundrobin, sticky or cooperative-sticky. */
        private String balanceStrategy = "range";
        @NotNull
        private Duration pollTimeout = Duration.ofMillis(500);
        @NotNull
        private Duration rejoinInterval = Duration.ofSeconds(1);
        @NotNull
        private Duration commitInterval = Duration.ofSeconds(1);
        @NotNull
        private Duration drainTimeout = Duration.ofSeconds(30);
        @Min(1)
        private int partitionBufferSize = 500;
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration backoffBase = Duration.ofMillis(100);
        @NotNull
        private Duration deadline = Duration.ofMinutes(2);
        @DecimalMin("0.0")
        @DecimalMax(value = "1.0", inclusive = false)
        private double jitter = 0.2;
    }

    @Data
    public static class Anomaly {
        private double maxTemperature = 50.0;
        private double minHumidity = 10.0;
    }

    @Data
    public static class Simulator {
        private boolean enabled = false;
        @Min(1)
        private int sensorCount = 1000;
        @NotNull
        private Duration interval = Duration.ofSeconds(2);
    }
}
