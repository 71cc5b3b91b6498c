package com.iotfleet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * IoT Sensor Anomaly Pipeline
 *
 * Consumes raw sensor readings, raises alerts for readings outside thresholds.
 *
 * Architecture:
 * - Kafka consumer group with a bounded worker pool (one dispatch thread per partition)
 * - Per-record retry with exponential backoff and jitter, bounded by attempts and a deadline
 * - Manual offset management (at-least-once delivery, contiguous commits only)
 * - Reliable publishers for alerts and dead letters, with the same retry discipline
 * - Dead-letter topic for records that cannot be processed
 * - Optional simulated sensor fleet and an HTTP ingestion endpoint
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class SensorPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SensorPipelineApplication.class, args);
    }
}
