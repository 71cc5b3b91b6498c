package com.iotfleet.domain.service;

import com.iotfleet.domain.model.SensorReading;
import com.iotfleet.infrastructure.serialization.JsonCodec;
import com.iotfleet.pipeline.ReliablePublisher;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.UUID;

/**
 * Publishes readings to the raw topic, keyed by sensor id.
 *
 * Missing ids get a random UUID and missing timestamps the current time. Blocks until the
 * reading is acknowledged; a {@link com.iotfleet.pipeline.PublishException} means it was not.
 */
@Slf4j
public class ReadingIngestionService {

    private final JsonCodec<SensorReading> readingCodec;
    private final ReliablePublisher readingPublisher;
    private final Clock clock;

    public ReadingIngestionService(JsonCodec<SensorReading> readingCodec,
                                   ReliablePublisher readingPublisher,
                                   Clock clock) {
        this.readingCodec = readingCodec;
        this.readingPublisher = readingPublisher;
        this.clock = clock;
    }

    public SensorReading submit(SensorReading reading) {
        if (reading.getId() == null || reading.getId().isBlank()) {
            reading.setId(UUID.randomUUID().toString());
        }
        if (reading.getTimestamp() == null) {
            reading.setTimestamp(clock.millis());
        }

        byte[] payload = readingCodec.encode(reading);
        readingPublisher.publish(reading.getId().getBytes(StandardCharsets.UTF_8), payload);
        log.debug("Published reading {} to {}", reading.getId(), readingPublisher.topic());
        return reading;
    }
}
