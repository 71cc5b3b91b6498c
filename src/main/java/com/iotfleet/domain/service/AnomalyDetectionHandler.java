package com.iotfleet.domain.service;

import com.iotfleet.domain.model.Anomaly;
import com.iotfleet.domain.model.SensorAlert;
import com.iotfleet.domain.model.SensorReading;
import com.iotfleet.infrastructure.serialization.CodecException;
import com.iotfleet.infrastructure.serialization.JsonCodec;
import com.iotfleet.pipeline.ProcessingOutcome;
import com.iotfleet.pipeline.PublishException;
import com.iotfleet.pipeline.RecordHandler;
import com.iotfleet.pipeline.ReliablePublisher;
import com.iotfleet.pipeline.ShutdownSignal;
import com.iotfleet.pipeline.log.LogRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Decodes raw readings, evaluates thresholds and publishes an alert per anomaly.
 *
 * Outcomes:
 * - Undecodable or incomplete reading: terminal, the record is dead-lettered as-is
 * - Normal reading: success
 * - Anomaly: alert keyed by sensor id on the alert topic, then success
 * - Alert cannot be encoded: terminal
 * - Alert publish exhausted its retries: retryable, the whole record is retried
 *
 * Cancellation from the alert publisher propagates to the consumer.
 */
@Slf4j
public class AnomalyDetectionHandler implements RecordHandler {

    private final JsonCodec<SensorReading> readingCodec;
    private final JsonCodec<SensorAlert> alertCodec;
    private final AnomalyDetector detector;
    private final ReliablePublisher alertPublisher;
    private final MeterRegistry meterRegistry;
    private final Counter readingsProcessed;
    private final Counter invalidReadings;
    private final Timer processingLatency;

    public AnomalyDetectionHandler(JsonCodec<SensorReading> readingCodec,
                                   JsonCodec<SensorAlert> alertCodec,
                                   AnomalyDetector detector,
                                   ReliablePublisher alertPublisher,
                                   MeterRegistry meterRegistry) {
        this.readingCodec = readingCodec;
        this.alertCodec = alertCodec;
        this.detector = detector;
        this.alertPublisher = alertPublisher;
        this.meterRegistry = meterRegistry;
        this.readingsProcessed = Counter.builder("anomaly.readings.processed")
                .description("Readings evaluated against the thresholds")
                .register(meterRegistry);
        this.invalidReadings = Counter.builder("anomaly.readings.invalid")
                .description("Readings that could not be decoded or were incomplete")
                .register(meterRegistry);
        this.processingLatency = Timer.builder("anomaly.processing.latency")
                .register(meterRegistry);
    }

    @Override
    public ProcessingOutcome handle(LogRecord record, ShutdownSignal signal) {
        Timer.Sample sample = Timer.start(meterRegistry);

        SensorReading reading;
        try {
            reading = readingCodec.decode(record.value());
        } catch (CodecException e) {
            invalidReadings.increment();
            log.warn("Undecodable reading at {}: {}", record, e.getMessage());
            return ProcessingOutcome.terminal(e);
        }
        if (!reading.isComplete()) {
            invalidReadings.increment();
            log.warn("Incomplete reading {} at {}", reading.getId(), record);
            return ProcessingOutcome.terminal(
                    new IllegalArgumentException("Reading " + reading.getId() + " is missing a measurement"));
        }

        Optional<Anomaly> anomaly = detector.evaluate(reading);
        if (anomaly.isPresent()) {
            ProcessingOutcome alerted = raiseAlert(reading, anomaly.get(), signal);
            if (!alerted.isSuccess()) {
                return alerted;
            }
        }

        readingsProcessed.increment();
        sample.stop(processingLatency);
        return ProcessingOutcome.success();
    }

    private ProcessingOutcome raiseAlert(SensorReading reading, Anomaly anomaly, ShutdownSignal signal) {
        SensorAlert alert = SensorAlert.from(reading, anomaly.getReason());

        byte[] payload;
        try {
            payload = alertCodec.encode(alert);
        } catch (CodecException e) {
            log.error("Failed to encode alert for sensor {}: {}", reading.getId(), e.getMessage(), e);
            return ProcessingOutcome.terminal(e);
        }

        byte[] key = reading.getId() == null ? null : reading.getId().getBytes(StandardCharsets.UTF_8);
        try {
            alertPublisher.publish(signal, key, payload);
        } catch (PublishException e) {
            log.warn("Alert for sensor {} not published: {}", reading.getId(), e.getMessage());
            return ProcessingOutcome.retryable(e);
        }

        Counter.builder("anomaly.alerts")
                .tag("kind", anomaly.getKind().tag())
                .register(meterRegistry)
                .increment();
        log.info("Alert for sensor {}: {} (temperature={}, humidity={})",
                reading.getId(), anomaly.getReason(), reading.getTemperature(), reading.getHumidity());
        return ProcessingOutcome.success();
    }
}
