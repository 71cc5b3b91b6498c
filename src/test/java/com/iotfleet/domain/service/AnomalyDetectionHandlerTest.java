package com.iotfleet.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iotfleet.domain.model.SensorAlert;
import com.iotfleet.domain.model.SensorReading;
import com.iotfleet.infrastructure.serialization.CodecException;
import com.iotfleet.infrastructure.serialization.JsonCodec;
import com.iotfleet.pipeline.ProcessingOutcome;
import com.iotfleet.pipeline.PublishException;
import com.iotfleet.pipeline.ReliablePublisher;
import com.iotfleet.pipeline.ShutdownSignal;
import com.iotfleet.pipeline.log.LogRecord;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionHandlerTest {

    @Mock private ReliablePublisher alertPublisher;

    private MeterRegistry meterRegistry;
    private JsonCodec<SensorReading> readingCodec;
    private JsonCodec<SensorAlert> alertCodec;
    private ShutdownSignal signal;
    private AnomalyDetectionHandler handler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        readingCodec = new JsonCodec<>(objectMapper, SensorReading.class);
        alertCodec = new JsonCodec<>(objectMapper, SensorAlert.class);
        signal = new ShutdownSignal("test");

        handler = new AnomalyDetectionHandler(readingCodec, alertCodec, AnomalyDetector.defaults(),
                alertPublisher, meterRegistry);
    }

    @Test
    void handle_highTemperaturePublishesAlertKeyedBySensor() {
        SensorReading reading = reading("sensor-9", 55.0f, 50.0f);

        ProcessingOutcome outcome = handler.handle(record(readingCodec.encode(reading)), signal);

        assertTrue(outcome.isSuccess());
        ArgumentCaptor<byte[]> payload = ArgumentCaptor.forClass(byte[].class);
        verify(alertPublisher).publish(eq(signal), eq("sensor-9".getBytes(StandardCharsets.UTF_8)), payload.capture());

        SensorAlert alert = alertCodec.decode(payload.getValue());
        assertEquals("sensor-9", alert.getSensorId());
        assertEquals("Temperature exceeds 50°C", alert.getReason());
        assertEquals(reading.getTimestamp(), alert.getTimestamp());
        assertEquals(reading.getTemperature(), alert.getTemperature());
        assertEquals(reading.getHumidity(), alert.getHumidity());
        assertEquals(1.0, meterRegistry.get("anomaly.alerts").tag("kind", "high_temperature").counter().count());
        assertEquals(1.0, meterRegistry.get("anomaly.readings.processed").counter().count());
    }

    @Test
    void handle_lowHumidityPublishesHumidityAlert() {
        ProcessingOutcome outcome = handler.handle(record(readingCodec.encode(reading("sensor-3", 20.0f, 5.0f))), signal);

        assertTrue(outcome.isSuccess());
        ArgumentCaptor<byte[]> payload = ArgumentCaptor.forClass(byte[].class);
        verify(alertPublisher).publish(eq(signal), any(), payload.capture());
        assertEquals("Humidity below 10%", alertCodec.decode(payload.getValue()).getReason());
    }

    @Test
    void handle_normalReadingPublishesNothing() {
        ProcessingOutcome outcome = handler.handle(record(readingCodec.encode(reading("sensor-1", 20.0f, 50.0f))), signal);

        assertTrue(outcome.isSuccess());
        verifyNoInteractions(alertPublisher);
        assertEquals(1.0, meterRegistry.get("anomaly.readings.processed").counter().count());
    }

    @Test
    void handle_undecodablePayloadIsTerminal() {
        ProcessingOutcome outcome = handler.handle(record("<xml/>".getBytes(StandardCharsets.UTF_8)), signal);

        assertTrue(outcome.isTerminal());
        assertInstanceOf(CodecException.class, outcome.getCause());
        verifyNoInteractions(alertPublisher);
        assertEquals(1.0, meterRegistry.get("anomaly.readings.invalid").counter().count());
    }

    @Test
    void handle_nullPayloadIsTerminal() {
        ProcessingOutcome outcome = handler.handle(record("null".getBytes(StandardCharsets.UTF_8)), signal);

        assertTrue(outcome.isTerminal());
        assertInstanceOf(CodecException.class, outcome.getCause());
        verifyNoInteractions(alertPublisher);
    }

    @Test
    void handle_missingMeasurementIsTerminal() {
        byte[] payload = "{\"id\":\"sensor-1\",\"ts\":1,\"temperature\":20.0}".getBytes(StandardCharsets.UTF_8);

        ProcessingOutcome outcome = handler.handle(record(payload), signal);

        assertTrue(outcome.isTerminal());
    }

    @Test
    void handle_alertPublishExhaustedIsRetryable() {
        doThrow(new PublishException("sensor.alert", 3, new IllegalStateException("broker down")))
                .when(alertPublisher).publish(any(ShutdownSignal.class), any(), any());

        ProcessingOutcome outcome = handler.handle(record(readingCodec.encode(reading("sensor-9", 60.0f, 50.0f))), signal);

        assertTrue(outcome.isRetryable());
        assertInstanceOf(PublishException.class, outcome.getCause());
    }

    @Test
    void handle_cancellationPropagates() {
        doThrow(new CancellationException("shutdown"))
                .when(alertPublisher).publish(any(ShutdownSignal.class), any(), any());

        assertThrows(CancellationException.class,
                () -> handler.handle(record(readingCodec.encode(reading("sensor-9", 60.0f, 50.0f))), signal));
    }

    private static SensorReading reading(String id, float temperature, float humidity) {
        return SensorReading.builder()
                .id(id)
                .timestamp(1_700_000_000_000L)
                .temperature(temperature)
                .humidity(humidity)
                .build();
    }

    private static LogRecord record(byte[] value) {
        return new LogRecord("sensor.raw", 0, 12L, null, value);
    }
}
