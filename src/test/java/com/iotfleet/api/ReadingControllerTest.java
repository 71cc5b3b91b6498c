package com.iotfleet.api;

import com.iotfleet.domain.model.SensorReading;
import com.iotfleet.domain.service.ReadingIngestionService;
import com.iotfleet.pipeline.PublishException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReadingControllerTest {

    @Mock private ReadingIngestionService ingestionService;

    private ReadingController controller;

    @BeforeEach
    void setUp() {
        controller = new ReadingController(ingestionService);
    }

    @Test
    void submitReading_returnsAcceptedWithPublishedReading() {
        SensorReading request = SensorReading.builder().temperature(21.5f).humidity(40.0f).build();
        SensorReading published = SensorReading.builder()
                .id("sensor-1").timestamp(10L).temperature(21.5f).humidity(40.0f).build();
        when(ingestionService.submit(request)).thenReturn(published);

        ResponseEntity<SensorReading> response = controller.submitReading(request);

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertSame(published, response.getBody());
    }

    @Test
    void publishFailed_mapsToServiceUnavailable() {
        PublishException failure = new PublishException("sensor.raw", 3, new IllegalStateException("broker down"));

        ResponseEntity<String> response = controller.publishFailed(failure);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
    }

    @Test
    void health_returnsOk() {
        assertEquals("OK", controller.health().getBody());
    }
}
