package com.iotfleet.api;

import com.iotfleet.domain.model.SensorReading;
import com.iotfleet.domain.service.ReadingIngestionService;
import com.iotfleet.pipeline.PublishException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for reading ingestion.
 *
 * Readings posted here go through the same reliable publisher as simulated ones and are
 * picked up by the anomaly consumer from the raw topic.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/readings")
@RequiredArgsConstructor
public class ReadingController {

    private final ReadingIngestionService ingestionService;

    /**
     * Submit a reading.
     *
     * POST /api/v1/readings
     *
     * Response: 202 with the reading as published (id and timestamp filled in),
     * 503 when the raw topic is unavailable.
     */
    @PostMapping
    public ResponseEntity<SensorReading> submitReading(@Valid @RequestBody SensorReading reading) {
        log.info("Received reading request for sensor {}", reading.getId());

        SensorReading published = ingestionService.submit(reading);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(published);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(PublishException.class)
    public ResponseEntity<String> publishFailed(PublishException e) {
        log.error("Reading not published to {} after {} attempt(s): {}", e.getTopic(), e.getAttempts(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("Reading could not be published, retry later");
    }
}
