package com.iotfleet.domain.service;

import com.iotfleet.domain.model.SensorReading;
import com.iotfleet.pipeline.PipelineException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

/**
 * Simulated sensor fleet for load and demo runs.
 *
 * Every tick each sensor emits one reading: temperature uniform in [10, 60) and humidity
 * uniform in [5, 95), so a share of readings crosses the default thresholds. Publish
 * failures are logged and counted; the next tick carries on.
 */
@Slf4j
public class SensorSimulator {

    static final double MIN_TEMPERATURE = 10.0;
    static final double TEMPERATURE_SPAN = 50.0;
    static final double MIN_HUMIDITY = 5.0;
    static final double HUMIDITY_SPAN = 90.0;

    private final ReadingIngestionService ingestionService;
    private final int sensorCount;
    private final DoubleSupplier random;
    private final AtomicInteger activeSensors = new AtomicInteger();
    private final Counter published;
    private final Counter failed;

    public SensorSimulator(ReadingIngestionService ingestionService, int sensorCount, MeterRegistry meterRegistry) {
        this(ingestionService, sensorCount, meterRegistry, () -> ThreadLocalRandom.current().nextDouble());
    }

    SensorSimulator(ReadingIngestionService ingestionService,
                    int sensorCount,
                    MeterRegistry meterRegistry,
                    DoubleSupplier random) {
        if (sensorCount < 1) {
            throw new IllegalArgumentException("sensorCount must be at least 1, got " + sensorCount);
        }
        this.ingestionService = ingestionService;
        this.sensorCount = sensorCount;
        this.random = random;
        this.published = Counter.builder("simulator.readings")
                .tag("result", "published")
                .register(meterRegistry);
        this.failed = Counter.builder("simulator.readings")
                .tag("result", "failed")
                .register(meterRegistry);
        Gauge.builder("simulator.active_sensors", activeSensors, AtomicInteger::get)
                .register(meterRegistry);
    }

    /**
     * Emit one reading per sensor.
     */
    @Scheduled(fixedRateString = "${app.pipeline.simulator.interval:2s}",
            initialDelayString = "${app.pipeline.simulator.interval:2s}")
    public void tick() {
        activeSensors.set(sensorCount);
        int failures = 0;
        for (int i = 0; i < sensorCount; i++) {
            try {
                ingestionService.submit(generate());
                published.increment();
            } catch (CancellationException e) {
                log.info("Simulator tick interrupted by shutdown after {} reading(s)", i);
                activeSensors.set(0);
                return;
            } catch (PipelineException e) {
                failed.increment();
                failures++;
                log.warn("Simulated reading not published: {}", e.getMessage());
            }
        }
        if (failures > 0) {
            log.warn("Simulator tick finished with {}/{} failed reading(s)", failures, sensorCount);
        } else {
            log.debug("Simulator tick published {} reading(s)", sensorCount);
        }
    }

    SensorReading generate() {
        float temperature = (float) (MIN_TEMPERATURE + random.getAsDouble() * TEMPERATURE_SPAN);
        float humidity = (float) (MIN_HUMIDITY + random.getAsDouble() * HUMIDITY_SPAN);
        return SensorReading.builder()
                .temperature(temperature)
                .humidity(humidity)
                .build();
    }

    public int sensorCount() {
        return sensorCount;
    }
}
