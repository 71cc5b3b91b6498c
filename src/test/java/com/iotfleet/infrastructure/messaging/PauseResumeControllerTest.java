package com.iotfleet.infrastructure.messaging;

import com.iotfleet.pipeline.log.LogRecord;
import com.iotfleet.pipeline.log.OffsetTracker;
import com.iotfleet.pipeline.log.TopicPartitionId;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PauseResumeControllerTest {

    private static final TopicPartition TP = new TopicPartition("sensor.raw", 0);

    @Mock private Consumer<byte[], byte[]> consumer;

    private OffsetTracker offsets;
    private KafkaPartitionClaim claim;
    private PauseResumeController controller;

    @BeforeEach
    void setUp() {
        offsets = new OffsetTracker();
        TopicPartitionId id = new TopicPartitionId(TP.topic(), TP.partition());
        offsets.assign(List.of(id));
        claim = new KafkaPartitionClaim(id, offsets);
        controller = new PauseResumeController(4);
    }

    @Test
    void pausesAtCapacityAndResumesAtHalf() {
        for (int i = 0; i < 4; i++) {
            claim.append(new LogRecord(TP.topic(), TP.partition(), i, null, new byte[]{1}));
        }

        controller.apply(consumer, Map.of(TP, claim));
        verify(consumer).pause(Set.of(TP));
        assertTrue(controller.isPaused(TP));

        claim.poll(Duration.ZERO);
        controller.apply(consumer, Map.of(TP, claim));
        verify(consumer, never()).resume(anyCollection());

        claim.poll(Duration.ZERO);
        controller.apply(consumer, Map.of(TP, claim));
        verify(consumer).resume(Set.of(TP));
        assertFalse(controller.isPaused(TP));
    }

    @Test
    void belowCapacityIsNotPaused() {
        claim.append(new LogRecord(TP.topic(), TP.partition(), 0, null, new byte[]{1}));

        controller.apply(consumer, Map.of(TP, claim));

        verify(consumer, never()).pause(anyCollection());
    }

    @Test
    void reset_resumesEverythingStillPaused() {
        when(consumer.paused()).thenReturn(Set.of(TP));

        controller.reset(consumer);

        verify(consumer).resume(Set.of(TP));
    }
}
