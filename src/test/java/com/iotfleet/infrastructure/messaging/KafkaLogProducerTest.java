package com.iotfleet.infrastructure.messaging;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaLogProducerTest {

    private static final String TOPIC = "sensor.alert";
    private static final byte[] KEY = "sensor-1".getBytes(StandardCharsets.UTF_8);
    private static final byte[] VALUE = "{}".getBytes(StandardCharsets.UTF_8);

    @Mock private KafkaTemplate<byte[], byte[]> kafkaTemplate;
    @Mock private DefaultKafkaProducerFactory<byte[], byte[]> producerFactory;

    private KafkaLogProducer producer;

    @BeforeEach
    void setUp() {
        producer = new KafkaLogProducer("alert", kafkaTemplate, producerFactory);
    }

    @Test
    void produce_completesOnAcknowledgment() throws Exception {
        ProducerRecord<byte[], byte[]> sent = new ProducerRecord<>(TOPIC, KEY, VALUE);
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 3), 41L, 0, 0L, KEY.length, VALUE.length);
        when(kafkaTemplate.send(TOPIC, KEY, VALUE))
                .thenReturn(CompletableFuture.completedFuture(new SendResult<>(sent, metadata)));

        CompletableFuture<Void> ack = producer.produce(TOPIC, KEY, VALUE);

        assertNull(ack.get(1, TimeUnit.SECONDS));
        verify(kafkaTemplate).send(TOPIC, KEY, VALUE);
    }

    @Test
    void produce_failsWhenBrokerRejects() {
        CompletableFuture<SendResult<byte[], byte[]>> rejected = new CompletableFuture<>();
        rejected.completeExceptionally(new IllegalStateException("not leader for partition"));
        when(kafkaTemplate.send(TOPIC, KEY, VALUE)).thenReturn(rejected);

        CompletableFuture<Void> ack = producer.produce(TOPIC, KEY, VALUE);

        ExecutionException e = assertThrows(ExecutionException.class, () -> ack.get(1, TimeUnit.SECONDS));
        assertEquals("not leader for partition", e.getCause().getMessage());
    }

    @Test
    void close_flushesAndDestroysFactoryOnce() throws Exception {
        producer.close();
        producer.close();

        verify(kafkaTemplate, times(1)).flush();
        verify(producerFactory, times(1)).destroy();
    }

    @Test
    void produce_afterCloseIsRejected() {
        producer.close();

        assertThrows(IllegalStateException.class, () -> producer.produce(TOPIC, KEY, VALUE));
        verify(kafkaTemplate, never()).send(TOPIC, KEY, VALUE);
    }
}
