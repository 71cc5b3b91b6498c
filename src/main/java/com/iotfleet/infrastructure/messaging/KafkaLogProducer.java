package com.iotfleet.infrastructure.messaging;

import com.iotfleet.pipeline.log.LogProducer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link LogProducer} over a {@link KafkaTemplate}.
 *
 * Each instance owns its producer factory, so closing one publisher closes exactly one
 * producer connection.
 */
@Slf4j
public class KafkaLogProducer implements LogProducer {

    private final String name;
    private final KafkaTemplate<byte[], byte[]> kafkaTemplate;
    private final ProducerFactory<byte[], byte[]> producerFactory;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public KafkaLogProducer(String name, ProducerFactory<byte[], byte[]> producerFactory) {
        this(name, new KafkaTemplate<>(producerFactory), producerFactory);
    }

    KafkaLogProducer(String name,
                     KafkaTemplate<byte[], byte[]> kafkaTemplate,
                     ProducerFactory<byte[], byte[]> producerFactory) {
        this.name = name;
        this.kafkaTemplate = kafkaTemplate;
        this.producerFactory = producerFactory;
    }

    @Override
    public CompletableFuture<Void> produce(String topic, byte[] key, byte[] value) {
        if (closed.get()) {
            throw new IllegalStateException("Producer " + name + " is closed");
        }
        return kafkaTemplate.send(topic, key, value)
                .thenAccept(result -> log.trace("Producer {} wrote to {}-{}@{}", name, topic,
                        result.getRecordMetadata().partition(), result.getRecordMetadata().offset()));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            kafkaTemplate.flush();
        } catch (RuntimeException e) {
            log.warn("Producer {} failed to flush on close: {}", name, e.getMessage());
        }
        if (producerFactory instanceof DisposableBean) {
            try {
                ((DisposableBean) producerFactory).destroy();
            } catch (Exception e) {
                log.error("Producer {} failed to close: {}", name, e.getMessage(), e);
            }
        }
        log.info("Producer {} closed", name);
    }
}
