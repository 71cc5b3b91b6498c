package com.iotfleet.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.List;

/**
 * Consume-process-publish pipeline bound to the application lifecycle.
 *
 * Start: the consumer joins its group. Stop: the consumer drains first, then every publisher
 * is stopped, so no publish is in flight when a producer connection closes.
 */
@Slf4j
public class ProcessingPipeline implements SmartLifecycle {

    private final GroupConsumer consumer;
    private final List<ReliablePublisher> publishers;
    private volatile boolean running;

    public ProcessingPipeline(GroupConsumer consumer, List<ReliablePublisher> publishers) {
        this.consumer = consumer;
        this.publishers = List.copyOf(publishers);
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        log.info("Starting processing pipeline with publishers {}",
                publishers.stream().map(ReliablePublisher::name).toList());
        consumer.start();
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping processing pipeline");
        try {
            consumer.stop();
        } finally {
            for (ReliablePublisher publisher : publishers) {
                try {
                    publisher.stop();
                } catch (RuntimeException e) {
                    log.error("Failed to stop publisher {}: {}", publisher.name(), e.getMessage(), e);
                }
            }
            running = false;
        }
        log.info("Processing pipeline stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public ConsumerState consumerState() {
        return consumer.state();
    }
}
