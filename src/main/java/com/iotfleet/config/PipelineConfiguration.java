package com.iotfleet.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iotfleet.domain.model.SensorAlert;
import com.iotfleet.domain.model.SensorReading;
import com.iotfleet.domain.service.AnomalyDetectionHandler;
import com.iotfleet.domain.service.AnomalyDetector;
import com.iotfleet.domain.service.ReadingIngestionService;
import com.iotfleet.domain.service.SensorSimulator;
import com.iotfleet.infrastructure.messaging.BalanceStrategy;
import com.iotfleet.infrastructure.messaging.KafkaConsumerGroup;
import com.iotfleet.infrastructure.messaging.KafkaLogProducer;
import com.iotfleet.infrastructure.serialization.JsonCodec;
import com.iotfleet.pipeline.BackoffPolicy;
import com.iotfleet.pipeline.BoundedWorkerPool;
import com.iotfleet.pipeline.ConsumerMetrics;
import com.iotfleet.pipeline.GroupConsumer;
import com.iotfleet.pipeline.ProcessingPipeline;
import com.iotfleet.pipeline.PublisherMetrics;
import com.iotfleet.pipeline.ReliablePublisher;
import com.iotfleet.pipeline.RetrySettings;
import com.iotfleet.pipeline.log.LogConsumerGroup;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Wires the consume-detect-publish pipeline.
 *
 * Architecture:
 * - Three reliable publishers (alerts, dead letters, raw readings), each with its own producer
 * - One group consumer on the raw topic running {@link AnomalyDetectionHandler}
 * - Records that exhaust retries, or fail terminally, go to the dead-letter topic unchanged
 */
@Slf4j
@Configuration
public class PipelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JsonCodec<SensorReading> readingCodec(ObjectMapper objectMapper) {
        return new JsonCodec<>(objectMapper, SensorReading.class);
    }

    @Bean
    public JsonCodec<SensorAlert> alertCodec(ObjectMapper objectMapper) {
        return new JsonCodec<>(objectMapper, SensorAlert.class);
    }

    @Bean
    public RetrySettings retrySettings(PipelineProperties properties) {
        PipelineProperties.Retry retry = properties.getRetry();
        return new RetrySettings(retry.getMaxAttempts(), retry.getDeadline(),
                new BackoffPolicy(retry.getBackoffBase(), retry.getJitter()));
    }

    @Bean(destroyMethod = "stop")
    public ReliablePublisher alertPublisher(PipelineProperties properties, KafkaProperties kafkaProperties,
                                            SslBundles sslBundles, RetrySettings retrySettings,
                                            MeterRegistry meterRegistry, Clock clock) {
        return publisher("alert", properties.getTopics().getAlert(),
                kafkaProperties, sslBundles, retrySettings, meterRegistry, clock);
    }

    @Bean(destroyMethod = "stop")
    public ReliablePublisher deadLetterPublisher(PipelineProperties properties, KafkaProperties kafkaProperties,
                                                 SslBundles sslBundles, RetrySettings retrySettings,
                                                 MeterRegistry meterRegistry, Clock clock) {
        return publisher("dead-letter", properties.getTopics().getDeadLetter(),
                kafkaProperties, sslBundles, retrySettings, meterRegistry, clock);
    }

    @Bean(destroyMethod = "stop")
    public ReliablePublisher readingPublisher(PipelineProperties properties, KafkaProperties kafkaProperties,
                                              SslBundles sslBundles, RetrySettings retrySettings,
                                              MeterRegistry meterRegistry, Clock clock) {
        return publisher("reading", properties.getTopics().getInput(),
                kafkaProperties, sslBundles, retrySettings, meterRegistry, clock);
    }

    @Bean
    public LogConsumerGroup sensorConsumerGroup(PipelineProperties properties, KafkaProperties kafkaProperties,
                                                SslBundles sslBundles) {
        PipelineProperties.Consumer consumer = properties.getConsumer();
        BalanceStrategy strategy = BalanceStrategy.fromName(consumer.getBalanceStrategy());

        Map<String, Object> config = kafkaProperties.buildConsumerProperties(sslBundles);
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        config.put(ConsumerConfig.PARTITION_ASSIGNMENT_STRATEGY_CONFIG, strategy.assignorClassName());

        String groupId = kafkaProperties.getConsumer().getGroupId();
        log.info("Consumer group {} on {} using {} assignment", groupId, properties.getTopics().getInput(),
                strategy.configName());

        return KafkaConsumerGroup.builder()
                .consumerFactory(new DefaultKafkaConsumerFactory<>(config,
                        new ByteArrayDeserializer(), new ByteArrayDeserializer()))
                .groupId(groupId)
                .topics(List.of(properties.getTopics().getInput()))
                .commitInterval(consumer.getCommitInterval())
                .partitionBufferSize(consumer.getPartitionBufferSize())
                .claimShutdownTimeout(consumer.getDrainTimeout())
                .build();
    }

    @Bean
    public AnomalyDetector anomalyDetector(PipelineProperties properties) {
        return new AnomalyDetector(properties.getAnomaly().getMaxTemperature(),
                properties.getAnomaly().getMinHumidity());
    }

    @Bean
    public AnomalyDetectionHandler anomalyDetectionHandler(JsonCodec<SensorReading> readingCodec,
                                                           JsonCodec<SensorAlert> alertCodec,
                                                           AnomalyDetector anomalyDetector,
                                                           @Qualifier("alertPublisher") ReliablePublisher alertPublisher,
                                                           MeterRegistry meterRegistry) {
        return new AnomalyDetectionHandler(readingCodec, alertCodec, anomalyDetector, alertPublisher, meterRegistry);
    }

    @Bean
    public GroupConsumer sensorConsumer(PipelineProperties properties,
                                        LogConsumerGroup sensorConsumerGroup,
                                        AnomalyDetectionHandler anomalyDetectionHandler,
                                        @Qualifier("deadLetterPublisher") ReliablePublisher deadLetterPublisher,
                                        RetrySettings retrySettings,
                                        MeterRegistry meterRegistry,
                                        Clock clock) {
        PipelineProperties.Consumer consumer = properties.getConsumer();
        return GroupConsumer.builder()
                .group(sensorConsumerGroup)
                .handler(anomalyDetectionHandler)
                .workerPool(new BoundedWorkerPool("anomaly-worker", consumer.getWorkerPoolSize()))
                .retrySettings(retrySettings)
                .deadLetterPublisher(deadLetterPublisher)
                .metrics(new ConsumerMetrics(meterRegistry))
                .clock(clock)
                .pollTimeout(consumer.getPollTimeout())
                .rejoinInterval(consumer.getRejoinInterval())
                .drainTimeout(consumer.getDrainTimeout())
                .build();
    }

    @Bean
    public ProcessingPipeline processingPipeline(GroupConsumer sensorConsumer,
                                                 @Qualifier("alertPublisher") ReliablePublisher alertPublisher,
                                                 @Qualifier("deadLetterPublisher") ReliablePublisher deadLetterPublisher) {
        return new ProcessingPipeline(sensorConsumer, List.of(alertPublisher, deadLetterPublisher));
    }

    @Bean
    public ReadingIngestionService readingIngestionService(JsonCodec<SensorReading> readingCodec,
                                                           @Qualifier("readingPublisher") ReliablePublisher readingPublisher,
                                                           Clock clock) {
        return new ReadingIngestionService(readingCodec, readingPublisher, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.pipeline.simulator", name = "enabled", havingValue = "true")
    public SensorSimulator sensorSimulator(PipelineProperties properties,
                                           ReadingIngestionService readingIngestionService,
                                           MeterRegistry meterRegistry) {
        log.info("Sensor simulator enabled: {} sensor(s) every {}",
                properties.getSimulator().getSensorCount(), properties.getSimulator().getInterval());
        return new SensorSimulator(readingIngestionService, properties.getSimulator().getSensorCount(), meterRegistry);
    }

    private static ReliablePublisher publisher(String name, String topic, KafkaProperties kafkaProperties,
                                               SslBundles sslBundles, RetrySettings retrySettings,
                                               MeterRegistry meterRegistry, Clock clock) {
        DefaultKafkaProducerFactory<byte[], byte[]> producerFactory = new DefaultKafkaProducerFactory<>(
                kafkaProperties.buildProducerProperties(sslBundles),
                new ByteArraySerializer(), new ByteArraySerializer());
        return new ReliablePublisher(name, topic, new KafkaLogProducer(name, producerFactory),
                retrySettings, new PublisherMetrics(meterRegistry, name), clock);
    }
}
