package com.iotfleet.pipeline.log;

import java.util.Objects;

/** Log-agnostic topic/partition coordinate. */
public final class TopicPartitionId {

    private final String topic;
    private final int partition;

    public TopicPartitionId(String topic, int partition) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.partition = partition;
    }

    public String topic() {
        return topic;
    }

    public int partition() {
        return partition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TopicPartitionId)) return false;
        TopicPartitionId that = (TopicPartitionId) o;
        return partition == that.partition && topic.equals(that.topic);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, partition);
    }

    @Override
    public String toString() {
        return topic + "-" + partition;
    }
}
