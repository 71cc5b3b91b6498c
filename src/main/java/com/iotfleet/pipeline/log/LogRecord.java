package com.iotfleet.pipeline.log;

import java.util.Arrays;
import java.util.Objects;

/**
 * One record pulled from a partitioned log. Key and value are opaque bytes; the record is
 * immutable, arrays are copied in and out.
 */
public final class LogRecord {

    private final String topic;
    private final int partition;
    private final long offset;
    private final byte[] key;
    private final byte[] value;

    public LogRecord(String topic, int partition, long offset, byte[] key, byte[] value) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.partition = partition;
        this.offset = offset;
        this.key = key == null ? null : key.clone();
        this.value = value == null ? new byte[0] : value.clone();
    }

    public String topic() {
        return topic;
    }

    public int partition() {
        return partition;
    }

    public long offset() {
        return offset;
    }

    /** Record key, or null when the record was produced without one. */
    public byte[] key() {
        return key == null ? null : key.clone();
    }

    public byte[] value() {
        return value.clone();
    }

    public int valueSize() {
        return value.length;
    }

    public TopicPartitionId source() {
        return new TopicPartitionId(topic, partition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogRecord)) return false;
        LogRecord that = (LogRecord) o;
        return partition == that.partition
                && offset == that.offset
                && topic.equals(that.topic)
                && Arrays.equals(key, that.key)
                && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(topic, partition, offset);
        result = 31 * result + Arrays.hashCode(key);
        result = 31 * result + Arrays.hashCode(value);
        return result;
    }

    @Override
    public String toString() {
        return topic + "-" + partition + "@" + offset;
    }
}
