package com.iotfleet.infrastructure.messaging;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerPartitionAssignor;
import org.apache.kafka.clients.consumer.CooperativeStickyAssignor;
import org.apache.kafka.clients.consumer.RangeAssignor;
import org.apache.kafka.clients.consumer.RoundRobinAssignor;
import org.apache.kafka.clients.consumer.StickyAssignor;

import java.util.Locale;

/**
 * Partition assignment strategies selectable by name.
 */
@Slf4j
public enum BalanceStrategy {

    RANGE("range", RangeAssignor.class),
    ROUND_ROBIN("roundrobin", RoundRobinAssignor.class),
    STICKY("sticky", StickyAssignor.class),
    COOPERATIVE_STICKY("cooperative-sticky", CooperativeStickyAssignor.class);

    private final String configName;
    private final Class<? extends ConsumerPartitionAssignor> assignor;

    BalanceStrategy(String configName, Class<? extends ConsumerPartitionAssignor> assignor) {
        this.configName = configName;
        this.assignor = assignor;
    }

    public String configName() {
        return configName;
    }

    /** Value for the consumer's {@code partition.assignment.strategy} property. */
    public String assignorClassName() {
        return assignor.getName();
    }

    /** Case-insensitive lookup; unknown or blank names fall back to {@link #RANGE}. */
    public static BalanceStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            return RANGE;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (BalanceStrategy strategy : values()) {
            if (strategy.configName.equals(normalized)) {
                return strategy;
            }
        }
        log.warn("Unknown balance strategy '{}', using {}", name, RANGE.configName);
        return RANGE;
    }
}
