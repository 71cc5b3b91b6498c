package com.iotfleet.infrastructure.messaging;

import org.apache.kafka.clients.consumer.CooperativeStickyAssignor;
import org.apache.kafka.clients.consumer.RangeAssignor;
import org.apache.kafka.clients.consumer.RoundRobinAssignor;
import org.apache.kafka.clients.consumer.StickyAssignor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BalanceStrategyTest {

    @Test
    void fromName_mapsKnownStrategies() {
        assertEquals(RangeAssignor.class.getName(), BalanceStrategy.fromName("range").assignorClassName());
        assertEquals(RoundRobinAssignor.class.getName(), BalanceStrategy.fromName("roundrobin").assignorClassName());
        assertEquals(StickyAssignor.class.getName(), BalanceStrategy.fromName("sticky").assignorClassName());
        assertEquals(CooperativeStickyAssignor.class.getName(),
                BalanceStrategy.fromName("cooperative-sticky").assignorClassName());
    }

    @Test
    void fromName_isCaseInsensitive() {
        assertEquals(BalanceStrategy.ROUND_ROBIN, BalanceStrategy.fromName(" RoundRobin "));
    }

    @Test
    void fromName_fallsBackToRange() {
        assertEquals(BalanceStrategy.RANGE, BalanceStrategy.fromName("least-loaded"));
        assertEquals(BalanceStrategy.RANGE, BalanceStrategy.fromName(""));
        assertEquals(BalanceStrategy.RANGE, BalanceStrategy.fromName(null));
    }
}
