package com.questrail.kducer.session.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class KducerTimingPolicyTest {

    @Test
    void defaultsMatchControllerSettleTimes() {
        KducerTimingPolicy policy = KducerTimingPolicy.defaults();

        assertEquals(Duration.ofMillis(50), policy.shortSettle());
        assertEquals(Duration.ofMillis(300), policy.programChangeSettle());
        assertEquals(Duration.ofMillis(50), policy.leverRepressInterval());
        assertEquals(Duration.ofMillis(1000), policy.permanentMemorySettle());
    }

    @Test
    void rejectsNegativeDurations() {
        assertThrows(IllegalArgumentException.class, () -> new KducerTimingPolicy(
                Duration.ofMillis(-1), Duration.ZERO, Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new KducerTimingPolicy(
                Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ofMillis(-1)));
    }

    @Test
    void rejectsNulls() {
        assertThrows(NullPointerException.class, () -> new KducerTimingPolicy(
                null, Duration.ZERO, Duration.ZERO, Duration.ZERO));
    }
}
