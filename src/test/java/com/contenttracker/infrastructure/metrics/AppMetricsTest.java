package com.contenttracker.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppMetricsTest {

    private MeterRegistry registry;
    private AppMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AppMetrics(registry);
    }

    @Test
    void countersShouldIncrement() {
        metrics.incrementLikes();
        metrics.incrementLikes();
        metrics.incrementEventsDispatched(3);

        assertEquals(2.0, registry.get("content_likes_total").counter().count());
        assertEquals(3.0, registry.get("domain_events_dispatched_total").counter().count());
    }

    @Test
    void rejectedActionsShouldBeTaggedByCode() {
        metrics.incrementRejectedActions("DUPLICATE_ACTION");
        metrics.incrementRejectedActions("DUPLICATE_ACTION");
        metrics.incrementRejectedActions("INVALID_STATE");

        assertEquals(2.0, registry.get(AppMetrics.REJECTED_ACTIONS).tag("code", "DUPLICATE_ACTION").counter().count());
        assertEquals(1.0, registry.get(AppMetrics.REJECTED_ACTIONS).tag("code", "INVALID_STATE").counter().count());
    }

    @Test
    void resetAllShouldZeroEveryCounter() {
        metrics.incrementContentSaved();
        metrics.incrementRejectedActions("DUPLICATE_ACTION");

        metrics.resetAll();

        assertEquals(0.0, registry.get("content_saved_total").counter().count());
        assertNull(registry.find(AppMetrics.REJECTED_ACTIONS).counter());
        metrics.incrementContentSaved();
        assertEquals(1.0, registry.get("content_saved_total").counter().count());
    }
}
