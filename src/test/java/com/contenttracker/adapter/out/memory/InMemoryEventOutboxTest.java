package com.contenttracker.adapter.out.memory;

import com.contenttracker.application.port.out.EventOutbox.EventEnvelope;
import com.contenttracker.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventOutboxTest {

    private InMemoryEventOutbox outbox;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getEvents().setOutboxCapacity(3);
        outbox = new InMemoryEventOutbox(properties);
    }

    private static EventEnvelope envelope(String aggregateId) {
        return new EventEnvelope(UUID.randomUUID(), "CONTENT_LIKED", aggregateId, Instant.now(), "test", null, "{}");
    }

    @Test
    void drainShouldReturnOldestFirstAndRemove() {
        outbox.append(envelope("1"));
        outbox.append(envelope("2"));
        outbox.append(envelope("3"));

        List<EventEnvelope> drained = outbox.drain(2);

        assertEquals(List.of("1", "2"), drained.stream().map(EventEnvelope::aggregateId).toList());
        assertEquals(1, outbox.countPending());
    }

    @Test
    void drainShouldStopWhenEmpty() {
        outbox.append(envelope("1"));

        assertEquals(1, outbox.drain(10).size());
        assertTrue(outbox.drain(10).isEmpty());
    }

    @Test
    void shouldDropOldestWhenFull() {
        outbox.append(envelope("1"));
        outbox.append(envelope("2"));
        outbox.append(envelope("3"));
        outbox.append(envelope("4"));

        List<EventEnvelope> drained = outbox.drain(10);

        assertEquals(List.of("2", "3", "4"), drained.stream().map(EventEnvelope::aggregateId).toList());
    }

    @Test
    void deleteAllShouldClear() {
        outbox.append(envelope("1"));

        outbox.deleteAll();

        assertEquals(0, outbox.countPending());
    }
}
