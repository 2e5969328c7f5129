package com.contenttracker.adapter.out.memory;

import com.contenttracker.application.port.out.EventOutbox;
import com.contenttracker.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO of serialized events awaiting an external consumer.
 * When full, the oldest envelope is dropped so recent session activity is kept.
 */
@Repository
public class InMemoryEventOutbox implements EventOutbox {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventOutbox.class);

    private final Deque<EventEnvelope> pending = new ArrayDeque<>();
    private final int capacity;

    public InMemoryEventOutbox(AppProperties appProperties) {
        this.capacity = appProperties.getEvents().getOutboxCapacity();
        if (capacity <= 0) {
            throw new IllegalArgumentException("Outbox capacity must be positive, was " + capacity);
        }
    }

    @Override
    public synchronized void append(EventEnvelope envelope) {
        if (pending.size() >= capacity) {
            EventEnvelope dropped = pending.pollFirst();
            log.warn("Outbox full ({}), dropping oldest event: type={}, aggregateId={}",
                capacity, dropped.eventType(), dropped.aggregateId());
        }
        pending.addLast(envelope);
    }

    @Override
    public synchronized List<EventEnvelope> drain(int limit) {
        List<EventEnvelope> drained = new ArrayList<>(Math.min(limit, pending.size()));
        while (drained.size() < limit && !pending.isEmpty()) {
            drained.add(pending.pollFirst());
        }
        return drained;
    }

    @Override
    public synchronized long countPending() {
        return pending.size();
    }

    @Override
    public synchronized void deleteAll() {
        pending.clear();
    }
}
