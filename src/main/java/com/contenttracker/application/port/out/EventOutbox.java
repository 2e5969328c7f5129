package com.contenttracker.application.port.out;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Holds serialized events until an external consumer drains them.
 */
public interface EventOutbox {
    void append(EventEnvelope envelope);

    /**
     * Removes and returns up to {@code limit} envelopes, oldest first.
     */
    List<EventEnvelope> drain(int limit);

    long countPending();

    void deleteAll();

    record EventEnvelope(
        UUID id,
        String eventType,
        String aggregateId,
        Instant occurredOn,
        String source,
        String sessionId,
        String payload
    ) {}
}
