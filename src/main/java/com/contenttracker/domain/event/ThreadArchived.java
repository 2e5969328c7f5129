package com.contenttracker.domain.event;

import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ThreadId;

import java.time.Instant;

public record ThreadArchived(
    ThreadId threadId,
    ActorId authorId,
    Instant archivedAt
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return threadId.toString();
    }

    @Override
    public Instant occurredOn() {
        return archivedAt;
    }

    @Override
    public String eventType() {
        return "THREAD_ARCHIVED";
    }
}
