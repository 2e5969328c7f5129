package com.contenttracker.domain.event;

import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ThreadId;
import com.contenttracker.domain.model.ThreadProps;

import java.time.Instant;

public record ThreadCreated(
    ThreadId threadId,
    ActorId authorId,
    ThreadProps props,
    Instant createdAt
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return threadId.toString();
    }

    @Override
    public Instant occurredOn() {
        return createdAt;
    }

    @Override
    public String eventType() {
        return "THREAD_CREATED";
    }
}
