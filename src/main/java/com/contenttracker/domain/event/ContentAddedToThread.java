package com.contenttracker.domain.event;

import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ThreadId;

import java.time.Instant;

public record ContentAddedToThread(
    ThreadId threadId,
    ContentId contentId,
    ActorId authorId,
    Instant addedAt
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return threadId.toString();
    }

    @Override
    public Instant occurredOn() {
        return addedAt;
    }

    @Override
    public String eventType() {
        return "CONTENT_ADDED_TO_THREAD";
    }
}
