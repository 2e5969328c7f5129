package com.contenttracker.domain.event;

import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;

import java.time.Instant;

public record ContentRetweeted(
    ContentId contentId,
    ActorId authorId,
    Instant retweetedAt
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return contentId.toString();
    }

    @Override
    public Instant occurredOn() {
        return retweetedAt;
    }

    @Override
    public String eventType() {
        return "CONTENT_RETWEETED";
    }
}
