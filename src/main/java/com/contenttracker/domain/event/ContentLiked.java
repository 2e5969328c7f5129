package com.contenttracker.domain.event;

import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;

import java.time.Instant;

public record ContentLiked(
    ContentId contentId,
    ActorId authorId,
    Instant likedAt
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return contentId.toString();
    }

    @Override
    public Instant occurredOn() {
        return likedAt;
    }

    @Override
    public String eventType() {
        return "CONTENT_LIKED";
    }
}
