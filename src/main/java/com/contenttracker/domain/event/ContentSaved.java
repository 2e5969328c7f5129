package com.contenttracker.domain.event;

import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ContentProps;

import java.time.Instant;

/**
 * A content item was saved locally, carrying the full scraped state at save time.
 */
public record ContentSaved(
    ContentId contentId,
    ActorId authorId,
    ContentProps props,
    Instant savedAt
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return contentId.toString();
    }

    @Override
    public Instant occurredOn() {
        return savedAt;
    }

    @Override
    public String eventType() {
        return "CONTENT_SAVED";
    }
}
