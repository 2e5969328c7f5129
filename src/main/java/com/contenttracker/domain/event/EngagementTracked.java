package com.contenttracker.domain.event;

import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.EngagementKey;
import com.contenttracker.domain.model.EngagementMetrics;

import java.time.Instant;

public record EngagementTracked(
    ContentId contentId,
    ActorId authorId,
    EngagementMetrics metrics,
    Instant trackedAt
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return new EngagementKey(contentId, authorId).toString();
    }

    @Override
    public Instant occurredOn() {
        return trackedAt;
    }

    @Override
    public String eventType() {
        return "ENGAGEMENT_TRACKED";
    }
}
