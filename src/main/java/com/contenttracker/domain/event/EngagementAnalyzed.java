package com.contenttracker.domain.event;

import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.EngagementKey;
import com.contenttracker.domain.model.EngagementMetrics;

import java.time.Instant;
import java.util.List;

public record EngagementAnalyzed(
    ContentId contentId,
    ActorId authorId,
    EngagementMetrics metrics,
    List<String> insights,
    Instant analyzedAt
) implements DomainEvent {

    public EngagementAnalyzed {
        insights = List.copyOf(insights);
    }

    @Override
    public String aggregateId() {
        return new EngagementKey(contentId, authorId).toString();
    }

    @Override
    public Instant occurredOn() {
        return analyzedAt;
    }

    @Override
    public String eventType() {
        return "ENGAGEMENT_ANALYZED";
    }
}
