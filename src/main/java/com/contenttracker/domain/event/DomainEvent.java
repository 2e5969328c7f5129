package com.contenttracker.domain.event;

import java.time.Instant;

/**
 * An immutable fact emitted by an aggregate. The record components of each implementation are its payload.
 * {@link #aggregateId()} is the correlation key downstream consumers group by.
 */
public sealed interface DomainEvent permits
        ContentSaved, ContentLiked, ContentRetweeted,
        ActorFollowed, ActorProfileUpdated,
        EngagementTracked, EngagementAnalyzed,
        VideoDownloadRequested, VideoDownloadCompleted, PlaylistSynced,
        ThreadCreated, ContentAddedToThread, ThreadArchived {

    String eventType();

    String aggregateId();

    Instant occurredOn();
}
