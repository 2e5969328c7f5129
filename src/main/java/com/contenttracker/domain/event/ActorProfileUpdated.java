package com.contenttracker.domain.event;

import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ActorProfile;

import java.time.Instant;

/**
 * Carries both profile snapshots so consumers can diff without keeping their own copy.
 */
public record ActorProfileUpdated(
    ActorId actorId,
    ActorProfile oldProfile,
    ActorProfile newProfile,
    Instant updatedAt
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return actorId.toString();
    }

    @Override
    public Instant occurredOn() {
        return updatedAt;
    }

    @Override
    public String eventType() {
        return "ACTOR_PROFILE_UPDATED";
    }
}
