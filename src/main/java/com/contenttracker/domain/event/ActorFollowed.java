package com.contenttracker.domain.event;

import com.contenttracker.domain.model.ActorId;

import java.time.Instant;

public record ActorFollowed(
    ActorId actorId,
    String username,
    Instant followedAt
) implements DomainEvent {

    @Override
    public String aggregateId() {
        return actorId.toString();
    }

    @Override
    public Instant occurredOn() {
        return followedAt;
    }

    @Override
    public String eventType() {
        return "ACTOR_FOLLOWED";
    }
}
