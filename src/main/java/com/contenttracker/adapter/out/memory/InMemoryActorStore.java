package com.contenttracker.adapter.out.memory;

import com.contenttracker.application.port.out.ActorRepository;
import com.contenttracker.domain.model.Actor;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ActorProfile;
import com.contenttracker.infrastructure.config.AppProperties;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public class InMemoryActorStore
        extends InMemoryAggregateStore<ActorId, Actor, InMemoryActorStore.Snapshot>
        implements ActorRepository {

    public InMemoryActorStore(AppProperties appProperties) {
        super(appProperties.getStore().getMaxEntries());
    }

    @Override
    protected Snapshot snapshot(Actor actor) {
        return new Snapshot(actor.getProfile(), actor.getFollowedAt());
    }

    @Override
    protected Actor restore(ActorId id, Snapshot s) {
        return Actor.reconstitute(id, s.profile(), s.followedAt());
    }

    record Snapshot(ActorProfile profile, Instant followedAt) {}
}
