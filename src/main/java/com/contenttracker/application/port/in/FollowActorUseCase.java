package com.contenttracker.application.port.in;

import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.Result;

import java.time.Instant;

public interface FollowActorUseCase {
    Result<Instant, TrackingError> follow(ActorId actorId);

    Result<Void, TrackingError> unfollow(ActorId actorId);
}
