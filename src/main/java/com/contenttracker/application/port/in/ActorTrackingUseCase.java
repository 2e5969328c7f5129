package com.contenttracker.application.port.in;

import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.Actor;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ActorProfile;
import com.contenttracker.domain.model.ActorStats;
import com.contenttracker.domain.model.ProfileUpdate;
import com.contenttracker.domain.model.Result;

public interface ActorTrackingUseCase {
    Result<Actor, TrackingError> registerActor(ActorId actorId, ActorProfile profile);

    Result<ActorProfile, TrackingError> updateProfile(ActorId actorId, ProfileUpdate update);

    Result<ActorProfile, TrackingError> syncStats(ActorId actorId, ActorStats stats);
}
