package com.contenttracker.application.service;

import com.contenttracker.application.port.in.ActorTrackingUseCase;
import com.contenttracker.application.port.in.FollowActorUseCase;
import com.contenttracker.application.port.out.ActorRepository;
import com.contenttracker.application.port.out.EventDispatcher;
import com.contenttracker.application.port.out.MetricsPort;
import com.contenttracker.domain.error.DuplicateActionException;
import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.Actor;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ActorProfile;
import com.contenttracker.domain.model.ActorStats;
import com.contenttracker.domain.model.ProfileUpdate;
import com.contenttracker.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

@Service
public class ActorService implements ActorTrackingUseCase, FollowActorUseCase {

    private static final Logger log = LoggerFactory.getLogger(ActorService.class);

    private final ActorRepository actorRepository;
    private final EventDispatcher eventDispatcher;
    private final MetricsPort metrics;

    public ActorService(ActorRepository actorRepository, EventDispatcher eventDispatcher, MetricsPort metrics) {
        this.actorRepository = actorRepository;
        this.eventDispatcher = eventDispatcher;
        this.metrics = metrics;
    }

    @Override
    public Result<Actor, TrackingError> registerActor(ActorId actorId, ActorProfile profile) {
        Actor actor = Actor.create(actorId, profile);
        if (!actorRepository.saveIfAbsent(actor)) {
            log.debug("Actor already registered: actorId={}", actorId);
            return Result.failure(new TrackingError.AlreadyPerformed("register", actorId.toString()));
        }
        log.info("Actor registered: actorId={}, username={}", actorId, profile.username());
        return Result.success(actor);
    }

    @Override
    public Result<ActorProfile, TrackingError> updateProfile(ActorId actorId, ProfileUpdate update) {
        Optional<Actor> found = actorRepository.findById(actorId);
        if (found.isEmpty()) {
            return notFound(actorId);
        }

        Actor actor = found.get();
        actor.updateProfile(update);
        actorRepository.save(actor);
        eventDispatcher.dispatch(actor.commit());
        log.debug("Profile updated: actorId={}", actorId);
        return Result.success(actor.getProfile());
    }

    @Override
    public Result<ActorProfile, TrackingError> syncStats(ActorId actorId, ActorStats stats) {
        Optional<Actor> found = actorRepository.findById(actorId);
        if (found.isEmpty()) {
            return notFound(actorId);
        }

        Actor actor = found.get();
        actor.updateStats(stats);
        actorRepository.save(actor);
        log.debug("Stats synced: actorId={}, stats={}", actorId, stats);
        return Result.success(actor.getProfile());
    }

    @Override
    public Result<Instant, TrackingError> follow(ActorId actorId) {
        log.debug("Processing follow request: actorId={}", actorId);

        Optional<Actor> found = actorRepository.findById(actorId);
        if (found.isEmpty()) {
            return notFound(actorId);
        }

        Actor actor = found.get();
        try {
            actor.follow();
        } catch (DuplicateActionException e) {
            log.warn("Rejected follow of actorId={}: {}", actorId, e.getMessage());
            metrics.incrementRejectedActions(e.getErrorCode());
            return Result.failure(TrackingErrors.from(e));
        }

        actorRepository.save(actor);
        eventDispatcher.dispatch(actor.commit());

        metrics.incrementFollows();
        log.info("Follow recorded: actorId={}, username={}", actorId, actor.getUsername());
        return Result.success(actor.getFollowedAt());
    }

    @Override
    public Result<Void, TrackingError> unfollow(ActorId actorId) {
        Optional<Actor> found = actorRepository.findById(actorId);
        if (found.isEmpty()) {
            return notFound(actorId);
        }

        Actor actor = found.get();
        actor.unfollow();
        actorRepository.save(actor);
        log.info("Unfollow recorded: actorId={}", actorId);
        return Result.success(null);
    }

    private <T> Result<T, TrackingError> notFound(ActorId actorId) {
        log.debug("Actor not tracked: actorId={}", actorId);
        return Result.failure(new TrackingError.NotFound("Actor", actorId.toString()));
    }
}
