package com.contenttracker.domain.model;

import com.contenttracker.domain.error.DuplicateActionException;
import com.contenttracker.domain.event.ActorFollowed;
import com.contenttracker.domain.event.ActorProfileUpdated;

import java.time.Instant;
import java.util.Objects;

/**
 * A platform account as seen by the local user ("User" on the platform).
 * <p>
 * Event policy: only {@link #follow()} and {@link #updateProfile(ProfileUpdate)} record facts.
 * Unfollowing resets local state, and stats or flag changes mirror the platform, so none of
 * those emit.
 */
public class Actor extends AggregateRoot<ActorId> {

    private ActorProfile profile;
    private Instant followedAt;

    private Actor(ActorId id, ActorProfile profile, Instant followedAt) {
        super(id);
        this.profile = Objects.requireNonNull(profile, "profile");
        this.followedAt = followedAt;
    }

    public static Actor create(ActorId id, ActorProfile profile) {
        return new Actor(id, profile, null);
    }

    /**
     * Rebuilds an actor from stored state without emitting events.
     */
    public static Actor reconstitute(ActorId id, ActorProfile profile, Instant followedAt) {
        return new Actor(id, profile, followedAt);
    }

    /**
     * @throws DuplicateActionException if the local user already follows this actor
     */
    public void follow() {
        if (isFollowed()) {
            throw new DuplicateActionException("follow", getId().toString(),
                "Actor " + profile.username() + " is already followed");
        }
        followedAt = Instant.now();
        addDomainEvent(new ActorFollowed(getId(), profile.username(), followedAt));
    }

    /**
     * Clears local follow state. No event.
     */
    public void unfollow() {
        followedAt = null;
    }

    public void updateProfile(ProfileUpdate update) {
        ActorProfile oldProfile = profile;
        profile = update.applyTo(oldProfile);
        addDomainEvent(new ActorProfileUpdated(getId(), oldProfile, profile, Instant.now()));
    }

    /**
     * Overwrites the four platform counters. Passive sync, no event.
     */
    public void updateStats(ActorStats stats) {
        profile = profile.withStats(stats);
    }

    public void verify() {
        profile = profile.withVerified(true);
    }

    public void protect() {
        profile = profile.withProtectedAccount(true);
    }

    public void unprotect() {
        profile = profile.withProtectedAccount(false);
    }

    public boolean isFollowed() {
        return followedAt != null;
    }

    public Instant getFollowedAt() {
        return followedAt;
    }

    public ActorProfile getProfile() {
        return profile;
    }

    public String getUsername() {
        return profile.username();
    }

    public String getDisplayName() {
        return profile.displayName();
    }

    public String getBio() {
        return profile.bio();
    }

    public String getLocation() {
        return profile.location();
    }

    public String getWebsite() {
        return profile.website();
    }

    public String getProfileImageUrl() {
        return profile.profileImageUrl();
    }

    public String getBannerImageUrl() {
        return profile.bannerImageUrl();
    }

    public boolean isVerified() {
        return profile.verified();
    }

    public boolean isProtected() {
        return profile.protectedAccount();
    }

    public ActorStats getStats() {
        return profile.stats();
    }

    public Instant getCreatedAt() {
        return profile.createdAt();
    }

    public Instant getJoinedAt() {
        return profile.joinedAt();
    }
}
