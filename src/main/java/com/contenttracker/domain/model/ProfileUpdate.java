package com.contenttracker.domain.model;

import java.time.Instant;

/**
 * A partial profile. Fields left {@code null} keep their current value when merged.
 * Clearing an optional field is not expressible; the platform never reports a removed bio
 * separately from an empty one.
 */
public final class ProfileUpdate {

    private String username;
    private String displayName;
    private String bio;
    private String location;
    private String website;
    private String profileImageUrl;
    private String bannerImageUrl;
    private Boolean verified;
    private Boolean protectedAccount;
    private Long followersCount;
    private Long followingCount;
    private Long tweetsCount;
    private Long listedCount;
    private Instant createdAt;
    private Instant joinedAt;

    private ProfileUpdate() {}

    public static ProfileUpdate create() {
        return new ProfileUpdate();
    }

    public ProfileUpdate username(String username) {
        this.username = username;
        return this;
    }

    public ProfileUpdate displayName(String displayName) {
        this.displayName = displayName;
        return this;
    }

    public ProfileUpdate bio(String bio) {
        this.bio = bio;
        return this;
    }

    public ProfileUpdate location(String location) {
        this.location = location;
        return this;
    }

    public ProfileUpdate website(String website) {
        this.website = website;
        return this;
    }

    public ProfileUpdate profileImageUrl(String profileImageUrl) {
        this.profileImageUrl = profileImageUrl;
        return this;
    }

    public ProfileUpdate bannerImageUrl(String bannerImageUrl) {
        this.bannerImageUrl = bannerImageUrl;
        return this;
    }

    public ProfileUpdate verified(boolean verified) {
        this.verified = verified;
        return this;
    }

    public ProfileUpdate protectedAccount(boolean protectedAccount) {
        this.protectedAccount = protectedAccount;
        return this;
    }

    public ProfileUpdate followersCount(long followersCount) {
        this.followersCount = followersCount;
        return this;
    }

    public ProfileUpdate followingCount(long followingCount) {
        this.followingCount = followingCount;
        return this;
    }

    public ProfileUpdate tweetsCount(long tweetsCount) {
        this.tweetsCount = tweetsCount;
        return this;
    }

    public ProfileUpdate listedCount(long listedCount) {
        this.listedCount = listedCount;
        return this;
    }

    public ProfileUpdate createdAt(Instant createdAt) {
        this.createdAt = createdAt;
        return this;
    }

    public ProfileUpdate joinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
        return this;
    }

    /**
     * Shallow merge: every non-null field of this update replaces the matching field of {@code current}.
     */
    public ActorProfile applyTo(ActorProfile current) {
        ActorProfile.Builder merged = current.toBuilder();
        if (username != null) merged.username(username);
        if (displayName != null) merged.displayName(displayName);
        if (bio != null) merged.bio(bio);
        if (location != null) merged.location(location);
        if (website != null) merged.website(website);
        if (profileImageUrl != null) merged.profileImageUrl(profileImageUrl);
        if (bannerImageUrl != null) merged.bannerImageUrl(bannerImageUrl);
        if (verified != null) merged.verified(verified);
        if (protectedAccount != null) merged.protectedAccount(protectedAccount);
        if (followersCount != null) merged.followersCount(followersCount);
        if (followingCount != null) merged.followingCount(followingCount);
        if (tweetsCount != null) merged.tweetsCount(tweetsCount);
        if (listedCount != null) merged.listedCount(listedCount);
        if (createdAt != null) merged.createdAt(createdAt);
        if (joinedAt != null) merged.joinedAt(joinedAt);
        return merged.build();
    }
}
