package com.contenttracker.domain.model;

import java.time.Instant;

/**
 * Profile of a platform account as last observed. Optional text fields are {@code null} when absent.
 */
public record ActorProfile(
    String username,
    String displayName,
    String bio,
    String location,
    String website,
    String profileImageUrl,
    String bannerImageUrl,
    boolean verified,
    boolean protectedAccount,
    long followersCount,
    long followingCount,
    long tweetsCount,
    long listedCount,
    Instant createdAt,
    Instant joinedAt
) {

    public ActorProfile withStats(ActorStats stats) {
        return toBuilder()
            .followersCount(stats.followersCount())
            .followingCount(stats.followingCount())
            .tweetsCount(stats.tweetsCount())
            .listedCount(stats.listedCount())
            .build();
    }

    public ActorProfile withVerified(boolean verified) {
        return toBuilder().verified(verified).build();
    }

    public ActorProfile withProtectedAccount(boolean protectedAccount) {
        return toBuilder().protectedAccount(protectedAccount).build();
    }

    public ActorStats stats() {
        return new ActorStats(followersCount, followingCount, tweetsCount, listedCount);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .username(username)
            .displayName(displayName)
            .bio(bio)
            .location(location)
            .website(website)
            .profileImageUrl(profileImageUrl)
            .bannerImageUrl(bannerImageUrl)
            .verified(verified)
            .protectedAccount(protectedAccount)
            .followersCount(followersCount)
            .followingCount(followingCount)
            .tweetsCount(tweetsCount)
            .listedCount(listedCount)
            .createdAt(createdAt)
            .joinedAt(joinedAt);
    }

    public static final class Builder {
        private String username;
        private String displayName;
        private String bio;
        private String location;
        private String website;
        private String profileImageUrl;
        private String bannerImageUrl;
        private boolean verified;
        private boolean protectedAccount;
        private long followersCount;
        private long followingCount;
        private long tweetsCount;
        private long listedCount;
        private Instant createdAt;
        private Instant joinedAt;

        private Builder() {}

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder bio(String bio) {
            this.bio = bio;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder profileImageUrl(String profileImageUrl) {
            this.profileImageUrl = profileImageUrl;
            return this;
        }

        public Builder bannerImageUrl(String bannerImageUrl) {
            this.bannerImageUrl = bannerImageUrl;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder protectedAccount(boolean protectedAccount) {
            this.protectedAccount = protectedAccount;
            return this;
        }

        public Builder followersCount(long followersCount) {
            this.followersCount = followersCount;
            return this;
        }

        public Builder followingCount(long followingCount) {
            this.followingCount = followingCount;
            return this;
        }

        public Builder tweetsCount(long tweetsCount) {
            this.tweetsCount = tweetsCount;
            return this;
        }

        public Builder listedCount(long listedCount) {
            this.listedCount = listedCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder joinedAt(Instant joinedAt) {
            this.joinedAt = joinedAt;
            return this;
        }

        public ActorProfile build() {
            return new ActorProfile(
                username, displayName, bio, location, website,
                profileImageUrl, bannerImageUrl, verified, protectedAccount,
                followersCount, followingCount, tweetsCount, listedCount,
                createdAt, joinedAt
            );
        }
    }
}
