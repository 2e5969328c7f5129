package com.contenttracker.domain.model;

/**
 * Platform-reported counters for an actor. Always a snapshot, never derived locally.
 */
public record ActorStats(
    long followersCount,
    long followingCount,
    long tweetsCount,
    long listedCount
) {}
