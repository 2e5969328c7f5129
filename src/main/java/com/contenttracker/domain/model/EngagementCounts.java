package com.contenttracker.domain.model;

/**
 * The five public counters shown under a content item.
 */
public record EngagementCounts(
    long retweets,
    long likes,
    long replies,
    long quotes,
    long views
) {}
