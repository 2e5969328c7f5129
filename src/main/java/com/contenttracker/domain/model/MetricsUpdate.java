package com.contenttracker.domain.model;

/**
 * A partial set of raw engagement counters. {@code null} fields keep their current value.
 * There is no engagement rate setter: the rate only ever comes from
 * {@link EngagementSnapshot#updateMetrics(MetricsUpdate)}.
 */
public final class MetricsUpdate {

    private Long impressions;
    private Long engagements;
    private Long likes;
    private Long retweets;
    private Long replies;
    private Long quotes;
    private Long profileClicks;
    private Long urlClicks;
    private Long hashtagClicks;
    private Long detailExpands;
    private Long mediaViews;
    private Long mediaEngagements;

    private MetricsUpdate() {}

    public static MetricsUpdate create() {
        return new MetricsUpdate();
    }

    public MetricsUpdate impressions(long impressions) {
        this.impressions = impressions;
        return this;
    }

    public MetricsUpdate engagements(long engagements) {
        this.engagements = engagements;
        return this;
    }

    public MetricsUpdate likes(long likes) {
        this.likes = likes;
        return this;
    }

    public MetricsUpdate retweets(long retweets) {
        this.retweets = retweets;
        return this;
    }

    public MetricsUpdate replies(long replies) {
        this.replies = replies;
        return this;
    }

    public MetricsUpdate quotes(long quotes) {
        this.quotes = quotes;
        return this;
    }

    public MetricsUpdate profileClicks(long profileClicks) {
        this.profileClicks = profileClicks;
        return this;
    }

    public MetricsUpdate urlClicks(long urlClicks) {
        this.urlClicks = urlClicks;
        return this;
    }

    public MetricsUpdate hashtagClicks(long hashtagClicks) {
        this.hashtagClicks = hashtagClicks;
        return this;
    }

    public MetricsUpdate detailExpands(long detailExpands) {
        this.detailExpands = detailExpands;
        return this;
    }

    public MetricsUpdate mediaViews(long mediaViews) {
        this.mediaViews = mediaViews;
        return this;
    }

    public MetricsUpdate mediaEngagements(long mediaEngagements) {
        this.mediaEngagements = mediaEngagements;
        return this;
    }

    /**
     * Shallow merge into {@code current}. The engagement rate is carried over untouched.
     */
    EngagementMetrics applyTo(EngagementMetrics current) {
        EngagementMetrics.Builder merged = current.toBuilder();
        if (impressions != null) merged.impressions(impressions);
        if (engagements != null) merged.engagements(engagements);
        if (likes != null) merged.likes(likes);
        if (retweets != null) merged.retweets(retweets);
        if (replies != null) merged.replies(replies);
        if (quotes != null) merged.quotes(quotes);
        if (profileClicks != null) merged.profileClicks(profileClicks);
        if (urlClicks != null) merged.urlClicks(urlClicks);
        if (hashtagClicks != null) merged.hashtagClicks(hashtagClicks);
        if (detailExpands != null) merged.detailExpands(detailExpands);
        if (mediaViews != null) merged.mediaViews(mediaViews);
        if (mediaEngagements != null) merged.mediaEngagements(mediaEngagements);
        return merged.build();
    }
}
