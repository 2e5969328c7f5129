package com.contenttracker.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Threshold rules turning engagement metrics into human-readable insights.
 * Rules are evaluated in declaration order and independently of one another: every rule that
 * matches contributes its insight, none short-circuits another.
 */
public enum EngagementInsights {

    HIGH_ENGAGEMENT_RATE(
        "High engagement rate - content resonates well with audience",
        m -> m.engagementRate() > Thresholds.ENGAGEMENT_RATE),

    HIGH_RETWEET_RATIO(
        "High retweet ratio - content is highly shareable",
        m -> m.retweets() > m.likes() * Thresholds.RETWEET_TO_LIKE),

    HIGH_REPLY_RATIO(
        "High reply ratio - content sparks conversation",
        m -> m.replies() > m.likes() * Thresholds.REPLY_TO_LIKE),

    STRONG_CLICK_THROUGH(
        "Strong click-through rate on links",
        // a zero impression count yields an infinite ratio, which counts as strong
        m -> m.urlClicks() > 0 && (double) m.urlClicks() / m.impressions() > Thresholds.URL_CLICK_THROUGH),

    MEDIA_PERFORMS_WELL(
        "Media content performs well",
        m -> m.mediaViews() > 0 && (double) m.mediaEngagements() / m.mediaViews() > Thresholds.MEDIA_ENGAGEMENT),

    DRIVES_PROFILE_VISITS(
        "Content drives profile visits",
        m -> m.profileClicks() > m.impressions() * Thresholds.PROFILE_CLICK);

    private final String insight;
    private final Predicate<EngagementMetrics> rule;

    EngagementInsights(String insight, Predicate<EngagementMetrics> rule) {
        this.insight = insight;
        this.rule = rule;
    }

    public String insight() {
        return insight;
    }

    public boolean appliesTo(EngagementMetrics metrics) {
        return rule.test(metrics);
    }

    /**
     * Evaluates every rule against {@code metrics}, returning the matching insights in rule order.
     */
    public static List<String> generate(EngagementMetrics metrics) {
        List<String> insights = new ArrayList<>();
        for (EngagementInsights candidate : values()) {
            if (candidate.appliesTo(metrics)) {
                insights.add(candidate.insight);
            }
        }
        return insights;
    }

    public static final class Thresholds {
        public static final double ENGAGEMENT_RATE = 0.05;
        public static final double RETWEET_TO_LIKE = 0.3;
        public static final double REPLY_TO_LIKE = 0.2;
        public static final double URL_CLICK_THROUGH = 0.02;
        public static final double MEDIA_ENGAGEMENT = 0.1;
        public static final double PROFILE_CLICK = 0.01;

        private Thresholds() {}
    }
}
