package com.contenttracker.domain.model;

/**
 * Raw engagement counters for one content item over one window, plus the derived rate.
 */
public record EngagementMetrics(
    long impressions,
    long engagements,
    double engagementRate,
    long likes,
    long retweets,
    long replies,
    long quotes,
    long profileClicks,
    long urlClicks,
    long hashtagClicks,
    long detailExpands,
    long mediaViews,
    long mediaEngagements
) {

    public static EngagementMetrics empty() {
        return builder().build();
    }

    EngagementMetrics withEngagementRate(double engagementRate) {
        return toBuilder().engagementRate(engagementRate).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .impressions(impressions)
            .engagements(engagements)
            .engagementRate(engagementRate)
            .likes(likes)
            .retweets(retweets)
            .replies(replies)
            .quotes(quotes)
            .profileClicks(profileClicks)
            .urlClicks(urlClicks)
            .hashtagClicks(hashtagClicks)
            .detailExpands(detailExpands)
            .mediaViews(mediaViews)
            .mediaEngagements(mediaEngagements);
    }

    public static final class Builder {
        private long impressions;
        private long engagements;
        private double engagementRate;
        private long likes;
        private long retweets;
        private long replies;
        private long quotes;
        private long profileClicks;
        private long urlClicks;
        private long hashtagClicks;
        private long detailExpands;
        private long mediaViews;
        private long mediaEngagements;

        private Builder() {}

        public Builder impressions(long impressions) {
            this.impressions = impressions;
            return this;
        }

        public Builder engagements(long engagements) {
            this.engagements = engagements;
            return this;
        }

        public Builder engagementRate(double engagementRate) {
            this.engagementRate = engagementRate;
            return this;
        }

        public Builder likes(long likes) {
            this.likes = likes;
            return this;
        }

        public Builder retweets(long retweets) {
            this.retweets = retweets;
            return this;
        }

        public Builder replies(long replies) {
            this.replies = replies;
            return this;
        }

        public Builder quotes(long quotes) {
            this.quotes = quotes;
            return this;
        }

        public Builder profileClicks(long profileClicks) {
            this.profileClicks = profileClicks;
            return this;
        }

        public Builder urlClicks(long urlClicks) {
            this.urlClicks = urlClicks;
            return this;
        }

        public Builder hashtagClicks(long hashtagClicks) {
            this.hashtagClicks = hashtagClicks;
            return this;
        }

        public Builder detailExpands(long detailExpands) {
            this.detailExpands = detailExpands;
            return this;
        }

        public Builder mediaViews(long mediaViews) {
            this.mediaViews = mediaViews;
            return this;
        }

        public Builder mediaEngagements(long mediaEngagements) {
            this.mediaEngagements = mediaEngagements;
            return this;
        }

        public EngagementMetrics build() {
            return new EngagementMetrics(
                impressions, engagements, engagementRate,
                likes, retweets, replies, quotes,
                profileClicks, urlClicks, hashtagClicks, detailExpands,
                mediaViews, mediaEngagements
            );
        }
    }
}
