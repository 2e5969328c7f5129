package com.contenttracker.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Scraped or API-supplied state of a content item at the moment it was saved.
 * Optional references and descriptors are {@code null} when absent.
 */
public record ContentProps(
    String content,
    List<String> mediaUrls,
    List<String> hashtags,
    List<String> mentions,
    long retweetCount,
    long likeCount,
    long replyCount,
    long quoteCount,
    long viewCount,
    Instant createdAt,
    boolean retweet,
    ContentId originalContentId,
    ContentId inReplyToId,
    boolean quoteTweet,
    ContentId quotedContentId,
    String language,
    String source
) {
    public ContentProps {
        mediaUrls = mediaUrls == null ? List.of() : List.copyOf(mediaUrls);
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
        mentions = mentions == null ? List.of() : List.copyOf(mentions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .content(content)
            .mediaUrls(mediaUrls)
            .hashtags(hashtags)
            .mentions(mentions)
            .retweetCount(retweetCount)
            .likeCount(likeCount)
            .replyCount(replyCount)
            .quoteCount(quoteCount)
            .viewCount(viewCount)
            .createdAt(createdAt)
            .retweet(retweet)
            .originalContentId(originalContentId)
            .inReplyToId(inReplyToId)
            .quoteTweet(quoteTweet)
            .quotedContentId(quotedContentId)
            .language(language)
            .source(source);
    }

    public static final class Builder {
        private String content = "";
        private List<String> mediaUrls = List.of();
        private List<String> hashtags = List.of();
        private List<String> mentions = List.of();
        private long retweetCount;
        private long likeCount;
        private long replyCount;
        private long quoteCount;
        private long viewCount;
        private Instant createdAt;
        private boolean retweet;
        private ContentId originalContentId;
        private ContentId inReplyToId;
        private boolean quoteTweet;
        private ContentId quotedContentId;
        private String language;
        private String source;

        private Builder() {}

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder mediaUrls(List<String> mediaUrls) {
            this.mediaUrls = mediaUrls;
            return this;
        }

        public Builder hashtags(List<String> hashtags) {
            this.hashtags = hashtags;
            return this;
        }

        public Builder mentions(List<String> mentions) {
            this.mentions = mentions;
            return this;
        }

        public Builder retweetCount(long retweetCount) {
            this.retweetCount = retweetCount;
            return this;
        }

        public Builder likeCount(long likeCount) {
            this.likeCount = likeCount;
            return this;
        }

        public Builder replyCount(long replyCount) {
            this.replyCount = replyCount;
            return this;
        }

        public Builder quoteCount(long quoteCount) {
            this.quoteCount = quoteCount;
            return this;
        }

        public Builder viewCount(long viewCount) {
            this.viewCount = viewCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder retweet(boolean retweet) {
            this.retweet = retweet;
            return this;
        }

        public Builder originalContentId(ContentId originalContentId) {
            this.originalContentId = originalContentId;
            return this;
        }

        public Builder inReplyToId(ContentId inReplyToId) {
            this.inReplyToId = inReplyToId;
            return this;
        }

        public Builder quoteTweet(boolean quoteTweet) {
            this.quoteTweet = quoteTweet;
            return this;
        }

        public Builder quotedContentId(ContentId quotedContentId) {
            this.quotedContentId = quotedContentId;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public ContentProps build() {
            return new ContentProps(
                content, mediaUrls, hashtags, mentions,
                retweetCount, likeCount, replyCount, quoteCount, viewCount,
                createdAt, retweet, originalContentId, inReplyToId,
                quoteTweet, quotedContentId, language, source
            );
        }
    }
}
