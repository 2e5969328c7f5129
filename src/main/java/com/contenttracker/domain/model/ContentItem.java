package com.contenttracker.domain.model;

import com.contenttracker.domain.error.DuplicateActionException;
import com.contenttracker.domain.event.ContentLiked;
import com.contenttracker.domain.event.ContentRetweeted;
import com.contenttracker.domain.event.ContentSaved;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A saved piece of content ("Tweet") with its counters and the local user's interactions.
 * <p>
 * Event policy: saving, liking and retweeting are facts and emit. Counter reconciliation,
 * hashtag/mention enrichment and thread linkage are bookkeeping and do not.
 * <p>
 * {@link #like()} and {@link #retweet()} bump their counter optimistically; the next
 * {@link #updateEngagement} overwrites it with the platform's number.
 */
public class ContentItem extends AggregateRoot<ContentId> {

    private final ActorId authorId;
    private final String content;
    private final List<String> mediaUrls;
    private final Set<String> hashtags;
    private final Set<String> mentions;
    private final Instant createdAt;
    private final boolean retweet;
    private final ContentId originalContentId;
    private final ContentId inReplyToId;
    private final boolean quoteTweet;
    private final ContentId quotedContentId;
    private final String language;
    private final String source;

    private long retweetCount;
    private long likeCount;
    private long replyCount;
    private long quoteCount;
    private long viewCount;

    private ThreadId threadId;
    private Instant savedAt;
    private Instant likedAt;
    private Instant retweetedAt;

    private ContentItem(ContentId id, ActorId authorId, ContentProps props, ThreadId threadId) {
        super(id);
        this.authorId = Objects.requireNonNull(authorId, "authorId");
        this.content = props.content();
        this.mediaUrls = new ArrayList<>(props.mediaUrls());
        this.hashtags = new LinkedHashSet<>(props.hashtags());
        this.mentions = new LinkedHashSet<>(props.mentions());
        this.createdAt = props.createdAt();
        this.retweet = props.retweet();
        this.originalContentId = props.originalContentId();
        this.inReplyToId = props.inReplyToId();
        this.quoteTweet = props.quoteTweet();
        this.quotedContentId = props.quotedContentId();
        this.language = props.language();
        this.source = props.source();
        this.retweetCount = props.retweetCount();
        this.likeCount = props.likeCount();
        this.replyCount = props.replyCount();
        this.quoteCount = props.quoteCount();
        this.viewCount = props.viewCount();
        this.threadId = threadId;
    }

    public static ContentItem create(ContentId id, ActorId authorId, ContentProps props) {
        return create(id, authorId, props, null);
    }

    public static ContentItem create(ContentId id, ActorId authorId, ContentProps props, ThreadId threadId) {
        ContentItem item = new ContentItem(id, authorId, props, threadId);
        item.savedAt = Instant.now();
        item.addDomainEvent(new ContentSaved(id, authorId, item.getProps(), item.savedAt));
        return item;
    }

    /**
     * Rebuilds a content item from stored state without emitting events.
     */
    public static ContentItem reconstitute(
            ContentId id,
            ActorId authorId,
            ContentProps props,
            ThreadId threadId,
            Instant savedAt,
            Instant likedAt,
            Instant retweetedAt) {
        ContentItem item = new ContentItem(id, authorId, props, threadId);
        item.savedAt = savedAt;
        item.likedAt = likedAt;
        item.retweetedAt = retweetedAt;
        return item;
    }

    /**
     * @throws DuplicateActionException if the local user already liked this item
     */
    public void like() {
        if (isLiked()) {
            throw new DuplicateActionException("like", getId().toString(), "Content is already liked");
        }
        likedAt = Instant.now();
        likeCount += 1;
        addDomainEvent(new ContentLiked(getId(), authorId, likedAt));
    }

    /**
     * @throws DuplicateActionException if the local user already retweeted this item
     */
    public void retweet() {
        if (isRetweeted()) {
            throw new DuplicateActionException("retweet", getId().toString(), "Content is already retweeted");
        }
        retweetedAt = Instant.now();
        retweetCount += 1;
        addDomainEvent(new ContentRetweeted(getId(), authorId, retweetedAt));
    }

    /**
     * Authoritative reconciliation with a fresh platform read. Overwrites all five counters.
     */
    public void updateEngagement(long retweets, long likes, long replies, long quotes, long views) {
        this.retweetCount = retweets;
        this.likeCount = likes;
        this.replyCount = replies;
        this.quoteCount = quotes;
        this.viewCount = views;
    }

    /**
     * Null or blank tags are ignored.
     */
    public void addHashtag(String hashtag) {
        if (hashtag != null && !hashtag.isBlank()) {
            hashtags.add(hashtag);
        }
    }

    /**
     * Null or blank names are ignored.
     */
    public void addMention(String mention) {
        if (mention != null && !mention.isBlank()) {
            mentions.add(mention);
        }
    }

    public void addToThread(ThreadId threadId) {
        this.threadId = threadId;
    }

    public void removeFromThread() {
        this.threadId = null;
    }

    public boolean isLiked() {
        return likedAt != null;
    }

    public boolean isRetweeted() {
        return retweetedAt != null;
    }

    public boolean isReply() {
        return inReplyToId != null;
    }

    public boolean isQuoteTweet() {
        return quoteTweet;
    }

    public boolean isRetweet() {
        return retweet;
    }

    public boolean hasMedia() {
        return !mediaUrls.isEmpty();
    }

    public ActorId getAuthorId() {
        return authorId;
    }

    public String getContent() {
        return content;
    }

    public List<String> getMediaUrls() {
        return List.copyOf(mediaUrls);
    }

    public List<String> getHashtags() {
        return List.copyOf(hashtags);
    }

    public List<String> getMentions() {
        return List.copyOf(mentions);
    }

    public EngagementCounts getEngagement() {
        return new EngagementCounts(retweetCount, likeCount, replyCount, quoteCount, viewCount);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public ThreadId getThreadId() {
        return threadId;
    }

    public ContentId getOriginalContentId() {
        return originalContentId;
    }

    public ContentId getInReplyToId() {
        return inReplyToId;
    }

    public ContentId getQuotedContentId() {
        return quotedContentId;
    }

    public String getLanguage() {
        return language;
    }

    public String getSource() {
        return source;
    }

    public Instant getSavedAt() {
        return savedAt;
    }

    public Instant getLikedAt() {
        return likedAt;
    }

    public Instant getRetweetedAt() {
        return retweetedAt;
    }

    /**
     * Snapshot of the current property bag, counters included.
     */
    public ContentProps getProps() {
        return ContentProps.builder()
            .content(content)
            .mediaUrls(mediaUrls)
            .hashtags(List.copyOf(hashtags))
            .mentions(List.copyOf(mentions))
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
            .source(source)
            .build();
    }
}
