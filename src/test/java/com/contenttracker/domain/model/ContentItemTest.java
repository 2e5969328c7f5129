package com.contenttracker.domain.model;

import com.contenttracker.domain.error.DuplicateActionException;
import com.contenttracker.domain.event.ContentLiked;
import com.contenttracker.domain.event.ContentRetweeted;
import com.contenttracker.domain.event.ContentSaved;
import com.contenttracker.domain.event.DomainEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentItemTest {

    private static final ContentId CONTENT_ID = ContentId.of("1790000000000000001");
    private static final ActorId AUTHOR_ID = ActorId.of("12345");

    private static ContentProps props() {
        return ContentProps.builder()
            .content("Shipping the new tracker today #java @team")
            .hashtags(List.of("java"))
            .mentions(List.of("team"))
            .likeCount(10)
            .retweetCount(2)
            .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
            .build();
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        void shouldEmitSingleContentSavedEvent() {
            ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, props());

            List<DomainEvent> events = item.getUncommittedEvents();
            assertEquals(1, events.size());
            ContentSaved saved = assertInstanceOf(ContentSaved.class, events.get(0));
            assertEquals(CONTENT_ID, saved.contentId());
            assertEquals(AUTHOR_ID, saved.authorId());
            assertEquals("Shipping the new tracker today #java @team", saved.props().content());
            assertEquals(item.getSavedAt(), saved.savedAt());
            assertEquals("CONTENT_SAVED", saved.eventType());
            assertEquals(CONTENT_ID.value(), saved.aggregateId());
        }

        @Test
        void shouldStartUnlikedAndUnretweeted() {
            ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, props());

            assertFalse(item.isLiked());
            assertFalse(item.isRetweeted());
            assertNotNull(item.getSavedAt());
            assertNull(item.getThreadId());
            assertEquals(new EngagementCounts(2, 10, 0, 0, 0), item.getEngagement());
        }

        @Test
        void shouldDeriveShapePredicatesFromProps() {
            ContentProps reply = props().toBuilder()
                .inReplyToId(ContentId.of("99"))
                .mediaUrls(List.of("https://media.example/1.jpg"))
                .quoteTweet(true)
                .quotedContentId(ContentId.of("98"))
                .build();

            ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, reply);

            assertTrue(item.isReply());
            assertTrue(item.hasMedia());
            assertTrue(item.isQuoteTweet());
            assertFalse(item.isRetweet());
        }
    }

    @Nested
    @DisplayName("like")
    class Like {

        @Test
        void shouldIncrementLikeCountAndEmit() {
            ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, props());
            item.commit();

            item.like();

            assertTrue(item.isLiked());
            assertEquals(11, item.getEngagement().likes());
            List<DomainEvent> events = item.commit();
            assertEquals(1, events.size());
            ContentLiked liked = assertInstanceOf(ContentLiked.class, events.get(0));
            assertEquals(item.getLikedAt(), liked.likedAt());
        }

        @Test
        void shouldRejectSecondLikeWithoutChangingState() {
            ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, props());
            item.like();
            item.commit();

            DuplicateActionException ex = assertThrows(DuplicateActionException.class, item::like);

            assertEquals("DUPLICATE_ACTION", ex.getErrorCode());
            assertEquals("like", ex.getAction());
            assertEquals(11, item.getEngagement().likes());
            assertFalse(item.hasUncommittedEvents());
        }
    }

    @Nested
    @DisplayName("retweet")
    class Retweet {

        @Test
        void shouldIncrementRetweetCountAndEmit() {
            ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, props());
            item.commit();

            item.retweet();

            assertTrue(item.isRetweeted());
            assertEquals(3, item.getEngagement().retweets());
            assertInstanceOf(ContentRetweeted.class, item.commit().get(0));
        }

        @Test
        void shouldRejectSecondRetweet() {
            ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, props());
            item.retweet();

            assertThrows(DuplicateActionException.class, item::retweet);
            assertEquals(3, item.getEngagement().retweets());
        }
    }

    @Test
    void updateEngagementShouldOverwriteCountersWithoutEvent() {
        ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, props());
        item.like();
        item.commit();

        item.updateEngagement(5, 40, 3, 1, 1200);

        assertEquals(new EngagementCounts(5, 40, 3, 1, 1200), item.getEngagement());
        assertTrue(item.isLiked());
        assertFalse(item.hasUncommittedEvents());
    }

    @Test
    void hashtagsAndMentionsShouldNotDuplicate() {
        ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, props());

        item.addHashtag("java");
        item.addHashtag("spring");
        item.addMention("team");

        assertEquals(List.of("java", "spring"), item.getHashtags());
        assertEquals(List.of("team"), item.getMentions());
    }

    @Test
    void nullOrBlankTagsShouldBeIgnored() {
        ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, props());

        item.addHashtag(null);
        item.addHashtag("  ");
        item.addMention(null);
        item.addMention("");

        ContentProps snapshot = item.getProps();
        assertEquals(List.of("java"), snapshot.hashtags());
        assertEquals(List.of("team"), snapshot.mentions());
    }

    @Test
    void threadLinkageShouldBeReversible() {
        ContentItem item = ContentItem.create(CONTENT_ID, AUTHOR_ID, props());
        ThreadId threadId = ThreadId.of("thread-1");

        item.addToThread(threadId);
        assertEquals(threadId, item.getThreadId());

        item.removeFromThread();
        assertNull(item.getThreadId());
    }

    @Test
    void reconstituteShouldRestoreStateWithoutEvents() {
        Instant likedAt = Instant.parse("2024-05-02T08:00:00Z");

        ContentItem item = ContentItem.reconstitute(
            CONTENT_ID, AUTHOR_ID, props(), null, Instant.parse("2024-05-01T12:00:00Z"), likedAt, null);

        assertTrue(item.isLiked());
        assertEquals(likedAt, item.getLikedAt());
        assertFalse(item.isRetweeted());
        assertFalse(item.hasUncommittedEvents());
        assertThrows(DuplicateActionException.class, item::like);
    }
}
