package com.contenttracker.integration;

import com.contenttracker.application.port.in.ActorTrackingUseCase;
import com.contenttracker.application.port.in.ContentInteractionUseCase;
import com.contenttracker.application.port.in.EngagementTrackingUseCase;
import com.contenttracker.application.port.in.FollowActorUseCase;
import com.contenttracker.application.port.in.MediaDownloadUseCase;
import com.contenttracker.application.port.in.SaveContentUseCase;
import com.contenttracker.application.port.in.ThreadUseCase;
import com.contenttracker.application.port.out.ActorRepository;
import com.contenttracker.application.port.out.ContentItemRepository;
import com.contenttracker.application.port.out.EngagementRepository;
import com.contenttracker.application.port.out.EventOutbox;
import com.contenttracker.application.port.out.EventOutbox.EventEnvelope;
import com.contenttracker.application.port.out.PlaylistRepository;
import com.contenttracker.application.port.out.ThreadRepository;
import com.contenttracker.application.port.out.VideoDownloadRepository;
import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ActorProfile;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ContentProps;
import com.contenttracker.domain.model.ConversationThread;
import com.contenttracker.domain.model.EngagementKey;
import com.contenttracker.domain.model.EngagementMetrics;
import com.contenttracker.domain.model.EngagementPeriod;
import com.contenttracker.domain.model.EngagementProps;
import com.contenttracker.domain.model.MetricsUpdate;
import com.contenttracker.domain.model.ThreadProps;
import com.contenttracker.domain.model.VideoId;
import com.contenttracker.domain.model.VideoMetadata;
import com.contenttracker.domain.model.VideoQuality;
import com.contenttracker.infrastructure.context.AnalysisSessionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs a whole observation session through the real services, stores and outbox.
 */
@SpringBootTest
@DisplayName("Tracking session")
class TrackingSessionIntegrationTest {

    private static final ContentId CONTENT_ID = ContentId.of("1790000000000000001");
    private static final ActorId AUTHOR_ID = ActorId.of("12345");

    @Autowired
    private SaveContentUseCase saveContentUseCase;

    @Autowired
    private ContentInteractionUseCase contentInteractionUseCase;

    @Autowired
    private ActorTrackingUseCase actorTrackingUseCase;

    @Autowired
    private FollowActorUseCase followActorUseCase;

    @Autowired
    private EngagementTrackingUseCase engagementTrackingUseCase;

    @Autowired
    private MediaDownloadUseCase mediaDownloadUseCase;

    @Autowired
    private ThreadUseCase threadUseCase;

    @Autowired
    private EventOutbox eventOutbox;

    @Autowired
    private ContentItemRepository contentItemRepository;

    @Autowired
    private ActorRepository actorRepository;

    @Autowired
    private EngagementRepository engagementRepository;

    @Autowired
    private VideoDownloadRepository videoDownloadRepository;

    @Autowired
    private PlaylistRepository playlistRepository;

    @Autowired
    private ThreadRepository threadRepository;

    @BeforeEach
    void setUp() {
        contentItemRepository.deleteAll();
        actorRepository.deleteAll();
        engagementRepository.deleteAll();
        videoDownloadRepository.deleteAll();
        playlistRepository.deleteAll();
        threadRepository.deleteAll();
        eventOutbox.deleteAll();
    }

    private List<String> drainEventTypes() {
        return eventOutbox.drain(100).stream().map(EventEnvelope::eventType).toList();
    }

    @Test
    @DisplayName("Content session emits events in action order, tagged with the session id")
    void contentSessionShouldEmitInOrder() {
        try (AnalysisSessionContext.Scope ignored = AnalysisSessionContext.open()) {
            String sessionId = AnalysisSessionContext.getSessionId();

            assertTrue(saveContentUseCase.saveContent(
                CONTENT_ID, AUTHOR_ID, ContentProps.builder().content("Launch day").likeCount(9).build(), null).isSuccess());
            assertEquals(10, contentInteractionUseCase.like(CONTENT_ID).getOrThrow().likes());
            assertTrue(contentInteractionUseCase.retweet(CONTENT_ID).isSuccess());

            var secondLike = contentInteractionUseCase.like(CONTENT_ID);
            assertInstanceOf(TrackingError.AlreadyPerformed.class, secondLike.errorOrNull());

            List<EventEnvelope> envelopes = eventOutbox.drain(100);
            assertEquals(
                List.of("CONTENT_SAVED", "CONTENT_LIKED", "CONTENT_RETWEETED"),
                envelopes.stream().map(EventEnvelope::eventType).toList());
            assertTrue(envelopes.stream().allMatch(e -> sessionId.equals(e.sessionId())));
            assertTrue(envelopes.stream().allMatch(e -> "content-tracker-test".equals(e.source())));
        }
        assertNull(AnalysisSessionContext.getSessionId());
    }

    @Test
    @DisplayName("Saving the same content twice is rejected")
    void duplicateSaveShouldBeRejected() {
        ContentProps props = ContentProps.builder().content("once").build();
        saveContentUseCase.saveContent(CONTENT_ID, AUTHOR_ID, props, null);

        var again = saveContentUseCase.saveContent(CONTENT_ID, AUTHOR_ID, props, null);

        assertInstanceOf(TrackingError.AlreadyPerformed.class, again.errorOrNull());
        assertEquals(List.of("CONTENT_SAVED"), drainEventTypes());
    }

    @Test
    @DisplayName("Follow, unfollow and follow again")
    void followCycle() {
        actorTrackingUseCase.registerActor(AUTHOR_ID, ActorProfile.builder().username("jdoe").build());

        assertTrue(followActorUseCase.follow(AUTHOR_ID).isSuccess());
        assertTrue(followActorUseCase.follow(AUTHOR_ID).isFailure());
        assertTrue(followActorUseCase.unfollow(AUTHOR_ID).isSuccess());
        assertTrue(followActorUseCase.follow(AUTHOR_ID).isSuccess());

        assertEquals(List.of("ACTOR_FOLLOWED", "ACTOR_FOLLOWED"), drainEventTypes());
    }

    @Test
    @DisplayName("Engagement is tracked, updated and analyzed")
    void engagementFlow() {
        EngagementProps props = new EngagementProps(
            EngagementMetrics.empty(), EngagementPeriod.DAY, Instant.now(), null);
        engagementTrackingUseCase.track(CONTENT_ID, AUTHOR_ID, props);
        EngagementKey key = new EngagementKey(CONTENT_ID, AUTHOR_ID);

        var metrics = engagementTrackingUseCase.updateMetrics(key, MetricsUpdate.create()
            .impressions(1000).engagements(100).likes(10).retweets(5).replies(3).urlClicks(25).profileClicks(5));
        assertEquals(0.1, metrics.getOrThrow().engagementRate(), 1e-9);

        List<String> insights = engagementTrackingUseCase.analyze(key).getOrThrow();

        assertEquals(List.of(
            "High engagement rate - content resonates well with audience",
            "High retweet ratio - content is highly shareable",
            "High reply ratio - content sparks conversation",
            "Strong click-through rate on links"
        ), insights);
        assertEquals(List.of("ENGAGEMENT_TRACKED", "ENGAGEMENT_ANALYZED"), drainEventTypes());
    }

    @Test
    @DisplayName("Video download is requested then completed")
    void downloadFlow() {
        VideoId videoId = VideoId.of("dQw4w9WgXcQ");
        VideoMetadata metadata = new VideoMetadata("Keynote", null, 90, Instant.EPOCH, "UC1", "Talks", null, 1, 1, null);

        mediaDownloadUseCase.requestDownload(videoId, metadata, VideoQuality.FULL_HD);
        var completed = mediaDownloadUseCase.completeDownload(videoId, "file:///videos/keynote.mp4");

        assertTrue(completed.getOrThrow().isDownloaded());
        assertTrue(videoDownloadRepository.findById(videoId).orElseThrow().isDownloaded());
        assertEquals(List.of("VIDEO_DOWNLOAD_REQUESTED", "VIDEO_DOWNLOAD_COMPLETED"), drainEventTypes());
    }

    @Test
    @DisplayName("Saved content is linked into a thread")
    void threadFlow() {
        saveContentUseCase.saveContent(CONTENT_ID, AUTHOR_ID, ContentProps.builder().content("1/").build(), null);
        ConversationThread thread = threadUseCase.createThread(AUTHOR_ID, ThreadProps.of("Launch", null, false)).getOrThrow();

        assertTrue(threadUseCase.addToThread(thread.getId(), CONTENT_ID).isSuccess());
        assertTrue(threadUseCase.archiveThread(thread.getId()).isSuccess());
        var late = threadUseCase.addToThread(thread.getId(), ContentId.of("2"));

        assertInstanceOf(TrackingError.InvalidState.class, late.errorOrNull());
        assertEquals(thread.getId(), contentItemRepository.findById(CONTENT_ID).orElseThrow().getThreadId());
        assertEquals(
            List.of("CONTENT_SAVED", "THREAD_CREATED", "CONTENT_ADDED_TO_THREAD", "THREAD_ARCHIVED"),
            drainEventTypes());
    }
}
