package com.contenttracker.infrastructure.metrics;

import com.contenttracker.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AppMetrics implements MetricsPort {

    private static final Logger log = LoggerFactory.getLogger(AppMetrics.class);

    static final String REJECTED_ACTIONS = "domain_actions_rejected_total";

    private final MeterRegistry registry;

    private Counter contentSaved;
    private Counter likes;
    private Counter retweets;
    private Counter follows;
    private Counter analyses;
    private Counter downloadsRequested;
    private Counter downloadsCompleted;
    private Counter playlistSyncs;
    private Counter eventsDispatched;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;
        registerAllMeters();
    }

    private void registerAllMeters() {
        this.contentSaved = Counter.builder("content_saved_total")
            .description("Total number of content items saved")
            .register(registry);

        this.likes = Counter.builder("content_likes_total")
            .description("Total number of local likes recorded")
            .register(registry);

        this.retweets = Counter.builder("content_retweets_total")
            .description("Total number of local retweets recorded")
            .register(registry);

        this.follows = Counter.builder("actor_follows_total")
            .description("Total number of follow actions")
            .register(registry);

        this.analyses = Counter.builder("engagement_analyses_total")
            .description("Total number of engagement analyses run")
            .register(registry);

        this.downloadsRequested = Counter.builder("video_downloads_requested_total")
            .description("Total number of video downloads requested")
            .register(registry);

        this.downloadsCompleted = Counter.builder("video_downloads_completed_total")
            .description("Total number of video downloads completed")
            .register(registry);

        this.playlistSyncs = Counter.builder("playlist_syncs_total")
            .description("Total number of playlist syncs")
            .register(registry);

        this.eventsDispatched = Counter.builder("domain_events_dispatched_total")
            .description("Total number of domain events handed to the outbox")
            .register(registry);
    }

    @Override
    public void resetAll() {
        log.info("Resetting all application metrics");

        registry.remove(contentSaved);
        registry.remove(likes);
        registry.remove(retweets);
        registry.remove(follows);
        registry.remove(analyses);
        registry.remove(downloadsRequested);
        registry.remove(downloadsCompleted);
        registry.remove(playlistSyncs);
        registry.remove(eventsDispatched);
        registry.find(REJECTED_ACTIONS).counters().forEach(registry::remove);

        registerAllMeters();

        log.info("All application metrics reset to zero");
    }

    @Override
    public void incrementContentSaved() {
        contentSaved.increment();
    }

    @Override
    public void incrementLikes() {
        likes.increment();
    }

    @Override
    public void incrementRetweets() {
        retweets.increment();
    }

    @Override
    public void incrementFollows() {
        follows.increment();
    }

    @Override
    public void incrementAnalyses() {
        analyses.increment();
    }

    @Override
    public void incrementDownloadsRequested() {
        downloadsRequested.increment();
    }

    @Override
    public void incrementDownloadsCompleted() {
        downloadsCompleted.increment();
    }

    @Override
    public void incrementPlaylistSyncs() {
        playlistSyncs.increment();
    }

    @Override
    public void incrementEventsDispatched(int count) {
        eventsDispatched.increment(count);
    }

    @Override
    public void incrementRejectedActions(String errorCode) {
        Counter.builder(REJECTED_ACTIONS)
            .description("Domain actions rejected by an aggregate invariant")
            .tag("code", errorCode)
            .register(registry)
            .increment();
    }
}
