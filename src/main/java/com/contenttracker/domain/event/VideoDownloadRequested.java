package com.contenttracker.domain.event;

import com.contenttracker.domain.model.VideoId;
import com.contenttracker.domain.model.VideoMetadata;
import com.contenttracker.domain.model.VideoQuality;

import java.time.Instant;

/**
 * A download of one video at one quality was requested. Completion arrives later as
 * {@link VideoDownloadCompleted} with the same video id; there is no in-progress or failed event.
 */
public record VideoDownloadRequested(
    VideoId videoId,
    VideoMetadata metadata,
    VideoQuality quality,
    Instant occurredOn
) implements DomainEvent {

    public static VideoDownloadRequested of(VideoId videoId, VideoMetadata metadata, VideoQuality quality) {
        return new VideoDownloadRequested(videoId, metadata, quality, Instant.now());
    }

    @Override
    public String aggregateId() {
        return videoId.toString();
    }

    @Override
    public String eventType() {
        return "VIDEO_DOWNLOAD_REQUESTED";
    }
}
