package com.contenttracker.domain.event;

import com.contenttracker.domain.model.VideoId;

import java.time.Instant;

public record VideoDownloadCompleted(
    VideoId videoId,
    String downloadUrl,
    Instant occurredOn
) implements DomainEvent {

    public static VideoDownloadCompleted of(VideoId videoId, String downloadUrl) {
        return new VideoDownloadCompleted(videoId, downloadUrl, Instant.now());
    }

    @Override
    public String aggregateId() {
        return videoId.toString();
    }

    @Override
    public String eventType() {
        return "VIDEO_DOWNLOAD_COMPLETED";
    }
}
