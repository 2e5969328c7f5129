package com.contenttracker.domain.model;

import com.contenttracker.domain.event.VideoDownloadCompleted;
import com.contenttracker.domain.event.VideoDownloadRequested;

import java.time.Instant;
import java.util.Objects;

/**
 * One requested video download, from request to completion.
 * Retries and failures belong to the orchestrator that performs the transfer, so completion
 * is not guarded: marking a download complete again records the new url and re-emits.
 */
public class VideoDownload extends AggregateRoot<VideoId> {

    private final VideoMetadata metadata;
    private final VideoQuality quality;
    private final Instant requestedAt;
    private String downloadUrl;
    private Instant downloadedAt;

    private VideoDownload(VideoId id, VideoMetadata metadata, VideoQuality quality, Instant requestedAt) {
        super(id);
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.quality = Objects.requireNonNull(quality, "quality");
        this.requestedAt = requestedAt;
    }

    public static VideoDownload request(VideoId id, VideoMetadata metadata, VideoQuality quality) {
        VideoDownloadRequested requested = VideoDownloadRequested.of(id, metadata, quality);
        VideoDownload download = new VideoDownload(id, metadata, quality, requested.occurredOn());
        download.addDomainEvent(requested);
        return download;
    }

    public static VideoDownload reconstitute(
            VideoId id,
            VideoMetadata metadata,
            VideoQuality quality,
            Instant requestedAt,
            String downloadUrl,
            Instant downloadedAt) {
        VideoDownload download = new VideoDownload(id, metadata, quality, requestedAt);
        download.downloadUrl = downloadUrl;
        download.downloadedAt = downloadedAt;
        return download;
    }

    public void markDownloaded(String downloadUrl) {
        VideoDownloadCompleted completed = VideoDownloadCompleted.of(getId(), downloadUrl);
        this.downloadUrl = downloadUrl;
        this.downloadedAt = completed.occurredOn();
        addDomainEvent(completed);
    }

    public boolean isDownloaded() {
        return downloadedAt != null;
    }

    public VideoMetadata getMetadata() {
        return metadata;
    }

    public VideoQuality getQuality() {
        return quality;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    public String getDownloadUrl() {
        return downloadUrl;
    }

    public Instant getDownloadedAt() {
        return downloadedAt;
    }
}
