package com.contenttracker.domain.model;

import com.contenttracker.domain.event.DomainEvent;
import com.contenttracker.domain.event.VideoDownloadCompleted;
import com.contenttracker.domain.event.VideoDownloadRequested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VideoDownloadTest {

    private static final VideoId VIDEO_ID = VideoId.of("dQw4w9WgXcQ");

    static VideoMetadata metadata() {
        return new VideoMetadata(
            "Conference keynote",
            "Opening talk",
            3725,
            Instant.parse("2024-04-10T15:00:00Z"),
            "UC1234567890",
            "Tech Talks",
            "https://img.example/keynote.jpg",
            10_000,
            800,
            List.of("keynote", "java"));
    }

    @Test
    void requestShouldEmitRequestedEvent() {
        VideoDownload download = VideoDownload.request(VIDEO_ID, metadata(), VideoQuality.FULL_HD);

        List<DomainEvent> events = download.commit();
        VideoDownloadRequested requested = assertInstanceOf(VideoDownloadRequested.class, events.get(0));
        assertEquals(VIDEO_ID, requested.videoId());
        assertEquals(VideoQuality.FULL_HD, requested.quality());
        assertEquals("VIDEO_DOWNLOAD_REQUESTED", requested.eventType());
        assertEquals(requested.occurredOn(), download.getRequestedAt());
        assertFalse(download.isDownloaded());
    }

    @Test
    void markDownloadedShouldRecordUrlAndEmit() {
        VideoDownload download = VideoDownload.request(VIDEO_ID, metadata(), VideoQuality.HIGH);
        download.commit();

        download.markDownloaded("file:///downloads/dQw4w9WgXcQ.mp4");

        assertTrue(download.isDownloaded());
        assertEquals("file:///downloads/dQw4w9WgXcQ.mp4", download.getDownloadUrl());
        VideoDownloadCompleted completed = assertInstanceOf(VideoDownloadCompleted.class, download.commit().get(0));
        assertEquals("file:///downloads/dQw4w9WgXcQ.mp4", completed.downloadUrl());
    }

    @Test
    void markDownloadedAgainShouldOverwriteAndReemit() {
        VideoDownload download = VideoDownload.request(VIDEO_ID, metadata(), VideoQuality.HIGH);
        download.markDownloaded("file:///a.mp4");

        download.markDownloaded("file:///b.mp4");

        assertEquals("file:///b.mp4", download.getDownloadUrl());
        assertEquals(3, download.commit().size());
    }

    @Test
    void qualityShouldExposeResolution() {
        assertEquals("720p", VideoQuality.HIGH.resolution());
        assertTrue(VideoQuality.HIGH.isHighDefinition());
        assertFalse(VideoQuality.MEDIUM.isHighDefinition());
    }
}
