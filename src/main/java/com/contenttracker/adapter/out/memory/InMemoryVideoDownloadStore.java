package com.contenttracker.adapter.out.memory;

import com.contenttracker.application.port.out.VideoDownloadRepository;
import com.contenttracker.domain.model.VideoDownload;
import com.contenttracker.domain.model.VideoId;
import com.contenttracker.domain.model.VideoMetadata;
import com.contenttracker.domain.model.VideoQuality;
import com.contenttracker.infrastructure.config.AppProperties;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public class InMemoryVideoDownloadStore
        extends InMemoryAggregateStore<VideoId, VideoDownload, InMemoryVideoDownloadStore.Snapshot>
        implements VideoDownloadRepository {

    public InMemoryVideoDownloadStore(AppProperties appProperties) {
        super(appProperties.getStore().getMaxEntries());
    }

    @Override
    protected Snapshot snapshot(VideoDownload download) {
        return new Snapshot(
            download.getMetadata(),
            download.getQuality(),
            download.getRequestedAt(),
            download.getDownloadUrl(),
            download.getDownloadedAt()
        );
    }

    @Override
    protected VideoDownload restore(VideoId id, Snapshot s) {
        return VideoDownload.reconstitute(id, s.metadata(), s.quality(), s.requestedAt(), s.downloadUrl(), s.downloadedAt());
    }

    record Snapshot(
        VideoMetadata metadata,
        VideoQuality quality,
        Instant requestedAt,
        String downloadUrl,
        Instant downloadedAt
    ) {}
}
