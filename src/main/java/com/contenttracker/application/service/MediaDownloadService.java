package com.contenttracker.application.service;

import com.contenttracker.application.port.in.MediaDownloadUseCase;
import com.contenttracker.application.port.out.EventDispatcher;
import com.contenttracker.application.port.out.MetricsPort;
import com.contenttracker.application.port.out.PlaylistRepository;
import com.contenttracker.application.port.out.VideoDownloadRepository;
import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.Playlist;
import com.contenttracker.domain.model.PlaylistId;
import com.contenttracker.domain.model.Result;
import com.contenttracker.domain.model.VideoDownload;
import com.contenttracker.domain.model.VideoId;
import com.contenttracker.domain.model.VideoMetadata;
import com.contenttracker.domain.model.VideoQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Records the request and completion sides of media downloads. The transfer itself is
 * performed elsewhere and reported back through {@link #completeDownload}.
 */
@Service
public class MediaDownloadService implements MediaDownloadUseCase {

    private static final Logger log = LoggerFactory.getLogger(MediaDownloadService.class);

    private final VideoDownloadRepository videoDownloadRepository;
    private final PlaylistRepository playlistRepository;
    private final EventDispatcher eventDispatcher;
    private final MetricsPort metrics;

    public MediaDownloadService(
            VideoDownloadRepository videoDownloadRepository,
            PlaylistRepository playlistRepository,
            EventDispatcher eventDispatcher,
            MetricsPort metrics) {
        this.videoDownloadRepository = videoDownloadRepository;
        this.playlistRepository = playlistRepository;
        this.eventDispatcher = eventDispatcher;
        this.metrics = metrics;
    }

    @Override
    public Result<VideoDownload, TrackingError> requestDownload(VideoId videoId, VideoMetadata metadata, VideoQuality quality) {
        log.debug("Download requested: videoId={}, quality={}, hd={}", videoId, quality, quality.isHighDefinition());

        VideoDownload download = VideoDownload.request(videoId, metadata, quality);
        videoDownloadRepository.save(download);
        eventDispatcher.dispatch(download.commit());

        metrics.incrementDownloadsRequested();
        log.info("Download queued: videoId={}, title={}, duration={}", videoId, metadata.title(), metadata.formattedDuration());
        return Result.success(download);
    }

    @Override
    public Result<VideoDownload, TrackingError> completeDownload(VideoId videoId, String downloadUrl) {
        Optional<VideoDownload> found = videoDownloadRepository.findById(videoId);
        if (found.isEmpty()) {
            log.warn("Completion for unknown download: videoId={}", videoId);
            return Result.failure(new TrackingError.NotFound("VideoDownload", videoId.toString()));
        }

        VideoDownload download = found.get();
        if (download.isDownloaded()) {
            log.debug("Download completed again: videoId={}, previousUrl={}", videoId, download.getDownloadUrl());
        }
        download.markDownloaded(downloadUrl);
        videoDownloadRepository.save(download);
        eventDispatcher.dispatch(download.commit());

        metrics.incrementDownloadsCompleted();
        log.info("Download completed: videoId={}", videoId);
        return Result.success(download);
    }

    @Override
    public Result<Playlist, TrackingError> syncPlaylist(PlaylistId playlistId, PlaylistDetails details, List<VideoId> videoIds) {
        Playlist playlist = playlistRepository.findById(playlistId)
            .orElseGet(() -> Playlist.create(
                playlistId, details.title(), details.description(), details.channelId(), details.publicPlaylist()));

        playlist.syncVideos(videoIds);
        playlistRepository.save(playlist);
        eventDispatcher.dispatch(playlist.commit());

        metrics.incrementPlaylistSyncs();
        log.info("Playlist synced: playlistId={}, videos={}", playlistId, videoIds.size());
        return Result.success(playlist);
    }
}
