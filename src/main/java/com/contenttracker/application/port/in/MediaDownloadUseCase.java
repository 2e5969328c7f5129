package com.contenttracker.application.port.in;

import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.Playlist;
import com.contenttracker.domain.model.PlaylistId;
import com.contenttracker.domain.model.Result;
import com.contenttracker.domain.model.VideoDownload;
import com.contenttracker.domain.model.VideoId;
import com.contenttracker.domain.model.VideoMetadata;
import com.contenttracker.domain.model.VideoQuality;

import java.util.List;

public interface MediaDownloadUseCase {
    Result<VideoDownload, TrackingError> requestDownload(VideoId videoId, VideoMetadata metadata, VideoQuality quality);

    Result<VideoDownload, TrackingError> completeDownload(VideoId videoId, String downloadUrl);

    /**
     * Creates the playlist on first sight, then replaces its members with {@code videoIds}.
     */
    Result<Playlist, TrackingError> syncPlaylist(PlaylistId playlistId, PlaylistDetails details, List<VideoId> videoIds);

    record PlaylistDetails(String title, String description, String channelId, boolean publicPlaylist) {}
}
