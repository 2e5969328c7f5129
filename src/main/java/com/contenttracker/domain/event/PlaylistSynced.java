package com.contenttracker.domain.event;

import com.contenttracker.domain.model.PlaylistId;
import com.contenttracker.domain.model.VideoId;

import java.time.Instant;
import java.util.List;

/**
 * The member list of a playlist was refreshed. Nothing ties this to the individual
 * video downloads; consumers correlate on the video ids themselves.
 */
public record PlaylistSynced(
    PlaylistId playlistId,
    List<VideoId> videoIds,
    Instant occurredOn
) implements DomainEvent {

    public PlaylistSynced {
        videoIds = List.copyOf(videoIds);
    }

    public static PlaylistSynced of(PlaylistId playlistId, List<VideoId> videoIds) {
        return new PlaylistSynced(playlistId, videoIds, Instant.now());
    }

    @Override
    public String aggregateId() {
        return playlistId.toString();
    }

    @Override
    public String eventType() {
        return "PLAYLIST_SYNCED";
    }
}
