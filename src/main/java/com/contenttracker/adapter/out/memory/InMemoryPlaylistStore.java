package com.contenttracker.adapter.out.memory;

import com.contenttracker.application.port.out.PlaylistRepository;
import com.contenttracker.domain.model.Playlist;
import com.contenttracker.domain.model.PlaylistId;
import com.contenttracker.domain.model.VideoId;
import com.contenttracker.infrastructure.config.AppProperties;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class InMemoryPlaylistStore
        extends InMemoryAggregateStore<PlaylistId, Playlist, InMemoryPlaylistStore.Snapshot>
        implements PlaylistRepository {

    public InMemoryPlaylistStore(AppProperties appProperties) {
        super(appProperties.getStore().getMaxEntries());
    }

    @Override
    protected Snapshot snapshot(Playlist playlist) {
        return new Snapshot(
            playlist.getTitle(),
            playlist.getDescription(),
            playlist.getChannelId(),
            playlist.isPublic(),
            playlist.getVideoIds(),
            playlist.getLastSyncedAt()
        );
    }

    @Override
    protected Playlist restore(PlaylistId id, Snapshot s) {
        return Playlist.reconstitute(id, s.title(), s.description(), s.channelId(), s.publicPlaylist(), s.videoIds(), s.lastSyncedAt());
    }

    record Snapshot(
        String title,
        String description,
        String channelId,
        boolean publicPlaylist,
        List<VideoId> videoIds,
        Instant lastSyncedAt
    ) {}
}
