package com.contenttracker.domain.model;

import com.contenttracker.domain.event.PlaylistSynced;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A playlist's local copy of its member video ids. Only a full sync is a recorded fact;
 * individual adds and removals are local edits.
 */
public class Playlist extends AggregateRoot<PlaylistId> {

    private final String title;
    private final String description;
    private final String channelId;
    private final boolean publicPlaylist;
    private final List<VideoId> videoIds = new ArrayList<>();
    private Instant lastSyncedAt;

    private Playlist(PlaylistId id, String title, String description, String channelId, boolean publicPlaylist) {
        super(id);
        this.title = title;
        this.description = description;
        this.channelId = channelId;
        this.publicPlaylist = publicPlaylist;
    }

    public static Playlist create(PlaylistId id, String title, String description, String channelId) {
        return create(id, title, description, channelId, true);
    }

    public static Playlist create(
            PlaylistId id,
            String title,
            String description,
            String channelId,
            boolean publicPlaylist) {
        return new Playlist(id, title, description, channelId, publicPlaylist);
    }

    public static Playlist reconstitute(
            PlaylistId id,
            String title,
            String description,
            String channelId,
            boolean publicPlaylist,
            List<VideoId> videoIds,
            Instant lastSyncedAt) {
        Playlist playlist = new Playlist(id, title, description, channelId, publicPlaylist);
        playlist.videoIds.addAll(videoIds);
        playlist.lastSyncedAt = lastSyncedAt;
        return playlist;
    }

    public void addVideo(VideoId videoId) {
        if (!videoIds.contains(videoId)) {
            videoIds.add(videoId);
        }
    }

    public void removeVideo(VideoId videoId) {
        videoIds.removeIf(videoId::equals);
    }

    /**
     * Replaces the member list with the host's current one.
     */
    public void syncVideos(List<VideoId> current) {
        videoIds.clear();
        videoIds.addAll(current);
        PlaylistSynced synced = PlaylistSynced.of(getId(), current);
        lastSyncedAt = synced.occurredOn();
        addDomainEvent(synced);
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getChannelId() {
        return channelId;
    }

    public boolean isPublic() {
        return publicPlaylist;
    }

    public List<VideoId> getVideoIds() {
        return List.copyOf(videoIds);
    }

    public int getVideoCount() {
        return videoIds.size();
    }

    public Instant getLastSyncedAt() {
        return lastSyncedAt;
    }
}
