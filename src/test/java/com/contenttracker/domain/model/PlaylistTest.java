package com.contenttracker.domain.model;

import com.contenttracker.domain.event.PlaylistSynced;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlaylistTest {

    private static final PlaylistId PLAYLIST_ID = PlaylistId.of("PL" + "a".repeat(32));
    private static final VideoId FIRST = VideoId.of("aaaaaaaaaaa");
    private static final VideoId SECOND = VideoId.of("bbbbbbbbbbb");

    @Test
    void createShouldDefaultToPublicWithoutEvents() {
        Playlist playlist = Playlist.create(PLAYLIST_ID, "Talks", "Recorded talks", "UC1234567890");

        assertTrue(playlist.isPublic());
        assertEquals(0, playlist.getVideoCount());
        assertNull(playlist.getLastSyncedAt());
        assertFalse(playlist.hasUncommittedEvents());
    }

    @Test
    void addVideoShouldIgnoreDuplicates() {
        Playlist playlist = Playlist.create(PLAYLIST_ID, "Talks", null, "UC1234567890");

        playlist.addVideo(FIRST);
        playlist.addVideo(FIRST);
        playlist.addVideo(SECOND);
        playlist.removeVideo(FIRST);

        assertEquals(List.of(SECOND), playlist.getVideoIds());
        assertFalse(playlist.hasUncommittedEvents());
    }

    @Test
    void removeVideoShouldDropEveryOccurrence() {
        Playlist playlist = Playlist.create(PLAYLIST_ID, "Talks", null, "UC1234567890");
        playlist.syncVideos(List.of(FIRST, SECOND, FIRST));

        playlist.removeVideo(FIRST);

        assertEquals(List.of(SECOND), playlist.getVideoIds());
        assertEquals(1, playlist.getVideoCount());
    }

    @Test
    void syncShouldReplaceMembersAndEmit() {
        Playlist playlist = Playlist.create(PLAYLIST_ID, "Talks", null, "UC1234567890", false);
        playlist.addVideo(FIRST);

        playlist.syncVideos(List.of(SECOND, FIRST));

        assertEquals(List.of(SECOND, FIRST), playlist.getVideoIds());
        assertNotNull(playlist.getLastSyncedAt());
        PlaylistSynced synced = assertInstanceOf(PlaylistSynced.class, playlist.commit().get(0));
        assertEquals(List.of(SECOND, FIRST), synced.videoIds());
        assertEquals(playlist.getLastSyncedAt(), synced.occurredOn());
    }

    @Test
    void syncedEventShouldNotAliasCallerList() {
        Playlist playlist = Playlist.create(PLAYLIST_ID, "Talks", null, "UC1234567890");
        List<VideoId> current = new ArrayList<>(List.of(FIRST));

        playlist.syncVideos(current);
        current.add(SECOND);

        PlaylistSynced synced = (PlaylistSynced) playlist.commit().get(0);
        assertEquals(List.of(FIRST), synced.videoIds());
        assertEquals(List.of(FIRST), playlist.getVideoIds());
    }
}
