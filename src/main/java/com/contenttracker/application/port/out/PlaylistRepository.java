package com.contenttracker.application.port.out;

import com.contenttracker.domain.model.Playlist;
import com.contenttracker.domain.model.PlaylistId;

public interface PlaylistRepository extends AggregateRepository<PlaylistId, Playlist> {
}
