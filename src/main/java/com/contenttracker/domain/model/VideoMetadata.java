package com.contenttracker.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Descriptive metadata of a video as reported by its host at request time.
 * Construction rejects a blank title and negative durations or counts.
 */
public record VideoMetadata(
    String title,
    String description,
    long durationSeconds,
    Instant publishedAt,
    String channelId,
    String channelTitle,
    String thumbnailUrl,
    long viewCount,
    long likeCount,
    List<String> tags
) {
    public VideoMetadata {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Video title cannot be empty");
        }
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("Video duration cannot be negative");
        }
        if (viewCount < 0 || likeCount < 0) {
            throw new IllegalArgumentException("View and like counts cannot be negative");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Renders the duration as {@code m:ss}, or {@code h:mm:ss} from one hour up.
     */
    public String formattedDuration() {
        long hours = durationSeconds / 3600;
        long minutes = (durationSeconds % 3600) / 60;
        long seconds = durationSeconds % 60;
        if (hours > 0) {
            return String.format("%d:%02d:%02d", hours, minutes, seconds);
        }
        return String.format("%d:%02d", minutes, seconds);
    }
}
