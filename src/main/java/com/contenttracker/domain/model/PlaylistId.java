package com.contenttracker.domain.model;

import com.contenttracker.domain.error.ValidationError.IdError;

import java.util.regex.Pattern;

/**
 * Value Object for a playlist id: the {@code PL} prefix followed by 32 URL-safe characters.
 */
public record PlaylistId(String value) {

    private static final Pattern FORMAT = Pattern.compile("^PL[a-zA-Z0-9_-]{32}$");

    public PlaylistId {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid playlist id: " + value);
        }
    }

    public static Result<PlaylistId, IdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new IdError.Empty("Playlist id"));
        }
        if (!FORMAT.matcher(value).matches()) {
            return Result.failure(new IdError.InvalidFormat("Playlist id", value));
        }
        return Result.success(new PlaylistId(value));
    }

    public static PlaylistId of(String value) {
        return new PlaylistId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
