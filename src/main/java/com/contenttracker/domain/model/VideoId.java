package com.contenttracker.domain.model;

import com.contenttracker.domain.error.ValidationError.IdError;

import java.util.regex.Pattern;

/**
 * Value Object for a hosted video's id: eleven URL-safe characters.
 */
public record VideoId(String value) {

    private static final Pattern FORMAT = Pattern.compile("^[a-zA-Z0-9_-]{11}$");

    public VideoId {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid video id: " + value);
        }
    }

    public static Result<VideoId, IdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new IdError.Empty("Video id"));
        }
        if (!FORMAT.matcher(value).matches()) {
            return Result.failure(new IdError.InvalidFormat("Video id", value));
        }
        return Result.success(new VideoId(value));
    }

    public static VideoId of(String value) {
        return new VideoId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
