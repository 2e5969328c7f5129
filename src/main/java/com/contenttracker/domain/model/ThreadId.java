package com.contenttracker.domain.model;

import com.contenttracker.domain.error.ValidationError.IdError;

import java.util.UUID;

public record ThreadId(String value) {

    private static final String KIND = "Thread id";

    public ThreadId {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("ThreadId value cannot be blank - use parse() for validation");
        }
    }

    /**
     * Parses untrusted input, returning a Result for expected validation failures.
     */
    public static Result<ThreadId, IdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new IdError.Empty(KIND));
        }
        String trimmed = value.trim();
        if (trimmed.chars().anyMatch(Character::isWhitespace)) {
            return Result.failure(new IdError.InvalidFormat(KIND, value));
        }
        return Result.success(new ThreadId(trimmed));
    }

    /**
     * Creates an id from a trusted source (our own stores, events we emitted).
     */
    public static ThreadId of(String value) {
        return new ThreadId(value);
    }

    /**
     * Threads are curated locally, so their ids are minted here rather than scraped.
     */
    public static ThreadId random() {
        return new ThreadId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
