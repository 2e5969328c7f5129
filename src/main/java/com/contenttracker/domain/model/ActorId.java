package com.contenttracker.domain.model;

import com.contenttracker.domain.error.ValidationError.IdError;

/**
 * Value Object for actor (platform account) identity.
 * Wraps the platform's opaque account id so it cannot be confused with other ids.
 */
public record ActorId(String value) {

    private static final String KIND = "Actor id";

    public ActorId {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("ActorId value cannot be blank - use parse() for validation");
        }
    }

    /**
     * Parses untrusted input, returning a Result for expected validation failures.
     */
    public static Result<ActorId, IdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new IdError.Empty(KIND));
        }
        String trimmed = value.trim();
        if (trimmed.chars().anyMatch(Character::isWhitespace)) {
            return Result.failure(new IdError.InvalidFormat(KIND, value));
        }
        return Result.success(new ActorId(trimmed));
    }

    /**
     * Creates an id from a trusted source (our own stores, events we emitted).
     */
    public static ActorId of(String value) {
        return new ActorId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
