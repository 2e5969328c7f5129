package com.contenttracker.domain.model;

import com.contenttracker.domain.error.ValidationError.IdError;

/**
 * Value Object for content item identity, the platform's status id.
 */
public record ContentId(String value) {

    private static final String KIND = "Content id";

    public ContentId {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("ContentId value cannot be blank - use parse() for validation");
        }
    }

    /**
     * Parses untrusted input, returning a Result for expected validation failures.
     */
    public static Result<ContentId, IdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new IdError.Empty(KIND));
        }
        String trimmed = value.trim();
        if (trimmed.chars().anyMatch(Character::isWhitespace)) {
            return Result.failure(new IdError.InvalidFormat(KIND, value));
        }
        return Result.success(new ContentId(trimmed));
    }

    /**
     * Creates an id from a trusted source (our own stores, events we emitted).
     */
    public static ContentId of(String value) {
        return new ContentId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
