package com.contenttracker.domain.model;

import java.time.Instant;

public record ThreadProps(
    String title,
    String description,
    boolean privateThread,
    Instant createdAt,
    Instant updatedAt
) {
    public static ThreadProps of(String title, String description, boolean privateThread) {
        Instant now = Instant.now();
        return new ThreadProps(title, description, privateThread, now, now);
    }

    ThreadProps touch() {
        return new ThreadProps(title, description, privateThread, createdAt, Instant.now());
    }

    ThreadProps withPrivateThread(boolean privateThread) {
        return new ThreadProps(title, description, privateThread, createdAt, Instant.now());
    }

    ThreadProps withMetadata(String newTitle, String newDescription) {
        return new ThreadProps(
            newTitle != null ? newTitle : title,
            newDescription != null ? newDescription : description,
            privateThread,
            createdAt,
            Instant.now()
        );
    }
}
