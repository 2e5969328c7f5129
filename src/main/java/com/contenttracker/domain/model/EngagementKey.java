package com.contenttracker.domain.model;

import java.util.Objects;

/**
 * Identity of an engagement snapshot: the tracked content item and its author.
 */
public record EngagementKey(ContentId contentId, ActorId authorId) {

    public EngagementKey {
        Objects.requireNonNull(contentId, "contentId");
        Objects.requireNonNull(authorId, "authorId");
    }

    @Override
    public String toString() {
        return contentId + ":" + authorId;
    }
}
