package com.contenttracker.adapter.out.memory;

import com.contenttracker.application.port.out.ContentItemRepository;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ContentItem;
import com.contenttracker.domain.model.ContentProps;
import com.contenttracker.domain.model.ThreadId;
import com.contenttracker.infrastructure.config.AppProperties;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public class InMemoryContentItemStore
        extends InMemoryAggregateStore<ContentId, ContentItem, InMemoryContentItemStore.Snapshot>
        implements ContentItemRepository {

    public InMemoryContentItemStore(AppProperties appProperties) {
        super(appProperties.getStore().getMaxEntries());
    }

    @Override
    protected Snapshot snapshot(ContentItem item) {
        return new Snapshot(
            item.getAuthorId(),
            item.getProps(),
            item.getThreadId(),
            item.getSavedAt(),
            item.getLikedAt(),
            item.getRetweetedAt()
        );
    }

    @Override
    protected ContentItem restore(ContentId id, Snapshot s) {
        return ContentItem.reconstitute(id, s.authorId(), s.props(), s.threadId(), s.savedAt(), s.likedAt(), s.retweetedAt());
    }

    record Snapshot(
        ActorId authorId,
        ContentProps props,
        ThreadId threadId,
        Instant savedAt,
        Instant likedAt,
        Instant retweetedAt
    ) {}
}
