package com.contenttracker.adapter.out.memory;

import com.contenttracker.application.port.out.ThreadRepository;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ConversationThread;
import com.contenttracker.domain.model.ThreadId;
import com.contenttracker.domain.model.ThreadProps;
import com.contenttracker.infrastructure.config.AppProperties;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class InMemoryThreadStore
        extends InMemoryAggregateStore<ThreadId, ConversationThread, InMemoryThreadStore.Snapshot>
        implements ThreadRepository {

    public InMemoryThreadStore(AppProperties appProperties) {
        super(appProperties.getStore().getMaxEntries());
    }

    @Override
    protected Snapshot snapshot(ConversationThread thread) {
        ThreadProps props = new ThreadProps(
            thread.getTitle(),
            thread.getDescription(),
            thread.isPrivate(),
            thread.getCreatedAt(),
            thread.getUpdatedAt()
        );
        return new Snapshot(thread.getAuthorId(), props, thread.getContentIds(), thread.getArchivedAt());
    }

    @Override
    protected ConversationThread restore(ThreadId id, Snapshot s) {
        return ConversationThread.reconstitute(id, s.authorId(), s.props(), s.contentIds(), s.archivedAt());
    }

    record Snapshot(ActorId authorId, ThreadProps props, List<ContentId> contentIds, Instant archivedAt) {}
}
