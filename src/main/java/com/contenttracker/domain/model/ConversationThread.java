package com.contenttracker.domain.model;

import com.contenttracker.domain.error.DuplicateActionException;
import com.contenttracker.domain.error.InvalidStateException;
import com.contenttracker.domain.event.ContentAddedToThread;
import com.contenttracker.domain.event.ThreadArchived;
import com.contenttracker.domain.event.ThreadCreated;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * A locally curated, ordered collection of content items by one author.
 */
public class ConversationThread extends AggregateRoot<ThreadId> {

    private final ActorId authorId;
    private ThreadProps props;
    private List<ContentId> contentIds = new ArrayList<>();
    private Instant archivedAt;

    private ConversationThread(ThreadId id, ActorId authorId, ThreadProps props) {
        super(id);
        this.authorId = Objects.requireNonNull(authorId, "authorId");
        this.props = Objects.requireNonNull(props, "props");
    }

    public static ConversationThread create(ThreadId id, ActorId authorId, ThreadProps props) {
        ConversationThread thread = new ConversationThread(id, authorId, props);
        thread.addDomainEvent(new ThreadCreated(id, authorId, props, Instant.now()));
        return thread;
    }

    /**
     * Rebuilds a thread from stored state without emitting events.
     */
    public static ConversationThread reconstitute(
            ThreadId id,
            ActorId authorId,
            ThreadProps props,
            List<ContentId> contentIds,
            Instant archivedAt) {
        ConversationThread thread = new ConversationThread(id, authorId, props);
        thread.contentIds.addAll(contentIds);
        thread.archivedAt = archivedAt;
        return thread;
    }

    /**
     * @throws DuplicateActionException if the item is already a member
     * @throws InvalidStateException if the thread is archived
     */
    public void addContent(ContentId contentId) {
        if (contentIds.contains(contentId)) {
            throw new DuplicateActionException("add-to-thread", getId().toString(),
                "Content " + contentId + " is already in thread");
        }
        if (isArchived()) {
            throw new InvalidStateException("Cannot add content to archived thread " + getId());
        }
        contentIds.add(contentId);
        props = props.touch();
        addDomainEvent(new ContentAddedToThread(getId(), contentId, authorId, Instant.now()));
    }

    public void removeContent(ContentId contentId) {
        if (!contentIds.remove(contentId)) {
            throw new InvalidStateException("Content " + contentId + " is not in thread " + getId());
        }
        props = props.touch();
    }

    public void archive() {
        if (isArchived()) {
            throw new DuplicateActionException("archive", getId().toString(), "Thread is already archived");
        }
        archivedAt = Instant.now();
        addDomainEvent(new ThreadArchived(getId(), authorId, archivedAt));
    }

    public void unarchive() {
        archivedAt = null;
    }

    public void makePrivate() {
        props = props.withPrivateThread(true);
    }

    public void makePublic() {
        props = props.withPrivateThread(false);
    }

    /**
     * Null arguments leave the corresponding field unchanged.
     */
    public void updateMetadata(String title, String description) {
        props = props.withMetadata(title, description);
    }

    /**
     * @throws InvalidStateException unless {@code newOrder} holds exactly the current members
     */
    public void reorder(List<ContentId> newOrder) {
        if (newOrder.size() != contentIds.size() || !new HashSet<>(newOrder).equals(new HashSet<>(contentIds))) {
            throw new InvalidStateException("New order must contain exactly the same content items");
        }
        contentIds = new ArrayList<>(newOrder);
        props = props.touch();
    }

    public boolean isArchived() {
        return archivedAt != null;
    }

    public boolean isEmpty() {
        return contentIds.isEmpty();
    }

    public boolean isPrivate() {
        return props.privateThread();
    }

    public ActorId getAuthorId() {
        return authorId;
    }

    public String getTitle() {
        return props.title();
    }

    public String getDescription() {
        return props.description();
    }

    public List<ContentId> getContentIds() {
        return List.copyOf(contentIds);
    }

    public int getContentCount() {
        return contentIds.size();
    }

    public ContentId getFirstContentId() {
        return contentIds.isEmpty() ? null : contentIds.get(0);
    }

    public ContentId getLastContentId() {
        return contentIds.isEmpty() ? null : contentIds.get(contentIds.size() - 1);
    }

    public Instant getCreatedAt() {
        return props.createdAt();
    }

    public Instant getUpdatedAt() {
        return props.updatedAt();
    }

    public Instant getArchivedAt() {
        return archivedAt;
    }
}
