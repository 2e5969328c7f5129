package com.contenttracker.domain.model;

import com.contenttracker.domain.event.DomainEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for aggregates that record their state changes as domain events.
 * <p>
 * Events are buffered in creation order until the owner drains them with {@link #commit()}.
 * Aggregates are forward-mutating: state loaded from a store is rebuilt through each aggregate's
 * {@code reconstitute} factory, never by replaying events.
 *
 * @param <ID> the identity type
 */
public abstract class AggregateRoot<ID> {

    private final ID id;
    private final List<DomainEvent> uncommittedEvents = new ArrayList<>();

    protected AggregateRoot(ID id) {
        this.id = Objects.requireNonNull(id, "Aggregate id cannot be null");
    }

    public ID getId() {
        return id;
    }

    protected void addDomainEvent(DomainEvent event) {
        uncommittedEvents.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * Returns a read-only copy of the pending events. Does not clear the buffer.
     */
    public List<DomainEvent> getUncommittedEvents() {
        return List.copyOf(uncommittedEvents);
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Drains the pending events in creation order and clears the buffer,
     * so a second call returns an empty list.
     */
    public List<DomainEvent> commit() {
        List<DomainEvent> drained = List.copyOf(uncommittedEvents);
        uncommittedEvents.clear();
        return drained;
    }
}
