package com.contenttracker.application.port.out;

import com.contenttracker.domain.model.AggregateRoot;

import java.util.Optional;

/**
 * Session-scoped storage for one aggregate type.
 * Implementations hand out a freshly rebuilt instance on every lookup, never a shared one.
 */
public interface AggregateRepository<ID, A extends AggregateRoot<ID>> {
    void save(A aggregate);

    /**
     * Stores the aggregate only if no entry with its id exists, atomically.
     *
     * @return {@code false} if an entry was already present and nothing was stored
     */
    boolean saveIfAbsent(A aggregate);

    Optional<A> findById(ID id);
    boolean exists(ID id);
    long count();
    void deleteAll();
}
