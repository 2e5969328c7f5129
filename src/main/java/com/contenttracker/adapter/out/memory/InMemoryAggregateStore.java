package com.contenttracker.adapter.out.memory;

import com.contenttracker.application.port.out.AggregateRepository;
import com.contenttracker.domain.model.AggregateRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Session store keeping a state snapshot per aggregate rather than the instance itself.
 * Every lookup rebuilds a new instance, so no two callers ever share one, and pending
 * events are never stored. Capacity is bounded; the oldest saved entry is evicted first.
 *
 * @param <ID> aggregate identity
 * @param <A>  aggregate type
 * @param <S>  snapshot type
 */
public abstract class InMemoryAggregateStore<ID, A extends AggregateRoot<ID>, S> implements AggregateRepository<ID, A> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAggregateStore.class);

    private final Map<ID, S> snapshots;

    protected InMemoryAggregateStore(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, was " + maxEntries);
        }
        this.snapshots = Collections.synchronizedMap(new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ID, S> eldest) {
                boolean evict = size() > maxEntries;
                if (evict) {
                    log.debug("Store full ({} entries), evicting {}", maxEntries, eldest.getKey());
                }
                return evict;
            }
        });
    }

    protected abstract S snapshot(A aggregate);

    protected abstract A restore(ID id, S snapshot);

    @Override
    public void save(A aggregate) {
        ID id = aggregate.getId();
        S snapshot = snapshot(aggregate);
        synchronized (snapshots) {
            // re-insert so a re-saved entry counts as newest
            snapshots.remove(id);
            snapshots.put(id, snapshot);
        }
    }

    @Override
    public boolean saveIfAbsent(A aggregate) {
        ID id = aggregate.getId();
        S snapshot = snapshot(aggregate);
        synchronized (snapshots) {
            if (snapshots.containsKey(id)) {
                return false;
            }
            snapshots.put(id, snapshot);
            return true;
        }
    }

    @Override
    public Optional<A> findById(ID id) {
        return Optional.ofNullable(snapshots.get(id)).map(snapshot -> restore(id, snapshot));
    }

    @Override
    public boolean exists(ID id) {
        return snapshots.containsKey(id);
    }

    @Override
    public long count() {
        return snapshots.size();
    }

    @Override
    public void deleteAll() {
        snapshots.clear();
    }
}
