package com.contenttracker.application.port.out;

import com.contenttracker.domain.event.DomainEvent;

import java.util.List;

/**
 * Port receiving events drained from an aggregate, in the order the aggregate created them.
 */
public interface EventDispatcher {
    void dispatch(List<DomainEvent> events);
}
