package com.contenttracker.adapter.out.dispatch;

import com.contenttracker.application.port.out.EventDispatcher;
import com.contenttracker.application.port.out.EventOutbox;
import com.contenttracker.application.port.out.EventOutbox.EventEnvelope;
import com.contenttracker.application.port.out.IdGenerator;
import com.contenttracker.application.port.out.MetricsPort;
import com.contenttracker.domain.event.DomainEvent;
import com.contenttracker.infrastructure.config.AppProperties;
import com.contenttracker.infrastructure.context.AnalysisSessionContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Serializes committed domain events into envelopes and appends them to the outbox.
 * Events are appended in the order the aggregate raised them.
 */
@Component
public class OutboxEventDispatcher implements EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxEventDispatcher.class);

    private final EventOutbox outbox;
    private final ObjectMapper objectMapper;
    private final IdGenerator idGenerator;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public OutboxEventDispatcher(
            EventOutbox outbox,
            ObjectMapper objectMapper,
            IdGenerator idGenerator,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.outbox = outbox;
        this.objectMapper = objectMapper;
        this.idGenerator = idGenerator;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public void dispatch(List<DomainEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        for (DomainEvent event : events) {
            EventEnvelope envelope = toEnvelope(event);
            outbox.append(envelope);
            if (appProperties.getEvents().isLogPayload()) {
                log.info("Dispatched {} for {}: {}", envelope.eventType(), envelope.aggregateId(), envelope.payload());
            } else {
                log.info("Dispatched {} for {}", envelope.eventType(), envelope.aggregateId());
            }
        }
        metrics.incrementEventsDispatched(events.size());
    }

    private EventEnvelope toEnvelope(DomainEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            return new EventEnvelope(
                idGenerator.generate(),
                event.eventType(),
                event.aggregateId(),
                event.occurredOn(),
                appProperties.getEvents().getSource(),
                AnalysisSessionContext.getSessionId(),
                payload
            );
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.eventType(), e);
        }
    }
}
