package com.contenttracker.domain.error;

/**
 * Thrown when a local, once-only action (like, retweet, follow, ...) is performed a second time.
 */
public class DuplicateActionException extends DomainException {

    private final String action;
    private final String aggregateId;

    public DuplicateActionException(String action, String aggregateId, String message) {
        super("DUPLICATE_ACTION", message);
        this.action = action;
        this.aggregateId = aggregateId;
    }

    public String getAction() {
        return action;
    }

    public String getAggregateId() {
        return aggregateId;
    }
}
