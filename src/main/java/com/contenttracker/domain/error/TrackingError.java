package com.contenttracker.domain.error;

/**
 * Sealed type representing expected outcomes of tracking use cases at the application layer.
 * Domain exceptions are converted into these at the service boundary.
 */
public sealed interface TrackingError {

    record AlreadyPerformed(String action, String aggregateId) implements TrackingError {
        @Override
        public String message() {
            return "Action '" + action + "' was already performed on " + aggregateId;
        }

        @Override
        public String code() {
            return "ALREADY_PERFORMED";
        }
    }

    record NotFound(String aggregateType, String aggregateId) implements TrackingError {
        @Override
        public String message() {
            return aggregateType + " not found: " + aggregateId;
        }

        @Override
        public String code() {
            return "NOT_FOUND";
        }
    }

    record InvalidState(String reason) implements TrackingError {
        @Override
        public String message() {
            return reason;
        }

        @Override
        public String code() {
            return "INVALID_STATE";
        }
    }

    /**
     * Wraps an identifier validation error raised while parsing caller input.
     */
    record InvalidId(ValidationError error) implements TrackingError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
