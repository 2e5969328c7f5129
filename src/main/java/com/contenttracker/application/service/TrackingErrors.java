package com.contenttracker.application.service;

import com.contenttracker.domain.error.DomainException;
import com.contenttracker.domain.error.DuplicateActionException;
import com.contenttracker.domain.error.TrackingError;

final class TrackingErrors {

    private TrackingErrors() {}

    static TrackingError from(DomainException e) {
        if (e instanceof DuplicateActionException duplicate) {
            return new TrackingError.AlreadyPerformed(duplicate.getAction(), duplicate.getAggregateId());
        }
        return new TrackingError.InvalidState(e.getMessage());
    }
}
