package com.contenttracker.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Time window and initial metrics of an engagement snapshot.
 */
public record EngagementProps(
    EngagementMetrics metrics,
    EngagementPeriod period,
    Instant startDate,
    Instant endDate
) {
    public EngagementProps {
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(period, "period");
    }
}
