package com.contenttracker.domain.model;

public enum EngagementPeriod {
    HOUR,
    DAY,
    WEEK,
    MONTH
}
