package com.contenttracker.application.port.out;

import com.contenttracker.domain.model.EngagementSnapshot;
import com.contenttracker.domain.model.EngagementKey;

public interface EngagementRepository extends AggregateRepository<EngagementKey, EngagementSnapshot> {
}
