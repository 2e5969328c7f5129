package com.contenttracker.application.port.in;

import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.EngagementKey;
import com.contenttracker.domain.model.EngagementMetrics;
import com.contenttracker.domain.model.EngagementProps;
import com.contenttracker.domain.model.EngagementSnapshot;
import com.contenttracker.domain.model.MetricsUpdate;
import com.contenttracker.domain.model.Result;

import java.util.List;

public interface EngagementTrackingUseCase {
    /**
     * Starts tracking a window. An existing snapshot for the same pair is replaced.
     */
    Result<EngagementSnapshot, TrackingError> track(ContentId contentId, ActorId authorId, EngagementProps props);

    Result<EngagementMetrics, TrackingError> updateMetrics(EngagementKey key, MetricsUpdate update);

    Result<List<String>, TrackingError> analyze(EngagementKey key);

    Result<List<String>, TrackingError> addInsight(EngagementKey key, String insight);
}
