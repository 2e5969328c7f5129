package com.contenttracker.application.port.in;

import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ContentItem;
import com.contenttracker.domain.model.EngagementCounts;
import com.contenttracker.domain.model.Result;

import java.util.List;

public interface ContentInteractionUseCase {
    Result<EngagementCounts, TrackingError> like(ContentId contentId);

    Result<EngagementCounts, TrackingError> retweet(ContentId contentId);

    /**
     * Overwrites the locally held counters with a fresh platform read.
     */
    Result<EngagementCounts, TrackingError> reconcileEngagement(ContentId contentId, EngagementCounts counts);

    Result<ContentItem, TrackingError> tagContent(ContentId contentId, List<String> hashtags, List<String> mentions);
}
