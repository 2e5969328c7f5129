package com.contenttracker.application.service;

import com.contenttracker.application.port.in.EngagementTrackingUseCase;
import com.contenttracker.application.port.out.EngagementRepository;
import com.contenttracker.application.port.out.EventDispatcher;
import com.contenttracker.application.port.out.MetricsPort;
import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.EngagementKey;
import com.contenttracker.domain.model.EngagementMetrics;
import com.contenttracker.domain.model.EngagementProps;
import com.contenttracker.domain.model.EngagementSnapshot;
import com.contenttracker.domain.model.MetricsUpdate;
import com.contenttracker.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class EngagementService implements EngagementTrackingUseCase {

    private static final Logger log = LoggerFactory.getLogger(EngagementService.class);

    private final EngagementRepository engagementRepository;
    private final EventDispatcher eventDispatcher;
    private final MetricsPort metrics;

    public EngagementService(
            EngagementRepository engagementRepository,
            EventDispatcher eventDispatcher,
            MetricsPort metrics) {
        this.engagementRepository = engagementRepository;
        this.eventDispatcher = eventDispatcher;
        this.metrics = metrics;
    }

    @Override
    public Result<EngagementSnapshot, TrackingError> track(ContentId contentId, ActorId authorId, EngagementProps props) {
        EngagementKey key = new EngagementKey(contentId, authorId);
        if (engagementRepository.exists(key)) {
            log.debug("Replacing engagement window for {}", key);
        }

        EngagementSnapshot snapshot = EngagementSnapshot.create(contentId, authorId, props);
        engagementRepository.save(snapshot);
        eventDispatcher.dispatch(snapshot.commit());

        log.info("Engagement tracked: key={}, period={}, impressions={}",
            key, props.period(), props.metrics().impressions());
        return Result.success(snapshot);
    }

    @Override
    public Result<EngagementMetrics, TrackingError> updateMetrics(EngagementKey key, MetricsUpdate update) {
        Optional<EngagementSnapshot> found = engagementRepository.findById(key);
        if (found.isEmpty()) {
            return notFound(key);
        }

        EngagementSnapshot snapshot = found.get();
        snapshot.updateMetrics(update);
        engagementRepository.save(snapshot);
        log.debug("Metrics updated: key={}, rate={}", key, snapshot.getEngagementRate());
        return Result.success(snapshot.getMetrics());
    }

    @Override
    public Result<List<String>, TrackingError> analyze(EngagementKey key) {
        Optional<EngagementSnapshot> found = engagementRepository.findById(key);
        if (found.isEmpty()) {
            return notFound(key);
        }

        EngagementSnapshot snapshot = found.get();
        if (snapshot.isAnalyzed()) {
            log.debug("Re-analyzing key={}, previously analyzed at {}", key, snapshot.getAnalyzedAt());
        }
        snapshot.analyze();
        engagementRepository.save(snapshot);
        eventDispatcher.dispatch(snapshot.commit());

        metrics.incrementAnalyses();
        log.info("Engagement analyzed: key={}, insights={}", key, snapshot.getInsights().size());
        return Result.success(snapshot.getInsights());
    }

    @Override
    public Result<List<String>, TrackingError> addInsight(EngagementKey key, String insight) {
        Optional<EngagementSnapshot> found = engagementRepository.findById(key);
        if (found.isEmpty()) {
            return notFound(key);
        }

        EngagementSnapshot snapshot = found.get();
        snapshot.addCustomInsight(insight);
        engagementRepository.save(snapshot);
        return Result.success(snapshot.getInsights());
    }

    private <T> Result<T, TrackingError> notFound(EngagementKey key) {
        log.debug("Engagement not tracked: key={}", key);
        return Result.failure(new TrackingError.NotFound("EngagementSnapshot", key.toString()));
    }
}
