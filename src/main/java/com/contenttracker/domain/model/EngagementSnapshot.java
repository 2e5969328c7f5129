package com.contenttracker.domain.model;

import com.contenttracker.domain.event.EngagementAnalyzed;
import com.contenttracker.domain.event.EngagementTracked;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Engagement metrics of one content item over one time window, with derived insights.
 * <p>
 * Invariant: the engagement rate is never set through an update. Every {@link #updateMetrics}
 * recomputes it as engagements / impressions when impressions are positive, and otherwise
 * leaves the previous rate in place.
 * <p>
 * Event policy: creation and analysis emit; metric updates and manual insight edits do not.
 * {@link #analyze()} may run more than once and re-emits each time.
 */
public class EngagementSnapshot extends AggregateRoot<EngagementKey> {

    private final EngagementPeriod period;
    private final Instant startDate;
    private final Instant endDate;

    private EngagementMetrics metrics;
    private Instant analyzedAt;
    private final Set<String> insights;

    private EngagementSnapshot(EngagementKey key, EngagementProps props, Instant analyzedAt, List<String> insights) {
        super(key);
        this.metrics = props.metrics();
        this.period = props.period();
        this.startDate = props.startDate();
        this.endDate = props.endDate();
        this.analyzedAt = analyzedAt;
        this.insights = new LinkedHashSet<>(insights);
    }

    public static EngagementSnapshot create(ContentId contentId, ActorId authorId, EngagementProps props) {
        Objects.requireNonNull(props, "props");
        EngagementSnapshot snapshot = new EngagementSnapshot(new EngagementKey(contentId, authorId), props, null, List.of());
        snapshot.addDomainEvent(new EngagementTracked(contentId, authorId, props.metrics(), Instant.now()));
        return snapshot;
    }

    /**
     * Rebuilds a snapshot from stored state without emitting events.
     */
    public static EngagementSnapshot reconstitute(
            EngagementKey key,
            EngagementProps props,
            Instant analyzedAt,
            List<String> insights) {
        return new EngagementSnapshot(key, props, analyzedAt, insights);
    }

    public void updateMetrics(MetricsUpdate update) {
        EngagementMetrics merged = update.applyTo(metrics);
        if (merged.impressions() > 0) {
            merged = merged.withEngagementRate((double) merged.engagements() / merged.impressions());
        }
        metrics = merged;
    }

    /**
     * Replaces the insights with those derived from the current metrics and records the analysis.
     */
    public void analyze() {
        analyzedAt = Instant.now();
        List<String> generated = EngagementInsights.generate(metrics);
        insights.clear();
        insights.addAll(generated);
        addDomainEvent(new EngagementAnalyzed(getContentId(), getAuthorId(), metrics, generated, analyzedAt));
    }

    public void addCustomInsight(String insight) {
        insights.add(insight);
    }

    public void removeInsight(String insight) {
        insights.remove(insight);
    }

    public boolean isAnalyzed() {
        return analyzedAt != null;
    }

    public ContentId getContentId() {
        return getId().contentId();
    }

    public ActorId getAuthorId() {
        return getId().authorId();
    }

    public EngagementMetrics getMetrics() {
        return metrics;
    }

    public EngagementPeriod getPeriod() {
        return period;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    public List<String> getInsights() {
        return List.copyOf(insights);
    }

    public double getEngagementRate() {
        return metrics.engagementRate();
    }

    public long getTotalEngagements() {
        return metrics.engagements();
    }

    public long getImpressions() {
        return metrics.impressions();
    }

    public EngagementProps getProps() {
        return new EngagementProps(metrics, period, startDate, endDate);
    }
}
