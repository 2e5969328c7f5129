package com.contenttracker.adapter.out.memory;

import com.contenttracker.application.port.out.EngagementRepository;
import com.contenttracker.domain.model.EngagementKey;
import com.contenttracker.domain.model.EngagementProps;
import com.contenttracker.domain.model.EngagementSnapshot;
import com.contenttracker.infrastructure.config.AppProperties;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class InMemoryEngagementStore
        extends InMemoryAggregateStore<EngagementKey, EngagementSnapshot, InMemoryEngagementStore.Snapshot>
        implements EngagementRepository {

    public InMemoryEngagementStore(AppProperties appProperties) {
        super(appProperties.getStore().getMaxEntries());
    }

    @Override
    protected Snapshot snapshot(EngagementSnapshot engagement) {
        return new Snapshot(engagement.getProps(), engagement.getAnalyzedAt(), engagement.getInsights());
    }

    @Override
    protected EngagementSnapshot restore(EngagementKey key, Snapshot s) {
        return EngagementSnapshot.reconstitute(key, s.props(), s.analyzedAt(), s.insights());
    }

    record Snapshot(EngagementProps props, Instant analyzedAt, List<String> insights) {}
}
