package com.contenttracker.application.service;

import com.contenttracker.application.port.in.ContentInteractionUseCase;
import com.contenttracker.application.port.in.SaveContentUseCase;
import com.contenttracker.application.port.out.ContentItemRepository;
import com.contenttracker.application.port.out.EventDispatcher;
import com.contenttracker.application.port.out.MetricsPort;
import com.contenttracker.domain.error.DuplicateActionException;
import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ContentItem;
import com.contenttracker.domain.model.ContentProps;
import com.contenttracker.domain.model.EngagementCounts;
import com.contenttracker.domain.model.Result;
import com.contenttracker.domain.model.ThreadId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

@Service
public class ContentService implements SaveContentUseCase, ContentInteractionUseCase {

    private static final Logger log = LoggerFactory.getLogger(ContentService.class);

    private final ContentItemRepository contentItemRepository;
    private final EventDispatcher eventDispatcher;
    private final MetricsPort metrics;

    public ContentService(
            ContentItemRepository contentItemRepository,
            EventDispatcher eventDispatcher,
            MetricsPort metrics) {
        this.contentItemRepository = contentItemRepository;
        this.eventDispatcher = eventDispatcher;
        this.metrics = metrics;
    }

    @Override
    public Result<ContentItem, TrackingError> saveContent(
            ContentId contentId, ActorId authorId, ContentProps props, ThreadId threadId) {
        log.debug("Saving content: contentId={}, authorId={}, thread={}", contentId, authorId, threadId);

        ContentItem item = ContentItem.create(contentId, authorId, props, threadId);
        if (!contentItemRepository.saveIfAbsent(item)) {
            log.debug("Content already saved: contentId={}", contentId);
            return Result.failure(new TrackingError.AlreadyPerformed("save", contentId.toString()));
        }
        eventDispatcher.dispatch(item.commit());

        metrics.incrementContentSaved();
        log.info("Content saved: contentId={}, authorId={}, media={}", contentId, authorId, item.hasMedia());
        return Result.success(item);
    }

    @Override
    public Result<EngagementCounts, TrackingError> like(ContentId contentId) {
        return interact(contentId, "like", ContentItem::like, metrics::incrementLikes);
    }

    @Override
    public Result<EngagementCounts, TrackingError> retweet(ContentId contentId) {
        return interact(contentId, "retweet", ContentItem::retweet, metrics::incrementRetweets);
    }

    @Override
    public Result<EngagementCounts, TrackingError> reconcileEngagement(ContentId contentId, EngagementCounts counts) {
        Optional<ContentItem> found = contentItemRepository.findById(contentId);
        if (found.isEmpty()) {
            return notFound(contentId);
        }

        ContentItem item = found.get();
        item.updateEngagement(counts.retweets(), counts.likes(), counts.replies(), counts.quotes(), counts.views());
        contentItemRepository.save(item);
        log.debug("Engagement reconciled: contentId={}, counts={}", contentId, counts);
        return Result.success(item.getEngagement());
    }

    @Override
    public Result<ContentItem, TrackingError> tagContent(ContentId contentId, List<String> hashtags, List<String> mentions) {
        Optional<ContentItem> found = contentItemRepository.findById(contentId);
        if (found.isEmpty()) {
            return notFound(contentId);
        }

        ContentItem item = found.get();
        hashtags.forEach(item::addHashtag);
        mentions.forEach(item::addMention);
        contentItemRepository.save(item);
        return Result.success(item);
    }

    private Result<EngagementCounts, TrackingError> interact(
            ContentId contentId, String action, Consumer<ContentItem> interaction, Runnable counter) {
        log.debug("Processing {} request: contentId={}", action, contentId);

        Optional<ContentItem> found = contentItemRepository.findById(contentId);
        if (found.isEmpty()) {
            return notFound(contentId);
        }

        ContentItem item = found.get();
        try {
            interaction.accept(item);
        } catch (DuplicateActionException e) {
            log.warn("Rejected {} on contentId={}: {}", action, contentId, e.getMessage());
            metrics.incrementRejectedActions(e.getErrorCode());
            return Result.failure(TrackingErrors.from(e));
        }

        contentItemRepository.save(item);
        eventDispatcher.dispatch(item.commit());

        counter.run();
        log.info("Content {} recorded: contentId={}, counts={}", action, contentId, item.getEngagement());
        return Result.success(item.getEngagement());
    }

    private <T> Result<T, TrackingError> notFound(ContentId contentId) {
        log.debug("Content not tracked: contentId={}", contentId);
        return Result.failure(new TrackingError.NotFound("ContentItem", contentId.toString()));
    }
}
