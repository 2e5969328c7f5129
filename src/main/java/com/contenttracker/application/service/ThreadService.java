package com.contenttracker.application.service;

import com.contenttracker.application.port.in.ThreadUseCase;
import com.contenttracker.application.port.out.ContentItemRepository;
import com.contenttracker.application.port.out.EventDispatcher;
import com.contenttracker.application.port.out.MetricsPort;
import com.contenttracker.application.port.out.ThreadRepository;
import com.contenttracker.domain.error.DomainException;
import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ConversationThread;
import com.contenttracker.domain.model.Result;
import com.contenttracker.domain.model.ThreadId;
import com.contenttracker.domain.model.ThreadProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Consumer;

@Service
public class ThreadService implements ThreadUseCase {

    private static final Logger log = LoggerFactory.getLogger(ThreadService.class);

    private final ThreadRepository threadRepository;
    private final ContentItemRepository contentItemRepository;
    private final EventDispatcher eventDispatcher;
    private final MetricsPort metrics;

    public ThreadService(
            ThreadRepository threadRepository,
            ContentItemRepository contentItemRepository,
            EventDispatcher eventDispatcher,
            MetricsPort metrics) {
        this.threadRepository = threadRepository;
        this.contentItemRepository = contentItemRepository;
        this.eventDispatcher = eventDispatcher;
        this.metrics = metrics;
    }

    @Override
    public Result<ConversationThread, TrackingError> createThread(ActorId authorId, ThreadProps props) {
        ConversationThread thread = ConversationThread.create(ThreadId.random(), authorId, props);
        threadRepository.save(thread);
        eventDispatcher.dispatch(thread.commit());
        log.info("Thread created: threadId={}, authorId={}", thread.getId(), authorId);
        return Result.success(thread);
    }

    @Override
    public Result<ConversationThread, TrackingError> addToThread(ThreadId threadId, ContentId contentId) {
        Result<ConversationThread, TrackingError> result = mutate(threadId, "add-to-thread", t -> t.addContent(contentId));
        if (result.isSuccess()) {
            // back-reference on the item is bookkeeping only, it emits nothing
            contentItemRepository.findById(contentId).ifPresent(item -> {
                item.addToThread(threadId);
                contentItemRepository.save(item);
            });
        }
        return result;
    }

    @Override
    public Result<ConversationThread, TrackingError> archiveThread(ThreadId threadId) {
        return mutate(threadId, "archive", ConversationThread::archive);
    }

    private Result<ConversationThread, TrackingError> mutate(
            ThreadId threadId, String action, Consumer<ConversationThread> mutation) {
        Optional<ConversationThread> found = threadRepository.findById(threadId);
        if (found.isEmpty()) {
            log.debug("Thread not found: threadId={}", threadId);
            return Result.failure(new TrackingError.NotFound("ConversationThread", threadId.toString()));
        }

        ConversationThread thread = found.get();
        try {
            mutation.accept(thread);
        } catch (DomainException e) {
            log.warn("Rejected {} on threadId={}: {}", action, threadId, e.getMessage());
            metrics.incrementRejectedActions(e.getErrorCode());
            return Result.failure(TrackingErrors.from(e));
        }

        threadRepository.save(thread);
        eventDispatcher.dispatch(thread.commit());
        log.debug("Thread {} applied: threadId={}, size={}", action, threadId, thread.getContentCount());
        return Result.success(thread);
    }
}
