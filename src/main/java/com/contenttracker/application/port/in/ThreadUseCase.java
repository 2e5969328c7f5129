package com.contenttracker.application.port.in;

import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ConversationThread;
import com.contenttracker.domain.model.Result;
import com.contenttracker.domain.model.ThreadId;
import com.contenttracker.domain.model.ThreadProps;

public interface ThreadUseCase {
    Result<ConversationThread, TrackingError> createThread(ActorId authorId, ThreadProps props);

    /**
     * Adds the item to the thread and, when the item is tracked, links it back to the thread.
     */
    Result<ConversationThread, TrackingError> addToThread(ThreadId threadId, ContentId contentId);

    Result<ConversationThread, TrackingError> archiveThread(ThreadId threadId);
}
