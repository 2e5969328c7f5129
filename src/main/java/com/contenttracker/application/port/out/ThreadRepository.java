package com.contenttracker.application.port.out;

import com.contenttracker.domain.model.ConversationThread;
import com.contenttracker.domain.model.ThreadId;

public interface ThreadRepository extends AggregateRepository<ThreadId, ConversationThread> {
}
