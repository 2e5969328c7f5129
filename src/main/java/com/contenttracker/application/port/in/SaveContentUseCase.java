package com.contenttracker.application.port.in;

import com.contenttracker.domain.error.TrackingError;
import com.contenttracker.domain.model.ActorId;
import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ContentItem;
import com.contenttracker.domain.model.ContentProps;
import com.contenttracker.domain.model.Result;
import com.contenttracker.domain.model.ThreadId;

public interface SaveContentUseCase {
    /**
     * @param threadId optional thread the item belongs to, {@code null} for none
     */
    Result<ContentItem, TrackingError> saveContent(ContentId contentId, ActorId authorId, ContentProps props, ThreadId threadId);
}
