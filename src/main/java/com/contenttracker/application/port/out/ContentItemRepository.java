package com.contenttracker.application.port.out;

import com.contenttracker.domain.model.ContentId;
import com.contenttracker.domain.model.ContentItem;

public interface ContentItemRepository extends AggregateRepository<ContentId, ContentItem> {
}
