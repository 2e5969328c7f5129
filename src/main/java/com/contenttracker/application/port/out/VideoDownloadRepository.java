package com.contenttracker.application.port.out;

import com.contenttracker.domain.model.VideoDownload;
import com.contenttracker.domain.model.VideoId;

public interface VideoDownloadRepository extends AggregateRepository<VideoId, VideoDownload> {
}
