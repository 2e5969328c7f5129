package com.contenttracker.application.port.out;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementContentSaved();

    void incrementLikes();

    void incrementRetweets();

    void incrementFollows();

    void incrementAnalyses();

    void incrementDownloadsRequested();

    void incrementDownloadsCompleted();

    void incrementPlaylistSyncs();

    void incrementEventsDispatched(int count);

    void incrementRejectedActions(String errorCode);

    /**
     * Resets all metrics to zero. Used between analysis sessions in tests and demos.
     */
    void resetAll();
}
