package com.contenttracker.infrastructure.context;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-bound id of the analysis session the current observer call belongs to.
 * Mirrored into the logging MDC and stamped on every dispatched event envelope.
 */
public final class AnalysisSessionContext {

    private static final String SESSION_ID_KEY = "sessionId";

    private static final ThreadLocal<String> currentSessionId = new ThreadLocal<>();

    private AnalysisSessionContext() {}

    public static void set(String sessionId) {
        currentSessionId.set(sessionId);
        MDC.put(SESSION_ID_KEY, sessionId);
    }

    /**
     * Starts a session with a random id; close the returned scope to end it.
     */
    public static Scope open() {
        set(UUID.randomUUID().toString());
        return AnalysisSessionContext::clear;
    }

    public static String getSessionId() {
        return currentSessionId.get();
    }

    public static void clear() {
        currentSessionId.remove();
        MDC.remove(SESSION_ID_KEY);
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
