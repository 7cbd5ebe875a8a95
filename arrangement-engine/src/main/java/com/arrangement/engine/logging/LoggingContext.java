package com.arrangement.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper so every log line written while a command runs carries the track, the user and
 * the command name.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forCommand(trackId, userId, "AddMidiNote")) {
 *     log.info("Persisting events"); // includes trackId, userId, command, traceId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TRACK_ID = "trackId";
    public static final String USER_ID = "userId";
    public static final String COMMAND = "command";
    public static final String QUERY = "query";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for a dispatched command.
     */
    public static LoggingContext forCommand(String trackId, String userId, String command) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(TRACK_ID, trackId);
        putIfPresent(USER_ID, userId);
        putIfPresent(COMMAND, command);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a read-only query.
     */
    public static LoggingContext forQuery(String query) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(QUERY, query);
        ensureTraceId();
        return ctx;
    }

    public static String getTrackId() {
        return MDC.get(TRACK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TRACK_ID);
        MDC.remove(USER_ID);
        MDC.remove(COMMAND);
        MDC.remove(QUERY);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
