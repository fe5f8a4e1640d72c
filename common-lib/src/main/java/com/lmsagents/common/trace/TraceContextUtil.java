package com.lmsagents.common.trace;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation helper. A trace id is minted when a worker originates an event and is
 * carried on every envelope that follows from it.
 *
 * <p>MDC is only written for the duration of a log statement, never left behind on a
 * pooled thread.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction}, then removes it.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
