package com.purchasingpower.blamelens.model;

import org.slf4j.Logger;

import java.util.StringJoiner;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * One provider request or git process run, as seen in the logs.
 *
 * <p>Request, response and failure lines share a short id, and details are rendered inline as
 * {@code key=value} pairs so a single grep on the id shows the whole call. Lookups run on every
 * hover, so the happy path stays at debug.
 *
 * @see com.purchasingpower.blamelens.util.ExternalCallLogger
 */
public class CallContext {

    private final String callId = UUID.randomUUID().toString().substring(0, 8);
    private final long startNanos = System.nanoTime();
    private final ServiceType service;
    private final String operation;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.service = service;
        this.operation = operation;
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        if (logger.isDebugEnabled()) {
            logger.debug("{} {} → {} [{}] {}{}", service.getEmoji(), service.getName(), operation, callId,
                    summary, inline(details));
        }
    }

    public void logResponse(String summary, Object... details) {
        if (logger.isDebugEnabled()) {
            logger.debug("{} {} ← {} [{}] ({}ms) {}{}", service.getEmoji(), service.getName(), operation, callId,
                    elapsedMs(), summary, inline(details));
        }
    }

    /**
     * Provider failures are routine (missing token, rate limit, offline), hence warn. The stack
     * trace only goes to debug.
     */
    public void logError(String errorMessage, Throwable ex) {
        logger.warn("{} {} ✖ {} [{}] ({}ms) {}", service.getEmoji(), service.getName(), operation, callId,
                elapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("[{}] cause", callId, ex);
        }
    }

    private long elapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String inline(Object... details) {
        if (details == null || details.length < 2) {
            return "";
        }
        StringJoiner joined = new StringJoiner(", ", " (", ")");
        for (int i = 0; i + 1 < details.length; i += 2) {
            joined.add(details[i] + "=" + details[i + 1]);
        }
        return joined.toString();
    }
}
