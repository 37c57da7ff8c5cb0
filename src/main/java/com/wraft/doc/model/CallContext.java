package com.wraft.doc.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one external call: a short call id, the start time, and request,
 * response and error log lines in a fixed format.
 *
 * @see com.wraft.doc.util.ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary) {
        logger.info("{} {} → {} [{}]",
                service.getEmoji(),
                service.getName(),
                operation,
                callId);

        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Request: {}", summary);
        }
    }

    public void logResponse(String summary) {
        logger.info("{} {} ← {} [{}] ({}ms)",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs());

        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Response: {}", summary);
        }
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                errorMessage);

        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
