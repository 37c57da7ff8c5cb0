package com.wraft.doc.service;

import java.time.Instant;

/**
 * Timings and exit status of one renderer run.
 */
public record BuildHistoryParams(Instant startTime, Instant endTime, int exitCode) {
}
