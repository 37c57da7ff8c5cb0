package com.wraft.doc.build;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one renderer run. The exit code is the process's own, with two
 * reserved values for runs that never produced one.
 */
@Value
@Builder
public class RenderResult {

    /**
     * The renderer executable could not be started.
     */
    public static final int EXIT_NOT_STARTED = 127;

    /**
     * The renderer was killed after exceeding its timeout.
     */
    public static final int EXIT_TIMED_OUT = 124;

    int exitCode;

    String output;

    long durationMs;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
