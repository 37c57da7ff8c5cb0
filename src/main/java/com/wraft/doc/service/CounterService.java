package com.wraft.doc.service;

import com.wraft.doc.model.ContentType;

import java.util.function.LongFunction;

/**
 * Per content type sequence numbers.
 */
public interface CounterService {

    /**
     * Increment the counter of a content type and return the new value.
     * The first call for a content type returns 1. Concurrent callers never
     * receive the same value.
     */
    default long next(ContentType contentType) {
        return next(contentType, value -> value);
    }

    /**
     * Increment the counter of a content type and hand the new value to {@code action}
     * in the same transaction. If the action throws, the increment is rolled back and
     * the value is handed out again to the next caller.
     */
    <T> T next(ContentType contentType, LongFunction<T> action);
}
