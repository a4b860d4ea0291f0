package com.vibeflows.dataserver.core;

import org.bson.conversions.Bson;

/**
 * Paging and ordering for a read.
 *
 * @param limit maximum documents returned, clamped to {@link #MAX_LIMIT}
 * @param skip  documents skipped before the first one returned
 * @param sort  ordering, or {@code null} for natural order
 */
public record FindOptions(int limit, int skip, Bson sort) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public FindOptions {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative, got " + skip);
        }
        limit = Math.min(limit, MAX_LIMIT);
    }

    public static FindOptions defaults() {
        return new FindOptions(DEFAULT_LIMIT, 0, null);
    }

    public FindOptions withLimit(int limit) {
        return new FindOptions(limit, skip, sort);
    }

    public FindOptions withSkip(int skip) {
        return new FindOptions(limit, skip, sort);
    }

    public FindOptions withSort(Bson sort) {
        return new FindOptions(limit, skip, sort);
    }
}
