package com.umitunal.cronlite.core;

/**
 * Offset/limit window over a listing.
 */
public class Page {
    public static final int DEFAULT_LIMIT = 50;

    private final int offset;
    private final int limit;

    private Page(int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0: " + offset);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0: " + limit);
        }
        this.offset = offset;
        this.limit = limit;
    }

    public static Page of(int offset, int limit) {
        return new Page(offset, limit);
    }

    public static Page first(int limit) {
        return new Page(0, limit);
    }

    public static Page defaults() {
        return new Page(0, DEFAULT_LIMIT);
    }

    public int getOffset() { return offset; }
    public int getLimit() { return limit; }
}
