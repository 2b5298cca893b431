package com.aperture.query.builder;

/**
 * Requested page. The limit is clamped to the configured maximum at compile time.
 */
public class Pagination {

    private final long limit;
    private final long offset;

    public Pagination(long limit, long offset) {
        this.limit = limit;
        this.offset = offset;
    }

    public static Pagination of(long limit, long offset) {
        return new Pagination(limit, offset);
    }

    public long getLimit() {
        return limit;
    }

    public long getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return "Pagination{limit=" + limit + ", offset=" + offset + "}";
    }
}
