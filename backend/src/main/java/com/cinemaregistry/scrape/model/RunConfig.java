package com.cinemaregistry.scrape.model;

public record RunConfig(long start, long end, int workerCount) {
    /** Upper bound on identifiers per run; every one is queued up front. */
    public static final long MAX_IDENTIFIERS = 10_000_000L;

    public RunConfig {
        if (start < 1) {
            throw new IllegalArgumentException("start must be a positive identifier, got " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end must not be lower than start (" + start + " > " + end + ")");
        }
        if (end - start + 1 > MAX_IDENTIFIERS) {
            throw new IllegalArgumentException(
                "range " + start + "-" + end + " exceeds " + MAX_IDENTIFIERS + " identifiers"
            );
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
        }
    }

    public long total() {
        return end - start + 1;
    }
}
