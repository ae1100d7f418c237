package com.cinemaregistry.scrape.service;

import java.util.OptionalLong;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pending identifiers shared by all workers. Each seeded identifier is handed
 * out at most once, and failed identifiers are never put back.
 */
public class IdentifierQueue {
    private final ConcurrentLinkedQueue<Long> pending = new ConcurrentLinkedQueue<>();
    private final AtomicLong seeded = new AtomicLong();
    private final AtomicLong done = new AtomicLong();
    private final AtomicLong drained = new AtomicLong();

    public void seed(long start, long end) {
        if (end < start) {
            return;
        }
        // counted loop so an end of Long.MAX_VALUE cannot wrap
        long count = end - start + 1;
        for (long offset = 0; offset < count; offset++) {
            pending.add(start + offset);
            seeded.incrementAndGet();
        }
    }

    public OptionalLong tryPoll() {
        Long next = pending.poll();
        return next == null ? OptionalLong.empty() : OptionalLong.of(next);
    }

    public void markDone() {
        done.incrementAndGet();
    }

    /**
     * Removes every identifier still waiting without handing it to a worker.
     *
     * @return how many identifiers were discarded by this call
     */
    public long drain() {
        long count = 0;
        while (pending.poll() != null) {
            count++;
        }
        drained.addAndGet(count);
        return count;
    }

    public long seededCount() {
        return seeded.get();
    }

    public long doneCount() {
        return done.get();
    }

    public long drainedCount() {
        return drained.get();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
