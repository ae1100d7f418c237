package com.cinemaregistry.scrape.service;

import com.cinemaregistry.scrape.model.FetchOutcome;
import com.cinemaregistry.scrape.model.ResultSnapshot;
import com.cinemaregistry.scrape.output.ResultPersister;
import com.cinemaregistry.scrape.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates the outcomes of one run in completion order. Snapshots are
 * copies, so persisting never clears what has been collected.
 */
public class ScrapeResultSink {
    private static final Logger log = LoggerFactory.getLogger(ScrapeResultSink.class);

    private final ResultPersister persister;
    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock persistLock = new ReentrantLock();
    private final List<Map<String, Object>> records = new ArrayList<>();
    private final List<FetchOutcome.Failure> errors = new ArrayList<>();
    private int notFoundCount;

    public ScrapeResultSink(ResultPersister persister) {
        this.persister = persister;
    }

    public void append(FetchOutcome outcome) {
        if (outcome == null) {
            return;
        }
        lock.lock();
        try {
            if (outcome instanceof FetchOutcome.Success success) {
                records.add(success.fields());
            } else if (outcome instanceof FetchOutcome.Failure failure) {
                errors.add(failure);
            } else {
                notFoundCount++;
            }
        } finally {
            lock.unlock();
        }
    }

    public ResultSnapshot snapshot() {
        lock.lock();
        try {
            return new ResultSnapshot(records, errors, notFoundCount);
        } finally {
            lock.unlock();
        }
    }

    public int foundCount() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public int failedCount() {
        lock.lock();
        try {
            return errors.size();
        } finally {
            lock.unlock();
        }
    }

    public int notFoundCount() {
        lock.lock();
        try {
            return notFoundCount;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Integer> failuresByReason() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (FetchOutcome.Failure failure : snapshot().errors()) {
            counts.merge(ReasonCodeClassifier.fromFailureReason(failure.reason()), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Persists everything collected so far. Appends may continue while the
     * copy is being written; two persists never write at the same time.
     *
     * @return {@code false} when the persister failed; the failure is logged
     */
    public boolean snapshotAndPersist(Instant label) {
        persistLock.lock();
        try {
            return persist(snapshot(), label);
        } finally {
            persistLock.unlock();
        }
    }

    private boolean persist(ResultSnapshot snapshot, Instant label) {
        try {
            persister.persist(snapshot, label);
            log.info(
                "Results saved at {}: records={}, errors={}, notFound={}",
                label,
                snapshot.records().size(),
                snapshot.errors().size(),
                snapshot.notFoundCount()
            );
            return true;
        } catch (Exception e) {
            log.error("Failed to save results at {}", label, e);
            return false;
        }
    }
}
