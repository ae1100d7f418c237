package com.cinemaregistry.scrape.service;

import com.cinemaregistry.config.ScraperProperties;
import com.cinemaregistry.scrape.model.FetchOutcome;
import com.cinemaregistry.scrape.model.RunConfig;
import com.cinemaregistry.scrape.model.ScrapeRunStatusResponse;
import com.cinemaregistry.scrape.model.ScrapeRunSummary;
import com.cinemaregistry.scrape.output.ResultPersister;
import com.cinemaregistry.scrape.rate.AdaptiveRateController;
import com.cinemaregistry.scrape.rate.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one scrape over an identifier range: seeds the queue, starts a fixed
 * pool of workers, checkpoints on a fixed period and always finishes with a
 * final persist, whether the range completed or the run was cancelled.
 */
@Service
public class ScrapeSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ScrapeSupervisor.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;
    private static final long TERMINATION_WAIT_SECONDS = 5;

    private final CinemaLookupClient lookupClient;
    private final ResultPersister persister;
    private final ScraperProperties properties;
    private final ExecutorService scrapeRunExecutor;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Object lifecycleLock = new Object();

    private volatile ActiveRun activeRun;
    private volatile ScrapeRunSummary lastRun;

    public ScrapeSupervisor(
        CinemaLookupClient lookupClient,
        ResultPersister persister,
        ScraperProperties properties,
        @Qualifier("scrapeRunExecutor") ExecutorService scrapeRunExecutor,
        Clock clock,
        Sleeper sleeper
    ) {
        this.lookupClient = lookupClient;
        this.persister = persister;
        this.properties = properties;
        this.scrapeRunExecutor = scrapeRunExecutor;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until every identifier of the range was processed or the run was
     * cancelled. The final persist has happened when this returns.
     */
    public ScrapeRunSummary run(RunConfig config) {
        ActiveRun run = register(config);
        return execute(run);
    }

    public RunConfig startAsync(RunConfig config) {
        ActiveRun run = register(config);
        try {
            scrapeRunExecutor.submit(() -> execute(run));
        } catch (RuntimeException e) {
            release(run);
            throw e;
        }
        return config;
    }

    /**
     * @return {@code true} if an active run was asked to stop
     */
    public boolean cancel() {
        ActiveRun run = activeRun;
        return run != null && run.cancel();
    }

    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        ActiveRun run = activeRun;
        return run == null || run.finished.await(timeout, unit);
    }

    public ScrapeRunStatusResponse status() {
        ActiveRun run = activeRun;
        if (run == null) {
            return new ScrapeRunStatusResponse(false, null, null, 0, 0, 0, 0, null, lastRun);
        }
        return new ScrapeRunStatusResponse(
            true,
            run.config,
            run.startedAt,
            run.queue.doneCount(),
            run.sink.foundCount(),
            run.sink.notFoundCount(),
            run.sink.failedCount(),
            run.rateController.snapshot(),
            lastRun
        );
    }

    @PreDestroy
    public void stopOnShutdown() {
        ActiveRun run = activeRun;
        if (run == null) {
            return;
        }
        log.info("Received shutdown, stopping scrape workers...");
        run.cancel();
        try {
            long timeout = properties.getRun().getJoinTimeoutSeconds() + SHUTDOWN_GRACE_SECONDS;
            if (!run.finished.await(timeout, TimeUnit.SECONDS)) {
                log.warn("Scrape run did not finish its final persist within {}s", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ActiveRun register(RunConfig config) {
        synchronized (lifecycleLock) {
            if (activeRun != null) {
                throw new ActiveScrapeRunException(
                    "Scrape run already active for range " + activeRun.config.start() + "-" + activeRun.config.end()
                );
            }
            AdaptiveRateController rateController =
                new AdaptiveRateController(properties.getRate(), clock, sleeper);
            ActiveRun run = new ActiveRun(config, clock.instant(), rateController, new ScrapeResultSink(persister));
            activeRun = run;
            return run;
        }
    }

    private void release(ActiveRun run) {
        synchronized (lifecycleLock) {
            if (activeRun == run) {
                activeRun = null;
            }
        }
        run.finished.countDown();
    }

    private ScrapeRunSummary execute(ActiveRun run) {
        RunConfig config = run.config;
        log.info("Starting scrape run with config {}", config);

        FetchWorker fetchWorker = new FetchWorker(
            lookupClient,
            run.rateController,
            properties.getRate().getPacingMode(),
            properties.getRetry(),
            sleeper,
            clock
        );
        ExecutorService workers = Executors.newFixedThreadPool(config.workerCount(), namedThreads("scrape-worker-"));
        ScheduledExecutorService checkpoints = Executors.newSingleThreadScheduledExecutor(namedThreads("scrape-checkpoint-"));
        long period = properties.getRun().getCheckpointInterval().toMillis();
        checkpoints.scheduleAtFixedRate(() -> checkpoint(run), period, period, TimeUnit.MILLISECONDS);

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < config.workerCount(); i++) {
            int workerIndex = i + 1;
            futures.add(CompletableFuture.runAsync(() -> workerLoop(run, fetchWorker, workerIndex), workers));
        }
        CompletableFuture<Void> allWorkers = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));

        boolean interrupted = false;
        ScrapeRunSummary summary = null;
        try {
            try {
                CompletableFuture.anyOf(allWorkers, run.cancelSignal).get();
            } catch (InterruptedException e) {
                interrupted = true;
                run.cancel();
            } catch (ExecutionException e) {
                log.error("Scrape worker pool failed", e.getCause());
            }
            if (run.cancelled.get()) {
                interrupted |= joinAfterCancel(run, allWorkers, workers);
            }
        } finally {
            workers.shutdown();
            interrupted |= Thread.interrupted();
            interrupted |= stopCheckpoints(checkpoints);
            try {
                run.sink.snapshotAndPersist(clock.instant());
                summary = summarize(run);
                lastRun = summary;
                log.info(
                    "Scraping {}. Found {} cinemas, {} errors, {} without record, {} skipped.",
                    summary.status().toLowerCase(),
                    summary.found(),
                    summary.failed(),
                    summary.notFound(),
                    summary.drained()
                );
            } finally {
                release(run);
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        return summary;
    }

    private boolean joinAfterCancel(ActiveRun run, CompletableFuture<Void> allWorkers, ExecutorService workers) {
        int joinTimeout = properties.getRun().getJoinTimeoutSeconds();
        try {
            allWorkers.get(joinTimeout, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Workers still busy {}s after cancellation, interrupting them", joinTimeout);
            return interruptAndAwait(workers);
        } catch (InterruptedException e) {
            interruptAndAwait(workers);
            return true;
        } catch (ExecutionException e) {
            log.error("Scrape worker pool failed", e.getCause());
        }
        return false;
    }

    /**
     * Interrupts the workers and waits for them to hand their last outcome to
     * the sink, so the final persist sees it.
     *
     * @return {@code true} if the calling thread was interrupted while waiting
     */
    private boolean interruptAndAwait(ExecutorService workers) {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Workers did not stop within {}s of being interrupted", TERMINATION_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            return true;
        }
        return false;
    }

    /**
     * Cancels future checkpoints and lets one already writing finish, so it
     * never overlaps the final persist.
     *
     * @return {@code true} if the calling thread was interrupted while waiting
     */
    private boolean stopCheckpoints(ScheduledExecutorService checkpoints) {
        checkpoints.shutdown();
        try {
            if (!checkpoints.awaitTermination(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Periodic checkpoint still writing after {}s", TERMINATION_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            return true;
        }
        return false;
    }

    private void workerLoop(ActiveRun run, FetchWorker fetchWorker, int workerIndex) {
        int maxAttempts = properties.getRetry().getMaxAttempts();
        int progressEvery = properties.getRun().getProgressLogEvery();
        long total = run.config.total();
        while (!run.cancelled.get() && !Thread.currentThread().isInterrupted()) {
            OptionalLong next = run.queue.tryPoll();
            if (next.isEmpty()) {
                break;
            }
            long identifier = next.getAsLong();
            FetchOutcome outcome;
            try {
                outcome = fetchWorker.fetch(identifier, maxAttempts, run.cancelled::get);
            } catch (Exception e) {
                log.error("Worker {} failed unexpectedly on id {}", workerIndex, identifier, e);
                outcome = new FetchOutcome.Failure(
                    identifier,
                    "unexpected: " + e.getClass().getSimpleName() + ": " + e.getMessage(),
                    clock.instant()
                );
            }
            run.sink.append(outcome);
            run.queue.markDone();

            long processed = run.queue.doneCount();
            if (processed % progressEvery == 0 || processed == total) {
                log.info("Progress {}/{} - last id: {}, found: {}", processed, total, identifier, run.sink.foundCount());
            }
        }
    }

    private void checkpoint(ActiveRun run) {
        try {
            run.sink.snapshotAndPersist(clock.instant());
        } catch (RuntimeException e) {
            log.warn("Periodic checkpoint failed", e);
        }
    }

    private ScrapeRunSummary summarize(ActiveRun run) {
        return new ScrapeRunSummary(
            run.config,
            run.startedAt,
            clock.instant(),
            run.cancelled.get() ? "CANCELLED" : "COMPLETED",
            run.queue.doneCount(),
            run.sink.foundCount(),
            run.sink.notFoundCount(),
            run.sink.failedCount(),
            run.queue.drainedCount(),
            run.sink.failuresByReason()
        );
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class ActiveRun {
        private final RunConfig config;
        private final Instant startedAt;
        private final AdaptiveRateController rateController;
        private final ScrapeResultSink sink;
        private final IdentifierQueue queue = new IdentifierQueue();
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final CompletableFuture<Void> cancelSignal = new CompletableFuture<>();
        private final CountDownLatch finished = new CountDownLatch(1);

        private ActiveRun(RunConfig config, Instant startedAt, AdaptiveRateController rateController, ScrapeResultSink sink) {
            this.config = config;
            this.startedAt = startedAt;
            this.rateController = rateController;
            this.sink = sink;
            queue.seed(config.start(), config.end());
        }

        private boolean cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return false;
            }
            long drained = queue.drain();
            log.info("Cancellation requested, dropped {} queued identifiers", drained);
            cancelSignal.complete(null);
            return true;
        }
    }
}
