package com.cinemaregistry.scrape.service;

import com.cinemaregistry.config.ScraperProperties;
import com.cinemaregistry.scrape.model.FetchOutcome;
import com.cinemaregistry.scrape.rate.AdaptiveRateController;
import com.cinemaregistry.scrape.rate.PacingMode;
import com.cinemaregistry.scrape.rate.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;

/**
 * Looks up one identifier with bounded retries. Every attempt is paced by the
 * run's {@link AdaptiveRateController} and reports back to it; transport
 * failures back off exponentially with jitter before the next attempt.
 *
 * <p>A cancelled run lets the attempt in progress finish, then stops retrying:
 * the identifier is recorded as failed with the last error seen.
 */
public class FetchWorker {
    private static final Logger log = LoggerFactory.getLogger(FetchWorker.class);

    private final CinemaLookupClient lookupClient;
    private final AdaptiveRateController rateController;
    private final PacingMode pacingMode;
    private final long baseDelayMs;
    private final Sleeper sleeper;
    private final Clock clock;

    public FetchWorker(
        CinemaLookupClient lookupClient,
        AdaptiveRateController rateController,
        PacingMode pacingMode,
        ScraperProperties.Retry retry,
        Sleeper sleeper,
        Clock clock
    ) {
        this.lookupClient = lookupClient;
        this.rateController = rateController;
        this.pacingMode = pacingMode;
        this.baseDelayMs = retry.getBaseDelayMs();
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public FetchOutcome fetch(long identifier, int maxAttempts) {
        return fetch(identifier, maxAttempts, () -> false);
    }

    public FetchOutcome fetch(long identifier, int maxAttempts, BooleanSupplier cancelled) {
        int attempts = Math.max(1, maxAttempts);
        String lastError = "no_attempt";
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                sleeper.sleep(pace());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return interrupted(identifier);
            }

            CinemaLookupClient.LookupAttempt result = lookupClient.lookup(identifier);
            if (result.reachedEndpoint()) {
                if (pacingMode == PacingMode.CONFIRMED) {
                    rateController.report(true);
                }
                if (result.kind() == CinemaLookupClient.AttemptKind.FOUND) {
                    return new FetchOutcome.Success(identifier, result.row());
                }
                return new FetchOutcome.NotFound(identifier);
            }

            rateController.report(false);
            lastError = result.errorMessage();
            if (result.kind() == CinemaLookupClient.AttemptKind.PARSE_FAILURE) {
                log.error("Unexpected payload for id {}: {}", identifier, lastError);
                return new FetchOutcome.Failure(identifier, lastError, clock.instant());
            }
            if (Thread.currentThread().isInterrupted()) {
                return interrupted(identifier);
            }
            if (attempt == attempts - 1) {
                break;
            }
            if (cancelled.getAsBoolean()) {
                return cancelledAfter(identifier, attempt + 1, lastError);
            }
            Duration backoff = backoffFor(attempt);
            log.debug("Attempt {} for id {} failed ({}), retrying in {}ms", attempt + 1, identifier, lastError, backoff.toMillis());
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return interrupted(identifier);
            }
            if (cancelled.getAsBoolean()) {
                return cancelledAfter(identifier, attempt + 1, lastError);
            }
        }
        log.warn("Failed id {} after {} attempts: {}", identifier, attempts, lastError);
        return new FetchOutcome.Failure(identifier, lastError, clock.instant());
    }

    private Duration pace() {
        if (pacingMode == PacingMode.OPTIMISTIC) {
            return rateController.report(true);
        }
        return rateController.waitInterval();
    }

    Duration backoffFor(int attempt) {
        if (baseDelayMs <= 0) {
            return Duration.ZERO;
        }
        long delay = baseDelayMs * (1L << Math.min(20, Math.max(0, attempt)));
        long jitter = ThreadLocalRandom.current().nextLong(baseDelayMs);
        return Duration.ofMillis(delay + jitter);
    }

    private FetchOutcome.Failure cancelledAfter(long identifier, int attemptsMade, String lastError) {
        log.info("Run cancelled, giving up id {} after {} attempt(s): {}", identifier, attemptsMade, lastError);
        return new FetchOutcome.Failure(identifier, lastError, clock.instant());
    }

    private FetchOutcome.Failure interrupted(long identifier) {
        return new FetchOutcome.Failure(identifier, "interrupted", clock.instant());
    }
}
