package com.cinemaregistry.scrape.rate;

import com.cinemaregistry.config.ScraperProperties;
import com.cinemaregistry.scrape.model.RateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reactive pacing shared by every worker of a run.
 *
 * <p>Successes slowly shrink the inter-request interval, repeated failures grow
 * it, and a sustained failure storm blocks the reporting worker for a cooldown.
 * The cooldown is taken while holding the controller lock, so every other
 * worker stalls on its next pacing call as well.
 */
public class AdaptiveRateController {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateController.class);

    private final ScraperProperties.Rate settings;
    private final Clock clock;
    private final Sleeper sleeper;

    private double intervalSeconds;
    private int timeoutCount;
    private double errorCount;
    private Instant lastSuccessAt;
    private int errorStormPauses;

    public AdaptiveRateController(ScraperProperties.Rate settings, Clock clock, Sleeper sleeper) {
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
        this.intervalSeconds = clamp(settings.getInitialIntervalSeconds());
        this.lastSuccessAt = clock.instant();
    }

    public synchronized Duration waitInterval() {
        return toDuration(intervalSeconds);
    }

    public synchronized Duration report(boolean success) {
        if (success) {
            recordSuccess();
        } else {
            recordFailure();
        }
        return toDuration(intervalSeconds);
    }

    public synchronized RateSnapshot snapshot() {
        return new RateSnapshot(intervalSeconds, timeoutCount, errorCount, lastSuccessAt, errorStormPauses);
    }

    private void recordSuccess() {
        Instant now = clock.instant();
        timeoutCount = Math.max(0, timeoutCount - 1);
        errorCount = Math.max(0.0, errorCount - 0.5);
        if (Duration.between(lastSuccessAt, now).toMillis() < settings.getFastSuccessWindowMs()) {
            intervalSeconds = clamp(intervalSeconds * settings.getSpeedUpFactor());
        }
        lastSuccessAt = now;
    }

    private void recordFailure() {
        timeoutCount++;
        errorCount += 1.0;
        if (timeoutCount > settings.getTimeoutThreshold()) {
            intervalSeconds = clamp(intervalSeconds * settings.getSlowDownFactor());
        }
        if (errorCount > settings.getErrorStormThreshold()) {
            double pauseSeconds = Math.min(
                settings.getMaxErrorStormPauseSeconds(),
                settings.getErrorStormPauseSecondsPerError() * errorCount
            );
            log.warn("Too many errors (score={}), pausing all requests for {}s", errorCount, pauseSeconds);
            errorStormPauses++;
            try {
                sleeper.sleep(toDuration(pauseSeconds));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Error storm pause interrupted");
            }
            errorCount = 0.0;
        }
    }

    private double clamp(double value) {
        return Math.max(settings.getMinIntervalSeconds(), Math.min(settings.getMaxIntervalSeconds(), value));
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }
}
