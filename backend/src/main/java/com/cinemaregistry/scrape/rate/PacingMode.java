package com.cinemaregistry.scrape.rate;

/**
 * When a worker reports success to the rate controller.
 */
public enum PacingMode {
    /**
     * Success is reported before every attempt and the returned interval is
     * slept. Attempts that go on to fail still count as a success first.
     */
    OPTIMISTIC,
    /**
     * The current interval is slept without touching the controller, and
     * success is reported only after a 2xx response.
     */
    CONFIRMED
}
