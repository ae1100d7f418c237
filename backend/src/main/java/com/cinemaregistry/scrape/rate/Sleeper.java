package com.cinemaregistry.scrape.rate;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = duration -> {
        long millis = duration.toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
