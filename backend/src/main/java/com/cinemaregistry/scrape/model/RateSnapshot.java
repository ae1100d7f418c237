package com.cinemaregistry.scrape.model;

import java.time.Instant;

public record RateSnapshot(
    double intervalSeconds,
    int timeoutCount,
    double errorCount,
    Instant lastSuccessAt,
    int errorStormPauses
) {}
