package com.cinemaregistry.scrape.model;

import java.time.Instant;

public record ScrapeRunStatusResponse(
    boolean running,
    RunConfig config,
    Instant startedAt,
    long processed,
    int found,
    int notFound,
    int failed,
    RateSnapshot rate,
    ScrapeRunSummary lastRun
) {}
