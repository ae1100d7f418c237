package com.cinemaregistry.scrape.model;

import java.time.Instant;
import java.util.Map;

public record ScrapeRunSummary(
    RunConfig config,
    Instant startedAt,
    Instant finishedAt,
    String status,
    long processed,
    int found,
    int notFound,
    int failed,
    long drained,
    Map<String, Integer> failuresByReason
) {}
