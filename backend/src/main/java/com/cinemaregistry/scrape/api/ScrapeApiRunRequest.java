package com.cinemaregistry.scrape.api;

public record ScrapeApiRunRequest(
    Long startId,
    Long endId,
    Integer workerCount
) {
}
