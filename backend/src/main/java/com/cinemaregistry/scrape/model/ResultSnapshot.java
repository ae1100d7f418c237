package com.cinemaregistry.scrape.model;

import java.util.List;
import java.util.Map;

public record ResultSnapshot(
    List<Map<String, Object>> records,
    List<FetchOutcome.Failure> errors,
    int notFoundCount
) {
    public ResultSnapshot {
        records = List.copyOf(records);
        errors = List.copyOf(errors);
    }

    public boolean isEmpty() {
        return records.isEmpty() && errors.isEmpty();
    }
}
