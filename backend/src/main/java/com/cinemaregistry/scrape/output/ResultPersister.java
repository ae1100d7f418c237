package com.cinemaregistry.scrape.output;

import com.cinemaregistry.scrape.model.ResultSnapshot;

import java.io.IOException;
import java.time.Instant;

public interface ResultPersister {

    /**
     * Writes one checkpoint of the run. The label distinguishes successive
     * checkpoints; a later checkpoint never depends on an earlier one.
     */
    void persist(ResultSnapshot snapshot, Instant label) throws IOException;
}
