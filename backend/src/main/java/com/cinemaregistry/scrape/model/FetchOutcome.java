package com.cinemaregistry.scrape.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of looking up one identifier. Exactly one variant is produced per
 * dequeued identifier.
 */
public interface FetchOutcome {

    long identifier();

    /**
     * The endpoint returned a record. Field order is preserved as received.
     */
    record Success(long identifier, Map<String, Object> fields) implements FetchOutcome {
        public Success {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    /**
     * Retries were exhausted, or the payload could not be parsed.
     */
    record Failure(long identifier, String reason, Instant timestamp) implements FetchOutcome {
    }

    /**
     * The endpoint answered but has no record for this identifier.
     */
    record NotFound(long identifier) implements FetchOutcome {
    }
}
