package com.cinemaregistry.scrape.service;

import com.cinemaregistry.config.ScraperProperties;
import com.cinemaregistry.scrape.http.LookupHttpClient;
import com.cinemaregistry.scrape.model.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Issues one lookup for one identifier and interprets the payload:
 * {@code {"status":1,"data":{"table0":[{...}]}}}.
 */
@Service
public class CinemaLookupClient {
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final ScraperProperties.Endpoint endpoint;
    private final LookupHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public CinemaLookupClient(ScraperProperties properties, LookupHttpClient httpClient, ObjectMapper objectMapper) {
        this.endpoint = properties.getEndpoint();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public LookupAttempt lookup(long identifier) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put(endpoint.getCacheBusterParam(), String.valueOf(ThreadLocalRandom.current().nextDouble()));
        form.put(endpoint.getIdentifierParam(), Long.toString(identifier));

        HttpFetchResult fetch = httpClient.postForm(endpoint.getUrl(), form);
        if (!fetch.isSuccessful()) {
            return LookupAttempt.transportFailure(fetch.describeFailure());
        }
        return parse(fetch.body());
    }

    LookupAttempt parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            return LookupAttempt.parseFailure("PARSING_FAILED: " + e.getOriginalMessage());
        }
        JsonNode status = root == null ? null : root.path("status");
        if (status == null || !status.isIntegralNumber() || status.longValue() != 1) {
            return LookupAttempt.notFound();
        }
        JsonNode rows = root.path("data").path("table0");
        if (!rows.isArray() || rows.isEmpty()) {
            return LookupAttempt.notFound();
        }
        JsonNode first = rows.get(0);
        if (first == null || !first.isObject() || first.isEmpty()) {
            return LookupAttempt.notFound();
        }
        return LookupAttempt.found(objectMapper.convertValue(first, ROW_TYPE));
    }

    public enum AttemptKind {
        FOUND,
        NOT_FOUND,
        TRANSPORT_FAILURE,
        PARSE_FAILURE
    }

    public record LookupAttempt(AttemptKind kind, Map<String, Object> row, String errorMessage) {
        static LookupAttempt found(Map<String, Object> row) {
            return new LookupAttempt(AttemptKind.FOUND, row, null);
        }

        static LookupAttempt notFound() {
            return new LookupAttempt(AttemptKind.NOT_FOUND, null, null);
        }

        static LookupAttempt transportFailure(String message) {
            return new LookupAttempt(AttemptKind.TRANSPORT_FAILURE, null, message);
        }

        static LookupAttempt parseFailure(String message) {
            return new LookupAttempt(AttemptKind.PARSE_FAILURE, null, message);
        }

        public boolean reachedEndpoint() {
            return kind == AttemptKind.FOUND || kind == AttemptKind.NOT_FOUND;
        }
    }
}
