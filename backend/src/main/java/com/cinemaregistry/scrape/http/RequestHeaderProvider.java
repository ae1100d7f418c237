package com.cinemaregistry.scrape.http;

import com.cinemaregistry.config.ScraperProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds browser-like headers for the lookup endpoint, rotating through the
 * configured User-Agent values on every request.
 */
@Component
public class RequestHeaderProvider {
    private final ScraperProperties.Endpoint endpoint;
    private final List<String> userAgents;
    private final AtomicInteger cursor = new AtomicInteger();

    public RequestHeaderProvider(ScraperProperties properties) {
        this.endpoint = properties.getEndpoint();
        this.userAgents = endpoint.getUserAgents();
    }

    public Map<String, String> nextHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", nextUserAgent());
        headers.put("Accept", "application/json, text/plain, */*");
        if (endpoint.getAcceptLanguage() != null && !endpoint.getAcceptLanguage().isBlank()) {
            headers.put("Accept-Language", endpoint.getAcceptLanguage());
        }
        if (endpoint.getOrigin() != null && !endpoint.getOrigin().isBlank()) {
            headers.put("Origin", endpoint.getOrigin());
        }
        if (endpoint.getReferer() != null && !endpoint.getReferer().isBlank()) {
            headers.put("Referer", endpoint.getReferer());
        }
        return headers;
    }

    String nextUserAgent() {
        int index = Math.floorMod(cursor.getAndIncrement(), userAgents.size());
        return ScraperProperties.normalizeUserAgent(userAgents.get(index));
    }
}
