package com.cinemaregistry.scrape.http;

import com.cinemaregistry.config.ScraperProperties;
import com.cinemaregistry.scrape.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ExecutorService;

/**
 * Single-attempt transport for the lookup endpoint. Every failure mode comes
 * back as an {@link HttpFetchResult} with an error code; retry and pacing are
 * the caller's concern.
 */
@Service
public class LookupHttpClient {
    private final ScraperProperties.Endpoint endpoint;
    private final HttpClient client;
    private final RequestHeaderProvider headerProvider;

    public LookupHttpClient(
        ScraperProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        RequestHeaderProvider headerProvider
    ) {
        this.endpoint = properties.getEndpoint();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(endpoint.getConnectTimeoutMs()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.headerProvider = headerProvider;
    }

    public HttpFetchResult postForm(String url, Map<String, String> form) {
        Instant startedAt = Instant.now();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
        if (uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host");
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofMillis(endpoint.getRequestTimeoutMs()))
            .header("Content-Type", "application/x-www-form-urlencoded");
        headerProvider.nextHeaders().forEach(builder::header);
        HttpRequest request = builder
            .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form), StandardCharsets.UTF_8))
            .build();

        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new HttpFetchResult(
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpConnectTimeoutException e) {
            return errorResult(url, startedAt, "connect_timeout", e.getMessage());
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", describe(e));
        }
    }

    static String encodeForm(Map<String, String> form) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : form.entrySet()) {
            String value = entry.getValue() == null ? "" : entry.getValue();
            joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "="
                + URLEncoder.encode(value, StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
