package com.cinemaregistry.scrape.service;

import com.cinemaregistry.config.ScraperProperties;
import com.cinemaregistry.scrape.http.LookupHttpClient;
import com.cinemaregistry.scrape.http.RequestHeaderProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class CinemaLookupClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private CinemaLookupClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        ScraperProperties properties = new ScraperProperties();
        properties.getEndpoint().setUrl(server.url("/enlib-api/api/cinema/getcinema_baseinfo_byid.do").toString());
        executor = Executors.newFixedThreadPool(2);
        LookupHttpClient httpClient = new LookupHttpClient(properties, executor, new RequestHeaderProvider(properties));
        client = new CinemaLookupClient(properties, httpClient, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void returnsFirstRowAndSendsIdentifierWithCacheBuster() throws Exception {
        server.enqueue(json("{\"status\":1,\"data\":{\"table0\":["
            + "{\"CinemaID\":1,\"CinemaName\":\"A\",\"ZZID\":\"44010001\"},"
            + "{\"CinemaID\":99,\"CinemaName\":\"ignored\"}]}}"));

        CinemaLookupClient.LookupAttempt attempt = client.lookup(1L);

        assertThat(attempt.kind()).isEqualTo(CinemaLookupClient.AttemptKind.FOUND);
        assertThat(attempt.row()).containsEntry("CinemaID", 1).containsEntry("CinemaName", "A").containsEntry("ZZID", "44010001");
        assertThat(attempt.row().keySet()).containsExactly("CinemaID", "CinemaName", "ZZID");

        RecordedRequest request = server.takeRequest();
        String body = request.getBody().readUtf8();
        assertThat(body).startsWith("r=").endsWith("&cinemaid=1");
    }

    @Test
    void cacheBusterChangesBetweenRequests() throws Exception {
        server.enqueue(json("{\"status\":0}"));
        server.enqueue(json("{\"status\":0}"));

        client.lookup(5L);
        client.lookup(5L);

        assertThat(server.takeRequest().getBody().readUtf8())
            .isNotEqualTo(server.takeRequest().getBody().readUtf8());
    }

    @Test
    void statusOtherThanOneIsNotFound() {
        server.enqueue(json("{\"status\":0,\"data\":{\"table0\":[{\"CinemaID\":3}]}}"));

        assertThat(client.lookup(3L).kind()).isEqualTo(CinemaLookupClient.AttemptKind.NOT_FOUND);
    }

    @Test
    void statusMustBeTheNumberOne() {
        assertThat(client.parse("{\"status\":\"1\",\"data\":{\"table0\":[{\"CinemaID\":3}]}}").kind())
            .isEqualTo(CinemaLookupClient.AttemptKind.NOT_FOUND);
        assertThat(client.parse("{\"status\":true,\"data\":{\"table0\":[{\"CinemaID\":3}]}}").kind())
            .isEqualTo(CinemaLookupClient.AttemptKind.NOT_FOUND);
        assertThat(client.parse("{\"status\":1,\"data\":{\"table0\":[{\"CinemaID\":3}]}}").kind())
            .isEqualTo(CinemaLookupClient.AttemptKind.FOUND);
    }

    @Test
    void emptyTableIsNotFound() {
        server.enqueue(json("{\"status\":1,\"data\":{\"table0\":[]}}"));

        CinemaLookupClient.LookupAttempt attempt = client.lookup(4L);

        assertThat(attempt.kind()).isEqualTo(CinemaLookupClient.AttemptKind.NOT_FOUND);
        assertThat(attempt.reachedEndpoint()).isTrue();
    }

    @Test
    void serverErrorIsTransportFailure() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

        CinemaLookupClient.LookupAttempt attempt = client.lookup(6L);

        assertThat(attempt.kind()).isEqualTo(CinemaLookupClient.AttemptKind.TRANSPORT_FAILURE);
        assertThat(attempt.errorMessage()).isEqualTo("http_status: 500");
        assertThat(attempt.reachedEndpoint()).isFalse();
    }

    @Test
    void malformedBodyIsParseFailure() {
        server.enqueue(json("<html>maintenance</html>"));

        CinemaLookupClient.LookupAttempt attempt = client.lookup(7L);

        assertThat(attempt.kind()).isEqualTo(CinemaLookupClient.AttemptKind.PARSE_FAILURE);
        assertThat(attempt.errorMessage()).startsWith("PARSING_FAILED");
    }

    @Test
    void missingDataIsNotFound() {
        assertThat(client.parse("{\"status\":1}").kind()).isEqualTo(CinemaLookupClient.AttemptKind.NOT_FOUND);
        assertThat(client.parse("{\"status\":1,\"data\":{\"table0\":[{}]}}").kind())
            .isEqualTo(CinemaLookupClient.AttemptKind.NOT_FOUND);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
