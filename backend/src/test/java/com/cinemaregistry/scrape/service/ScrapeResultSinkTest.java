package com.cinemaregistry.scrape.service;

import com.cinemaregistry.scrape.model.FetchOutcome;
import com.cinemaregistry.scrape.model.ResultSnapshot;
import com.cinemaregistry.scrape.output.ResultPersister;
import com.cinemaregistry.scrape.util.ReasonCodeClassifier;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ScrapeResultSinkTest {
    private static final Instant AT = Instant.parse("2024-05-01T08:00:00Z");

    @Test
    void routesOutcomesByKind() {
        ScrapeResultSink sink = new ScrapeResultSink(Mockito.mock(ResultPersister.class));

        sink.append(new FetchOutcome.Success(1, Map.of("CinemaID", 1)));
        sink.append(new FetchOutcome.NotFound(2));
        sink.append(new FetchOutcome.Failure(3, "timeout: request timed out", AT));
        sink.append(new FetchOutcome.Failure(4, "http_status: 503", AT));
        sink.append(new FetchOutcome.Failure(5, "timeout", AT));

        ResultSnapshot snapshot = sink.snapshot();
        assertThat(snapshot.records()).containsExactly(Map.of("CinemaID", 1));
        assertThat(snapshot.errors()).extracting(FetchOutcome.Failure::identifier).containsExactly(3L, 4L, 5L);
        assertThat(snapshot.notFoundCount()).isEqualTo(1);
        assertThat(sink.failuresByReason())
            .containsEntry(ReasonCodeClassifier.TIMEOUT, 2)
            .containsEntry(ReasonCodeClassifier.HTTP_5XX, 1);
    }

    @Test
    void persistingKeepsCollectedResults() throws Exception {
        List<ResultSnapshot> persisted = new ArrayList<>();
        ScrapeResultSink sink = new ScrapeResultSink((snapshot, label) -> persisted.add(snapshot));
        sink.append(new FetchOutcome.Success(1, Map.of("CinemaID", 1)));

        assertThat(sink.snapshotAndPersist(AT)).isTrue();
        assertThat(sink.snapshotAndPersist(AT.plusSeconds(3600))).isTrue();

        assertThat(persisted).hasSize(2);
        assertThat(persisted.get(0)).isEqualTo(persisted.get(1));
        assertThat(sink.foundCount()).isEqualTo(1);
    }

    @Test
    void snapshotIsDetachedFromLaterAppends() {
        ScrapeResultSink sink = new ScrapeResultSink(Mockito.mock(ResultPersister.class));
        sink.append(new FetchOutcome.Success(1, Map.of("CinemaID", 1)));

        ResultSnapshot before = sink.snapshot();
        sink.append(new FetchOutcome.Success(2, Map.of("CinemaID", 2)));

        assertThat(before.records()).hasSize(1);
        assertThat(sink.snapshot().records()).hasSize(2);
    }

    @Test
    void concurrentPersistsNeverOverlap() throws Exception {
        AtomicInteger writing = new AtomicInteger();
        AtomicInteger maxWriting = new AtomicInteger();
        ScrapeResultSink sink = new ScrapeResultSink((snapshot, label) -> {
            maxWriting.accumulateAndGet(writing.incrementAndGet(), Math::max);
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                writing.decrementAndGet();
            }
        });
        sink.append(new FetchOutcome.Success(1, Map.of("CinemaID", 1)));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                results.add(pool.submit(() -> sink.snapshotAndPersist(AT)));
            }
            for (Future<Boolean> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxWriting.get()).isEqualTo(1);
    }

    @Test
    void persistFailureIsReportedNotThrown() throws Exception {
        ResultPersister persister = Mockito.mock(ResultPersister.class);
        doThrow(new IOException("disk full")).when(persister).persist(any(), any());
        ScrapeResultSink sink = new ScrapeResultSink(persister);
        sink.append(new FetchOutcome.Failure(9, "timeout", AT));

        assertThat(sink.snapshotAndPersist(AT)).isFalse();

        ArgumentCaptor<ResultSnapshot> captor = ArgumentCaptor.forClass(ResultSnapshot.class);
        verify(persister, times(1)).persist(captor.capture(), any());
        assertThat(captor.getValue().errors()).hasSize(1);
        assertThat(sink.failedCount()).isEqualTo(1);
    }
}
