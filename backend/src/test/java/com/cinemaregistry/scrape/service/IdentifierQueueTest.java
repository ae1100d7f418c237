package com.cinemaregistry.scrape.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierQueueTest {

    @Test
    void handsOutEveryIdentifierExactlyOnceAcrossThreads() throws Exception {
        IdentifierQueue queue = new IdentifierQueue();
        queue.seed(1, 5000);
        List<Long> taken = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    OptionalLong next;
                    while ((next = queue.tryPoll()).isPresent()) {
                        taken.add(next.getAsLong());
                        queue.markDone();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(taken).hasSize(5000).doesNotHaveDuplicates();
        assertThat(taken).allSatisfy(id -> assertThat(id).isBetween(1L, 5000L));
        assertThat(queue.doneCount()).isEqualTo(5000);
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    void pollsInSeedOrderAndEndsEmpty() {
        IdentifierQueue queue = new IdentifierQueue();
        queue.seed(7, 8);

        assertThat(queue.tryPoll()).hasValue(7);
        assertThat(queue.tryPoll()).hasValue(8);
        assertThat(queue.tryPoll()).isEmpty();
        assertThat(queue.seededCount()).isEqualTo(2);
    }

    @Test
    void seedingUpToLargestIdentifierTerminates() {
        IdentifierQueue queue = new IdentifierQueue();
        queue.seed(Long.MAX_VALUE - 2, Long.MAX_VALUE);

        assertThat(queue.seededCount()).isEqualTo(3);
        assertThat(queue.tryPoll()).hasValue(Long.MAX_VALUE - 2);
        assertThat(queue.drain()).isEqualTo(2);
    }

    @Test
    void drainDropsRemainingIdentifiers() {
        IdentifierQueue queue = new IdentifierQueue();
        queue.seed(1, 10);
        queue.tryPoll();

        assertThat(queue.drain()).isEqualTo(9);
        assertThat(queue.drain()).isZero();
        assertThat(queue.drainedCount()).isEqualTo(9);
        assertThat(queue.tryPoll()).isEmpty();
    }
}
