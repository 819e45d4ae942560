package com.phillippitts.aibakeoff.service.concurrency;

import com.phillippitts.aibakeoff.exception.BakeoffException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ConcurrencyLimiterTest {

    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new ConcurrencyLimiter("bad", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void neverExceedsCapacity() throws Exception {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("test", 3);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(pool.submit(() -> limiter.run(() -> {
                peak.accumulateAndGet(active.incrementAndGet(), Math::max);
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                active.decrementAndGet();
                return null;
            })));
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> limiter.activeCount() == 3 && limiter.queueLength() == 5);
        assertThat(active.get()).isEqualTo(3);

        release.countDown();
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        assertThat(peak.get()).isEqualTo(3);
        assertThat(limiter.activeCount()).isZero();
    }

    @Test
    void admitsWaitersInArrivalOrder() throws Exception {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("fifo", 1);
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());

        limiter.acquire();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            int id = i;
            futures.add(pool.submit(() -> limiter.run(() -> order.add(id))));
            // Wait until this caller is queued before starting the next one
            int expectedQueue = i + 1;
            await().atMost(Duration.ofSeconds(5)).until(() -> limiter.queueLength() == expectedQueue);
        }
        limiter.release();

        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        assertThat(order).containsExactly(0, 1, 2, 3);
    }

    @Test
    void releasesSlotWhenTaskThrows() {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("throwing", 1);

        assertThatThrownBy(() -> limiter.run(() -> {
            throw new IllegalStateException("provider down");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(limiter.activeCount()).isZero();
        assertThat(limiter.run(() -> "next")).isEqualTo("next");
    }

    @Test
    void nestedLimitersBoundIndependently() throws Exception {
        ConcurrencyLimiter outer = new ConcurrencyLimiter("outer", 4);
        ConcurrencyLimiter inner = new ConcurrencyLimiter("inner", 2);
        AtomicInteger innerActive = new AtomicInteger();
        AtomicInteger innerPeak = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(pool.submit(() -> outer.run(() -> inner.run(() -> {
                innerPeak.accumulateAndGet(innerActive.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                innerActive.decrementAndGet();
                return null;
            }))));
        }
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }

        assertThat(innerPeak.get()).isLessThanOrEqualTo(2);
        assertThat(outer.activeCount()).isZero();
        assertThat(inner.activeCount()).isZero();
    }

    @Test
    void interruptedWaitSurfacesAsBakeoffException() throws Exception {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("interrupt", 1);
        limiter.acquire();
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean flagRestored = new AtomicBoolean();

        Thread waiter = new Thread(() -> {
            try {
                limiter.acquire();
            } catch (BakeoffException e) {
                thrown.set(e);
                flagRestored.set(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> limiter.queueLength() == 1);
        waiter.interrupt();
        waiter.join(5000);

        assertThat(thrown.get()).isInstanceOf(BakeoffException.class)
                .hasMessageContaining("interrupt limiter interrupted");
        assertThat(flagRestored).isTrue();
        assertThat(limiter.activeCount()).isEqualTo(1);
        limiter.release();
    }
}
