package com.phillippitts.aibakeoff.service.concurrency;

import com.phillippitts.aibakeoff.exception.BakeoffException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Bounds the number of in-flight units of work sharing a resource pool.
 *
 * <p>At most {@link #capacity()} callers hold a slot at any instant; further callers block
 * in {@link #acquire()} and are admitted in the order they arrived. Ordering is provided by a
 * fair {@link Semaphore}, which hands released permits to the longest-waiting thread.
 *
 * <p>Limiters nest: a task running under a scenario-wide limiter may acquire a narrower
 * limiter before calling a provider with a stricter per-account ceiling.
 *
 * <p>There is no acquire timeout and no cancellation. A task that never finishes keeps its
 * slot for the rest of the run.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. All shared state lives in the
 * underlying semaphore.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * ConcurrencyLimiter limiter = new ConcurrencyLimiter("tts", 20);
 * List<MeasurementRecord> records = limiter.run(() -> synthesizeAll(prompt));
 * }</pre>
 *
 * @since 1.0
 */
public final class ConcurrencyLimiter {

    private static final Logger LOG = LogManager.getLogger(ConcurrencyLimiter.class);

    private final String name;
    private final int capacity;
    private final Semaphore semaphore;

    /**
     * Constructs a limiter admitting at most {@code capacity} concurrent holders.
     *
     * @param name pool name for logs and error messages
     * @param capacity maximum number of concurrent slot holders (must be positive)
     * @throws IllegalArgumentException if capacity is not positive
     */
    public ConcurrencyLimiter(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity, true);
    }

    /**
     * Acquires a slot, blocking until one is free.
     *
     * <p>Callers that cannot be admitted immediately queue behind earlier callers.
     *
     * @throws BakeoffException if the thread is interrupted while waiting; the interrupt
     *         flag is restored
     */
    public void acquire() {
        if (LOG.isTraceEnabled() && semaphore.availablePermits() == 0) {
            LOG.trace("{} limiter saturated ({} active, {} queued)", name, activeCount(), queueLength());
        }
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BakeoffException(name + " limiter interrupted while waiting for a slot", e);
        }
    }

    /**
     * Releases a previously acquired slot, admitting the longest-waiting caller if any.
     *
     * <p>Must be called exactly once per successful {@link #acquire()}, normally from a
     * finally block.
     */
    public void release() {
        semaphore.release();
    }

    /**
     * Runs {@code task} while holding a slot.
     *
     * <p>The slot is released whether the task returns or throws, so a failing task never
     * starves the pool.
     *
     * @param task work to run
     * @param <T> result type
     * @return the task's result
     */
    public <T> T run(Supplier<T> task) {
        Objects.requireNonNull(task, "task");
        acquire();
        try {
            return task.get();
        } finally {
            release();
        }
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Returns the number of slots currently held.
     */
    public int activeCount() {
        return capacity - semaphore.availablePermits();
    }

    /**
     * Returns an estimate of the number of threads waiting for a slot.
     */
    public int queueLength() {
        return semaphore.getQueueLength();
    }
}
