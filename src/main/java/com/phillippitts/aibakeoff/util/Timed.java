package com.phillippitts.aibakeoff.util;

import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Result of an operation paired with the wall-clock time it took.
 *
 * <p>Only successful operations produce a {@code Timed}; an exception thrown by the
 * operation propagates unchanged and no duration is reported.
 *
 * @param elapsedMs elapsed milliseconds, never negative
 * @param value the operation's result
 * @param <T> result type
 */
public record Timed<T>(double elapsedMs, T value) {

    public Timed {
        if (elapsedMs < 0.0) {
            throw new IllegalArgumentException("elapsedMs must be non-negative");
        }
    }

    /**
     * Runs {@code operation} and measures it with {@link System#nanoTime()}.
     */
    public static <T> Timed<T> measure(Supplier<T> operation) {
        return measure(System::nanoTime, operation);
    }

    /**
     * Runs {@code operation} and measures it with the given nanosecond ticker.
     *
     * @param ticker monotonic nanosecond source
     * @param operation work to time
     * @return the result and its elapsed time
     */
    public static <T> Timed<T> measure(LongSupplier ticker, Supplier<T> operation) {
        Objects.requireNonNull(ticker, "ticker");
        Objects.requireNonNull(operation, "operation");
        long start = ticker.getAsLong();
        T value = operation.get();
        long elapsed = ticker.getAsLong() - start;
        return new Timed<>(TimeUtils.nanosToMillis(Math.max(0L, elapsed)), value);
    }
}
