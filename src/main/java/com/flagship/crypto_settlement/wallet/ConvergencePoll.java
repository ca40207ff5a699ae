package com.flagship.crypto_settlement.wallet;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Non-blocking bounded poll with exponential backoff.
 *
 * The probe is evaluated up to {@code maxAttempts} times. An empty probe
 * result means "not converged yet"; the next attempt is scheduled after the
 * current delay, which grows by {@code multiplier} each round. The returned
 * future completes with CONVERGED and the value, or EXHAUSTED once attempts
 * run out. It never completes exceptionally for a non-converging probe.
 */
@Slf4j
public final class ConvergencePoll {

    public enum Status {
        CONVERGED,
        EXHAUSTED
    }

    @Value
    public static class Outcome<T> {
        Status status;
        T value;
        int attempts;

        public boolean isConverged() {
            return status == Status.CONVERGED;
        }

        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }
    }

    private static final long MAX_DELAY_MS = 5_000;

    private ConvergencePoll() {
    }

    public static <T> CompletableFuture<Outcome<T>> poll(Supplier<Optional<T>> probe,
                                                        int maxAttempts,
                                                        long initialDelayMs,
                                                        double multiplier,
                                                        Executor executor) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelayMs < 0 || multiplier < 1.0) {
            throw new IllegalArgumentException("Delay must be non-negative and multiplier at least 1");
        }
        CompletableFuture<Outcome<T>> result = new CompletableFuture<>();
        attempt(probe, 1, maxAttempts, initialDelayMs, multiplier, executor, result);
        return result;
    }

    private static <T> void attempt(Supplier<Optional<T>> probe, int attempt, int maxAttempts,
                                    long delayMs, double multiplier, Executor executor,
                                    CompletableFuture<Outcome<T>> result) {
        Optional<T> value;
        try {
            value = probe.get();
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        if (value.isPresent()) {
            result.complete(new Outcome<>(Status.CONVERGED, value.get(), attempt));
            return;
        }
        if (attempt >= maxAttempts) {
            result.complete(new Outcome<>(Status.EXHAUSTED, null, attempt));
            return;
        }

        log.debug("Not converged after attempt {}/{}, retrying in {}ms", attempt, maxAttempts, delayMs);
        long nextDelay = Math.min(MAX_DELAY_MS, (long) (delayMs * multiplier));
        Executor delayed = CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, executor);
        delayed.execute(() -> attempt(probe, attempt + 1, maxAttempts, nextDelay, multiplier, executor, result));
    }
}
