package org.carball.sift.storage;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for calls that cross into a backend.
 * The first retry waits {@code initialBackoffMs}; each later one waits
 * {@code multiplier} times longer than the one before.
 */
@Value
@Builder(toBuilder = true)
@Slf4j
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    long initialBackoffMs = 100;

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    Sleeper sleeper = Thread::sleep;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy none() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    /**
     * Runs {@code action}, retrying when it throws an instance of {@code retryOn}. Once the
     * attempts are used up the last failure is rethrown; any other exception propagates
     * immediately.
     */
    public <T> T execute(String description, Class<? extends RuntimeException> retryOn, Supplier<T> action) {
        int attempts = Math.max(1, maxAttempts);
        long backoff = initialBackoffMs;

        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!retryOn.isInstance(e) || attempt >= attempts) {
                    throw e;
                }
                log.warn("{} failed, retrying in {}ms (attempt {}/{}): {}",
                        description, backoff, attempt, attempts, e.getMessage());
                pause(backoff, e);
                backoff = (long) (backoff * multiplier);
            }
        }
    }

    private void pause(long millis, RuntimeException failure) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            failure.addSuppressed(ie);
            throw failure;
        }
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
