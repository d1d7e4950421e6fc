package com.coderaptor.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxRetries;
    private final long initialBackoffMs;

    public RetryPolicy(int maxRetries, long initialBackoffMs) {
        if (maxRetries < 0 || initialBackoffMs < 0) {
            throw new ConfigException("retry settings must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.initialBackoffMs = initialBackoffMs;
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, 0);
    }

    public int maxRetries() {
        return maxRetries;
    }

    public long initialBackoffMs() {
        return initialBackoffMs;
    }

    /**
     * Runs {@code attempt} up to {@code maxRetries + 1} times. Failures of {@code failureType} are
     * retried with doubling backoff; unchecked exceptions propagate immediately.
     */
    public <T, E extends Exception> T run(String operation, Class<E> failureType, Attempt<T, E> attempt) throws E {
        int maxAttempts = maxRetries + 1;
        for (int attemptNumber = 1; ; attemptNumber++) {
            try {
                return attempt.get();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                E failure = failureType.cast(e);
                if (attemptNumber >= maxAttempts) {
                    throw failure;
                }
                long backoff = backoffFor(attemptNumber);
                log.warn("retry.attempt operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attemptNumber, maxAttempts, backoff, e.getMessage());
                if (!sleep(backoff)) {
                    throw failure;
                }
            }
        }
    }

    long backoffFor(int attemptNumber) {
        int shift = Math.min(attemptNumber - 1, 20);
        return initialBackoffMs << shift;
    }

    private static boolean sleep(long backoffMs) {
        if (backoffMs <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(backoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public interface Attempt<T, E extends Exception> {
        T get() throws E;
    }
}
