package com.coderaptor.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    @Test
    void shouldDoubleBackoffPerAttempt() {
        RetryPolicy policy = new RetryPolicy(3, 100);

        assertEquals(100, policy.backoffFor(1));
        assertEquals(200, policy.backoffFor(2));
        assertEquals(400, policy.backoffFor(3));
    }

    @Test
    void shouldStopAfterConfiguredRetries() {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(2, 0);

        assertThrows(IOException.class, () -> policy.run("read", IOException.class, () -> {
            attempts.incrementAndGet();
            throw new IOException("unavailable");
        }));
        assertEquals(3, attempts.get());
    }

    @Test
    void shouldNotRetryUncheckedFailures() {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(5, 0);

        assertThrows(IllegalStateException.class, () -> policy.<String, IOException>run("bug", IOException.class, () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bug");
        }));
        assertEquals(1, attempts.get());
    }

    @Test
    void shouldReturnFirstSuccessAfterRetries() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(3, 0);

        String result = policy.run("flaky", IOException.class, () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("not yet");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void shouldRejectNegativeSettings() {
        assertThrows(ConfigException.class, () -> new RetryPolicy(-1, 0));
    }
}
