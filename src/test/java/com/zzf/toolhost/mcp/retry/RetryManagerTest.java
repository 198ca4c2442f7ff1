package com.zzf.toolhost.mcp.retry;

import com.zzf.toolhost.mcp.error.ProviderConnectionException;
import com.zzf.toolhost.mcp.error.ProviderFatalException;
import com.zzf.toolhost.mcp.error.ProviderProtocolException;
import com.zzf.toolhost.mcp.error.ProviderTimeoutException;
import com.zzf.toolhost.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryManagerTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final AtomicBoolean circuitOpen = new AtomicBoolean(false);
    private final RetryPolicy policy = RetryPolicy.builder()
            .strategy(BackoffStrategy.EXPONENTIAL)
            .baseDelay(Duration.ofMillis(100))
            .build();
    private final RetryManager retry = new RetryManager(policy, id -> circuitOpen.get(), sleeps::add,
            new MutableClock(), new SimpleMeterRegistry());

    @Test
    void shouldRetryTransientFailuresUntilSuccess() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        String result = retry.execute("fs", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new ProviderTimeoutException("fs", "call", Duration.ofSeconds(1));
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(3, attempts.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);

        RetryStats stats = retry.getStats("fs");
        assertEquals(1, stats.getTotalCalls());
        assertEquals(3, stats.getTotalAttempts());
        assertEquals(1, stats.getRetriedCalls());
        assertEquals(3.0, stats.getAverageAttempts());
        assertNotNull(stats.getLastRetry());
    }

    @Test
    void shouldNotRetryProtocolOrFatal() {
        AtomicInteger attempts = new AtomicInteger();
        assertThrows(ProviderProtocolException.class, () -> retry.execute("fs", () -> {
            attempts.incrementAndGet();
            throw new ProviderProtocolException("fs", "bad frame");
        }));
        assertThrows(ProviderFatalException.class, () -> retry.execute("fs", () -> {
            attempts.incrementAndGet();
            throw new ProviderFatalException("fs", "revoked");
        }));
        assertEquals(2, attempts.get());
        assertTrue(sleeps.isEmpty());
        assertEquals(2, retry.getStats("fs").getFailedCalls());
    }

    @Test
    void shouldNotRetryWhileCircuitOpen() {
        circuitOpen.set(true);
        AtomicInteger attempts = new AtomicInteger();
        assertThrows(ProviderConnectionException.class, () -> retry.execute("fs", () -> {
            attempts.incrementAndGet();
            throw new ProviderConnectionException("fs", "refused");
        }));
        assertEquals(1, attempts.get());
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        assertThrows(ProviderConnectionException.class, () -> retry.execute("fs", () -> {
            attempts.incrementAndGet();
            throw new ProviderConnectionException("fs", "refused");
        }));
        assertEquals(3, attempts.get());
        assertEquals(1, retry.getStats().getFailedCalls());
    }

    @Test
    void shouldComputeBackoffPerStrategy() {
        RetryPolicy base = RetryPolicy.builder()
                .baseDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(5))
                .build();

        RetryPolicy fixed = base.toBuilder().strategy(BackoffStrategy.FIXED).build();
        RetryPolicy linear = base.toBuilder().strategy(BackoffStrategy.LINEAR).build();
        RetryPolicy exponential = base.toBuilder().strategy(BackoffStrategy.EXPONENTIAL).build();

        assertEquals(Duration.ofSeconds(1), retry.calculateBackoff(3, fixed));
        assertEquals(Duration.ofSeconds(3), retry.calculateBackoff(3, linear));
        assertEquals(Duration.ofSeconds(4), retry.calculateBackoff(3, exponential));
        assertEquals(Duration.ofSeconds(5), retry.calculateBackoff(10, exponential));
    }

    @Test
    void shouldKeepJitterWithinBoundsAndFloor() {
        RetryPolicy jittered = RetryPolicy.builder()
                .strategy(BackoffStrategy.EXPONENTIAL_JITTER)
                .baseDelay(Duration.ofSeconds(2))
                .build();
        for (int i = 0; i < 200; i++) {
            long ms = retry.calculateBackoff(1, jittered).toMillis();
            assertTrue(ms >= 1500 && ms <= 2500, "delay out of range: " + ms);
        }

        RetryPolicy tiny = jittered.toBuilder().baseDelay(Duration.ofMillis(10)).build();
        assertEquals(100, retry.calculateBackoff(1, tiny).toMillis());
    }

    @Test
    void shouldMapStrategyNames() {
        assertEquals(BackoffStrategy.EXPONENTIAL_JITTER, BackoffStrategy.fromString(null));
        assertEquals(BackoffStrategy.LINEAR, BackoffStrategy.fromString("linear"));
        assertEquals(BackoffStrategy.EXPONENTIAL, BackoffStrategy.fromString("bogus"));
    }
}
