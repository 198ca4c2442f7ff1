package com.zzf.toolhost.mcp.retry;

import com.zzf.toolhost.mcp.isolation.FailureCategory;
import com.zzf.toolhost.mcp.isolation.FailureClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * 重试管理 (退避重试, 仅针对瞬时错误).
 */
@Slf4j
public class RetryManager {

    private final RetryPolicy defaultPolicy;
    private final Predicate<String> circuitOpen;
    private final Sleeper sleeper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Counters aggregate = new Counters();
    private final Map<String, Counters> perServer = new ConcurrentHashMap<>();

    /**
     * @param circuitOpen reports whether a server's breaker is currently OPEN
     */
    public RetryManager(RetryPolicy defaultPolicy, Predicate<String> circuitOpen, Sleeper sleeper,
                        Clock clock, MeterRegistry meterRegistry) {
        this.defaultPolicy = defaultPolicy;
        this.circuitOpen = circuitOpen;
        this.sleeper = sleeper;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public <T> T execute(String serverId, Callable<T> action) throws Exception {
        return execute(serverId, action, defaultPolicy);
    }

    /**
     * Runs {@code action}, retrying transient failures with backoff. Protocol and fatal
     * failures, and any failure while the server's breaker is OPEN, propagate at once.
     */
    public <T> T execute(String serverId, Callable<T> action, RetryPolicy policy) throws Exception {
        int maxAttempts = Math.max(1, policy.getMaxAttempts());
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                T result = action.call();
                record(serverId, attempt, true);
                return result;
            } catch (Exception e) {
                FailureCategory category = FailureClassifier.classify(e);
                boolean open = circuitOpen.test(serverId);
                if (!category.isRetryable() || open || attempt >= maxAttempts) {
                    if (attempt > 1 || category.isRetryable()) {
                        log.warn("retry.give_up id={} attempts={} category={} circuitOpen={} err={}",
                                serverId, attempt, category, open, e.toString());
                    }
                    record(serverId, attempt, false);
                    throw e;
                }
                Duration delay = calculateBackoff(attempt, policy);
                log.info("retry.attempt id={} attempt={}/{} delayMs={} err={}",
                        serverId, attempt, maxAttempts, delay.toMillis(), e.toString());
                meterRegistry.counter("toolhost.retry.attempts", "server", serverId).increment();
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    record(serverId, attempt, false);
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }

    /**
     * Delay before the attempt following {@code attempt} (1-based).
     */
    public Duration calculateBackoff(int attempt, RetryPolicy policy) {
        long base = policy.getBaseDelay().toMillis();
        int n = Math.max(1, attempt);
        double raw;
        switch (policy.getStrategy()) {
            case FIXED:
                raw = base;
                break;
            case LINEAR:
                raw = base * (double) n;
                break;
            case EXPONENTIAL:
            case EXPONENTIAL_JITTER:
            default:
                raw = base * Math.pow(policy.getMultiplier(), n - 1);
                break;
        }
        raw = Math.min(raw, policy.getMaxDelay().toMillis());
        if (policy.getStrategy() == BackoffStrategy.EXPONENTIAL_JITTER && policy.getJitter() > 0) {
            double spread = raw * policy.getJitter();
            if (spread > 0) {
                raw = raw + ThreadLocalRandom.current().nextDouble(-spread, spread);
            }
            raw = Math.max(raw, policy.getMinDelay().toMillis());
        }
        return Duration.ofMillis(Math.round(raw));
    }

    public RetryStats getStats() {
        return aggregate.snapshot();
    }

    public RetryStats getStats(String serverId) {
        Counters counters = perServer.get(serverId);
        return counters == null ? RetryStats.empty() : counters.snapshot();
    }

    public Map<String, RetryStats> getAllStats() {
        Map<String, RetryStats> out = new ConcurrentHashMap<>();
        perServer.forEach((id, counters) -> out.put(id, counters.snapshot()));
        return out;
    }

    public void resetStats(String serverId) {
        perServer.remove(serverId);
    }

    private void record(String serverId, int attempts, boolean success) {
        Instant now = attempts > 1 ? clock.instant() : null;
        aggregate.add(attempts, success, now);
        if (serverId != null) {
            perServer.computeIfAbsent(serverId, k -> new Counters()).add(attempts, success, now);
        }
    }

    private static final class Counters {
        private long totalCalls;
        private long totalAttempts;
        private long successfulCalls;
        private long failedCalls;
        private long retriedCalls;
        private Instant lastRetry;

        synchronized void add(int attempts, boolean success, Instant retryTime) {
            totalCalls++;
            totalAttempts += attempts;
            if (success) {
                successfulCalls++;
            } else {
                failedCalls++;
            }
            if (attempts > 1) {
                retriedCalls++;
                lastRetry = retryTime;
            }
        }

        synchronized RetryStats snapshot() {
            return RetryStats.builder()
                    .totalCalls(totalCalls)
                    .totalAttempts(totalAttempts)
                    .successfulCalls(successfulCalls)
                    .failedCalls(failedCalls)
                    .retriedCalls(retriedCalls)
                    .lastRetry(lastRetry)
                    .build();
        }
    }
}
