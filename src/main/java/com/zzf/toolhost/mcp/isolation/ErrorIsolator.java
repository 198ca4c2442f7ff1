package com.zzf.toolhost.mcp.isolation;

import com.zzf.toolhost.mcp.error.QuarantinedServerException;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetricsPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 错误隔离: 熔断器 + 隔离 (quarantine).
 * <p>
 * The breaker recovers on its own. Quarantine is sticky and only
 * {@link #clearQuarantine(String)} lifts it. Outcomes of calls that started before
 * {@link #reset(String)} are dropped so a re-registered id starts clean.
 */
@Slf4j
public class ErrorIsolator {

    private final IsolationSettings settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final TaggedCircuitBreakerMetricsPublisher breakerMetrics;
    private final Map<String, ServerRecord> records = new ConcurrentHashMap<>();
    private final List<IsolationListener> listeners = new CopyOnWriteArrayList<>();

    public ErrorIsolator(IsolationSettings settings, Clock clock, MeterRegistry meterRegistry) {
        settings.validate();
        this.settings = settings;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.breakerMetrics = new TaggedCircuitBreakerMetricsPublisher(meterRegistry);
    }

    public void addListener(IsolationListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    /**
     * Runs {@code action} under the breaker. Rejected calls never reach the provider.
     *
     * @throws QuarantinedServerException if the server is quarantined
     * @throws com.zzf.toolhost.mcp.error.CircuitOpenException if the breaker rejects the call
     */
    public <T> T call(String serverId, Callable<T> action) throws Exception {
        ServerRecord record = record(serverId);
        String reason = record.quarantineReason();
        if (reason != null) {
            throw new QuarantinedServerException(serverId, reason);
        }
        record.breaker.acquire();
        T result;
        try {
            result = action.call();
        } catch (Exception e) {
            if (isCurrent(serverId, record)) {
                recordFailure(serverId, record, e);
            }
            throw e;
        }
        if (isCurrent(serverId, record)) {
            recordSuccess(record);
        }
        return result;
    }

    public void recordSuccess(String serverId) {
        recordSuccess(record(serverId));
    }

    public void recordFailure(String serverId, Throwable error) {
        recordFailure(serverId, record(serverId), error);
    }

    public boolean isQuarantined(String serverId) {
        ServerRecord record = records.get(serverId);
        return record != null && record.quarantineReason() != null;
    }

    public String getQuarantineReason(String serverId) {
        ServerRecord record = records.get(serverId);
        return record == null ? null : record.quarantineReason();
    }

    /**
     * Manual quarantine, e.g. by an operator.
     */
    public void quarantine(String serverId, String reason) {
        quarantine(serverId, record(serverId), reason);
    }

    private void quarantine(String serverId, ServerRecord record, String reason) {
        boolean newly;
        synchronized (record) {
            newly = record.quarantineReason == null;
            if (newly) {
                record.quarantineReason = reason == null || reason.isBlank() ? "manual" : reason;
                record.quarantinedAt = clock.instant();
                record.quarantineCount++;
            }
        }
        if (newly) {
            log.warn("isolation.quarantine id={} reason={}", serverId, record.quarantineReason());
            meterRegistry.counter("toolhost.isolation.quarantined", "server", serverId).increment();
            for (IsolationListener listener : listeners) {
                listener.onQuarantined(serverId, record.quarantineReason());
            }
        }
    }

    /**
     * Explicit operator action. Also resets the breaker and the consecutive error count.
     *
     * @return {@code true} if the server was quarantined
     */
    public boolean clearQuarantine(String serverId) {
        ServerRecord record = records.get(serverId);
        if (record == null) {
            return false;
        }
        boolean cleared;
        synchronized (record) {
            cleared = record.quarantineReason != null;
            record.quarantineReason = null;
            record.quarantinedAt = null;
            record.consecutiveErrors = 0;
        }
        record.breaker.reset();
        if (cleared) {
            log.info("isolation.quarantine_cleared id={}", serverId);
            for (IsolationListener listener : listeners) {
                listener.onQuarantineCleared(serverId);
            }
        }
        return cleared;
    }

    public CircuitState getCircuitState(String serverId) {
        ServerRecord record = records.get(serverId);
        return record == null ? CircuitState.CLOSED : record.breaker.getState();
    }

    public boolean isCircuitOpen(String serverId) {
        return getCircuitState(serverId) == CircuitState.OPEN;
    }

    public void forceOpen(String serverId) {
        record(serverId).breaker.forceOpen();
    }

    public void forceClose(String serverId) {
        record(serverId).breaker.reset();
    }

    /**
     * Forgets all bookkeeping for a server, including quarantine.
     */
    public void reset(String serverId) {
        ServerRecord removed = records.remove(serverId);
        if (removed != null) {
            breakerMetrics.removeMetrics(removed.breaker.delegate());
        }
    }

    public ErrorStats getErrorStats(String serverId) {
        ServerRecord record = records.get(serverId);
        if (record == null) {
            return ErrorStats.empty(serverId);
        }
        synchronized (record) {
            return ErrorStats.builder()
                    .serverId(serverId)
                    .totalErrors(record.totalErrors)
                    .consecutiveErrors(record.consecutiveErrors)
                    .errorsByCategory(Map.copyOf(record.byCategory))
                    .lastError(record.lastError)
                    .lastErrorTime(record.lastErrorTime)
                    .quarantined(record.quarantineReason != null)
                    .quarantineCount(record.quarantineCount)
                    .quarantinedAt(record.quarantinedAt)
                    .quarantineReason(record.quarantineReason)
                    .circuitState(record.breaker.getState())
                    .build();
        }
    }

    public IsolationSettings getSettings() {
        return settings;
    }

    private void recordSuccess(ServerRecord record) {
        synchronized (record) {
            record.consecutiveErrors = 0;
        }
        record.breaker.onSuccess();
    }

    private void recordFailure(String serverId, ServerRecord record, Throwable error) {
        FailureCategory category = FailureClassifier.classify(error);
        record.breaker.onFailure(error);
        if (!category.isCounted()) {
            return;
        }
        String quarantineReason = null;
        synchronized (record) {
            record.totalErrors++;
            record.consecutiveErrors++;
            record.byCategory.merge(category, 1L, Long::sum);
            record.lastError = describe(error);
            record.lastErrorTime = clock.instant();
            if (category == FailureCategory.FATAL) {
                quarantineReason = "fatal error: " + record.lastError;
            } else if (record.consecutiveErrors >= settings.getQuarantineThreshold()) {
                quarantineReason = record.consecutiveErrors + " consecutive failures, last: " + record.lastError;
            }
        }
        log.warn("isolation.failure id={} category={} err={}", serverId, category, describe(error));
        if (quarantineReason != null) {
            quarantine(serverId, record, quarantineReason);
        }
    }

    private boolean isCurrent(String serverId, ServerRecord record) {
        if (records.get(serverId) == record) {
            return true;
        }
        log.debug("isolation.stale_outcome id={}", serverId);
        return false;
    }

    private void notifyCircuit(String serverId, CircuitState from, CircuitState to) {
        if (from == to) {
            return;
        }
        if (to == CircuitState.OPEN) {
            meterRegistry.counter("toolhost.circuit.opened", "server", serverId).increment();
        }
        for (IsolationListener listener : listeners) {
            listener.onCircuitStateChange(serverId, from, to);
        }
    }

    private ServerRecord record(String serverId) {
        if (serverId == null) {
            throw new IllegalArgumentException("serverId is null");
        }
        ServerRecord existing = records.get(serverId);
        if (existing != null) {
            return existing;
        }
        ServerRecord created = new ServerRecord(new ServerBreaker(serverId, settings, clock,
                (from, to) -> notifyCircuit(serverId, from, to)));
        ServerRecord raced = records.putIfAbsent(serverId, created);
        if (raced != null) {
            return raced;
        }
        breakerMetrics.publishMetrics(created.breaker.delegate());
        return created;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String msg = error.getMessage();
        return msg == null || msg.isBlank() ? error.getClass().getSimpleName() : error.getClass().getSimpleName() + ": " + msg;
    }

    private static final class ServerRecord {
        private final ServerBreaker breaker;
        private final Map<FailureCategory, Long> byCategory = new EnumMap<>(FailureCategory.class);
        private long totalErrors;
        private int consecutiveErrors;
        private String lastError;
        private Instant lastErrorTime;
        private String quarantineReason;
        private Instant quarantinedAt;
        private int quarantineCount;

        private ServerRecord(ServerBreaker breaker) {
            this.breaker = breaker;
        }

        private synchronized String quarantineReason() {
            return quarantineReason;
        }
    }
}
