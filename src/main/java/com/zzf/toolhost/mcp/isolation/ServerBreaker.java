package com.zzf.toolhost.mcp.isolation;

import com.zzf.toolhost.mcp.error.CircuitOpenException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.internal.CircuitBreakerStateMachine;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * 单个服务器的熔断器, 基于 resilience4j.
 * <p>
 * CLOSED opens after K consecutive failures or M failures in the last W outcomes. OPEN rejects
 * until the cooldown elapses, then HALF_OPEN admits exactly one trial call. A failed trial call
 * reopens the breaker with the cooldown multiplied, capped. Only TRANSIENT and PROTOCOL failures are
 * recorded; anything else releases its permit without an outcome.
 */
@Slf4j
public class ServerBreaker {

    private final String serverId;
    private final IsolationSettings settings;
    private final Clock clock;
    private final CircuitBreaker delegate;
    private final BiConsumer<CircuitState, CircuitState> transitions;

    private int consecutiveFailures;
    private volatile Instant openedAt;
    private volatile int openAttempts;

    public ServerBreaker(String serverId, IsolationSettings settings, Clock clock,
                         BiConsumer<CircuitState, CircuitState> transitions) {
        this.serverId = serverId;
        this.settings = settings;
        this.clock = clock;
        this.transitions = transitions == null ? (from, to) -> { } : transitions;
        this.delegate = new CircuitBreakerStateMachine(serverId, configFor(settings), clock);
        delegate.getEventPublisher().onStateTransition(event -> onTransition(
                event.getStateTransition().getFromState(), event.getStateTransition().getToState()));
    }

    static CircuitBreakerConfig configFor(IsolationSettings settings) {
        IntervalFunction cooldowns = attempt -> cooldownFor(settings, attempt).toMillis();
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getWindowSize())
                .minimumNumberOfCalls(settings.getWindowSize())
                .failureRateThreshold(100f * settings.getWindowFailureThreshold() / settings.getWindowSize())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .waitIntervalFunctionInOpenState(cooldowns)
                .recordException(ServerBreaker::isRecorded)
                .ignoreException(e -> !isRecorded(e))
                .build();
    }

    /**
     * Cooldown for the {@code attempt}-th consecutive opening (1-based).
     */
    static Duration cooldownFor(IsolationSettings settings, int attempt) {
        double raw = settings.getOpenCooldown().toMillis()
                * Math.pow(settings.getCooldownMultiplier(), Math.max(0, attempt - 1));
        long capped = (long) Math.min(raw, settings.getMaxOpenCooldown().toMillis());
        return Duration.ofMillis(capped);
    }

    static boolean isRecorded(Throwable error) {
        FailureCategory category = FailureClassifier.classify(error);
        return category == FailureCategory.TRANSIENT || category == FailureCategory.PROTOCOL;
    }

    /**
     * Admits a call or throws {@link CircuitOpenException}.
     *
     * @return {@code true} when the admitted call is the half-open trial call
     */
    public boolean acquire() {
        if (delegate.tryAcquirePermission()) {
            boolean trial = delegate.getState() == CircuitBreaker.State.HALF_OPEN;
            if (trial) {
                log.info("circuit.trial_call id={}", serverId);
            }
            return trial;
        }
        if (delegate.getState() == CircuitBreaker.State.HALF_OPEN) {
            throw new CircuitOpenException(serverId, "circuit breaker for server " + serverId
                    + " is half-open and its trial call is still in flight");
        }
        throw new CircuitOpenException(serverId, remainingCooldownMs());
    }

    /**
     * Gives a permit back without recording an outcome.
     */
    public void release() {
        delegate.releasePermission();
    }

    public synchronized CircuitState onSuccess() {
        consecutiveFailures = 0;
        delegate.onSuccess(0, TimeUnit.NANOSECONDS);
        return getState();
    }

    /**
     * Records a failed call. Failures outside TRANSIENT and PROTOCOL only release the permit.
     */
    public synchronized CircuitState onFailure(Throwable error) {
        delegate.onError(0, TimeUnit.NANOSECONDS, error);
        if (isRecorded(error)) {
            consecutiveFailures++;
            if (consecutiveFailures >= settings.getFailureThreshold()
                    && delegate.getState() == CircuitBreaker.State.CLOSED) {
                log.warn("circuit.open id={} consecutive={}", serverId, consecutiveFailures);
                delegate.transitionToOpenState();
            }
        }
        return getState();
    }

    /**
     * OPEN reports as HALF_OPEN once its cooldown has run out; the next call is the trial call.
     */
    public CircuitState getState() {
        switch (delegate.getState()) {
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            case OPEN:
            case FORCED_OPEN:
                return cooldownElapsed() ? CircuitState.HALF_OPEN : CircuitState.OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public Duration getCooldown() {
        return cooldownFor(settings, Math.max(1, openAttempts));
    }

    public synchronized void forceOpen() {
        if (delegate.getState() != CircuitBreaker.State.OPEN) {
            log.warn("circuit.force_open id={}", serverId);
            delegate.transitionToOpenState();
        }
    }

    /**
     * Back to CLOSED with an empty window and the initial cooldown.
     */
    public synchronized void reset() {
        consecutiveFailures = 0;
        if (delegate.getState() == CircuitBreaker.State.CLOSED) {
            delegate.reset();
        } else {
            delegate.transitionToClosedState();
        }
        openAttempts = 0;
        openedAt = null;
    }

    CircuitBreaker delegate() {
        return delegate;
    }

    private void onTransition(CircuitBreaker.State from, CircuitBreaker.State to) {
        if (to == CircuitBreaker.State.OPEN) {
            openAttempts = from == CircuitBreaker.State.HALF_OPEN ? openAttempts + 1 : 1;
            openedAt = clock.instant();
            if (from == CircuitBreaker.State.HALF_OPEN) {
                log.warn("circuit.reopen id={} cooldownMs={}", serverId, getCooldown().toMillis());
            }
        } else if (to == CircuitBreaker.State.CLOSED) {
            synchronized (this) {
                consecutiveFailures = 0;
            }
            openAttempts = 0;
            openedAt = null;
            log.info("circuit.close id={}", serverId);
        } else if (to == CircuitBreaker.State.HALF_OPEN) {
            log.info("circuit.half_open id={}", serverId);
        }
        CircuitState before = map(from);
        CircuitState after = map(to);
        if (before != after) {
            transitions.accept(before, after);
        }
    }

    private boolean cooldownElapsed() {
        Instant opened = openedAt;
        return opened != null && clock.instant().isAfter(opened.plus(getCooldown()));
    }

    private long remainingCooldownMs() {
        Instant opened = openedAt;
        if (opened == null) {
            return 0;
        }
        long elapsed = Duration.between(opened, clock.instant()).toMillis();
        return Math.max(0, getCooldown().toMillis() - elapsed);
    }

    private static CircuitState map(CircuitBreaker.State state) {
        switch (state) {
            case OPEN:
            case FORCED_OPEN:
                return CircuitState.OPEN;
            case HALF_OPEN:
                return CircuitState.HALF_OPEN;
            default:
                return CircuitState.CLOSED;
        }
    }
}
