package com.zzf.toolhost.mcp.isolation;

import com.zzf.toolhost.mcp.error.CircuitOpenException;
import com.zzf.toolhost.mcp.error.ConfigurationException;
import com.zzf.toolhost.mcp.error.ProviderConnectionException;
import com.zzf.toolhost.mcp.error.ProviderFatalException;
import com.zzf.toolhost.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServerBreakerTest {

    private static final Duration JUST_OVER = Duration.ofMillis(1);

    private final MutableClock clock = new MutableClock();
    private final List<String> transitions = new ArrayList<>();
    private final ServerBreaker breaker = new ServerBreaker("fs", IsolationSettings.defaults(), clock,
            (from, to) -> transitions.add(from + "->" + to));

    private static Exception transientError() {
        return new ProviderConnectionException("fs", "connection reset");
    }

    @Test
    void shouldOpenAfterConsecutiveFailures() {
        for (int i = 0; i < 2; i++) {
            assertFalse(breaker.acquire());
            assertEquals(CircuitState.CLOSED, breaker.onFailure(transientError()));
        }
        breaker.acquire();
        assertEquals(CircuitState.OPEN, breaker.onFailure(transientError()));
        assertEquals(List.of("CLOSED->OPEN"), transitions);

        CircuitOpenException rejected = assertThrows(CircuitOpenException.class, breaker::acquire);
        assertEquals(30_000L, rejected.getRetryAfterMs());
    }

    @Test
    void shouldOpenOnWindowFailureRate() {
        // alternating outcomes never reach 3 in a row but do reach 5 of the last 10
        breaker.onSuccess();
        for (int i = 0; i < 4; i++) {
            breaker.onFailure(transientError());
            breaker.onSuccess();
        }
        assertEquals(CircuitState.CLOSED, breaker.getState());
        breaker.onFailure(transientError());
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(1, breaker.getConsecutiveFailures());
    }

    @Test
    void shouldIgnoreFailuresOutsideTransientAndProtocol() {
        for (int i = 0; i < 5; i++) {
            breaker.acquire();
            breaker.onFailure(new ProviderFatalException("fs", "invalid credentials"));
            breaker.acquire();
            breaker.onFailure(new ConfigurationException("fs", "bad command"));
        }
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getConsecutiveFailures());
    }

    @Test
    void shouldAdmitSingleTrialCallAfterCooldown() {
        breaker.forceOpen();
        clock.advance(Duration.ofSeconds(30));
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertThrows(CircuitOpenException.class, breaker::acquire);

        clock.advance(JUST_OVER);
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertTrue(breaker.acquire());
        CircuitOpenException second = assertThrows(CircuitOpenException.class, breaker::acquire);
        assertTrue(second.getMessage().contains("half-open"));

        assertEquals(CircuitState.CLOSED, breaker.onSuccess());
        assertEquals(0, breaker.getConsecutiveFailures());
        assertEquals(Duration.ofSeconds(30), breaker.getCooldown());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    void shouldMultiplyCooldownOnFailedTrialCallUpToCap() {
        breaker.forceOpen();
        Duration expected = Duration.ofSeconds(30);
        for (int round = 0; round < 5; round++) {
            clock.advance(breaker.getCooldown().plus(JUST_OVER));
            assertTrue(breaker.acquire());
            assertEquals(CircuitState.OPEN, breaker.onFailure(transientError()));
            expected = expected.multipliedBy(2);
            if (expected.compareTo(Duration.ofMinutes(5)) > 0) {
                expected = Duration.ofMinutes(5);
            }
            assertEquals(expected, breaker.getCooldown());
        }
        assertEquals(Duration.ofMinutes(5), breaker.getCooldown());
        assertEquals(Duration.ofMinutes(5), ServerBreaker.cooldownFor(IsolationSettings.defaults(), 20));
    }

    @Test
    void shouldFreeTrialSlotOnRelease() {
        breaker.forceOpen();
        clock.advance(Duration.ofSeconds(30).plus(JUST_OVER));
        assertTrue(breaker.acquire());
        breaker.release();
        assertTrue(breaker.acquire());
    }

    @Test
    void shouldCloseWithInitialCooldownOnReset() {
        breaker.forceOpen();
        clock.advance(Duration.ofSeconds(30).plus(JUST_OVER));
        breaker.acquire();
        breaker.onFailure(transientError());
        assertEquals(Duration.ofSeconds(60), breaker.getCooldown());

        breaker.reset();
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(Duration.ofSeconds(30), breaker.getCooldown());
        assertFalse(breaker.acquire());
        assertEquals("HALF_OPEN->OPEN", transitions.get(transitions.size() - 2));
        assertEquals("OPEN->CLOSED", transitions.get(transitions.size() - 1));
    }
}
