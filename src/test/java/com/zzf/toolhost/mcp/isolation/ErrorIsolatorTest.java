package com.zzf.toolhost.mcp.isolation;

import com.zzf.toolhost.mcp.error.CircuitOpenException;
import com.zzf.toolhost.mcp.error.ProviderConnectionException;
import com.zzf.toolhost.mcp.error.ProviderFatalException;
import com.zzf.toolhost.mcp.error.QuarantinedServerException;
import com.zzf.toolhost.mcp.error.ServerUnavailableException;
import com.zzf.toolhost.mcp.server.ServerState;
import com.zzf.toolhost.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorIsolatorTest {

    private final MutableClock clock = new MutableClock();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final ErrorIsolator isolator = new ErrorIsolator(IsolationSettings.defaults(), clock, meters);
    private final AtomicInteger invocations = new AtomicInteger();

    private String failing() {
        invocations.incrementAndGet();
        throw new ProviderConnectionException("fs", "connection reset");
    }

    private String ok() {
        invocations.incrementAndGet();
        return "ok";
    }

    @Test
    void shouldFastFailFourthCallWithoutInvokingProvider() {
        for (int i = 0; i < 3; i++) {
            assertThrows(ProviderConnectionException.class, () -> isolator.call("fs", this::failing));
        }
        assertEquals(CircuitState.OPEN, isolator.getCircuitState("fs"));

        assertThrows(CircuitOpenException.class, () -> isolator.call("fs", this::ok));
        assertEquals(3, invocations.get());
        assertEquals(1.0, meters.counter("toolhost.circuit.opened", "server", "fs").count());
    }

    @Test
    void shouldAdmitExactlyOneTrialCallWhileHalfOpen() throws Exception {
        isolator.forceOpen("fs");
        clock.advance(Duration.ofSeconds(30).plusMillis(1));

        CountDownLatch trialStarted = new CountDownLatch(1);
        CountDownLatch releaseTrial = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> trial = pool.submit(() -> isolator.call("fs", () -> {
                trialStarted.countDown();
                assertTrue(releaseTrial.await(5, TimeUnit.SECONDS));
                return "trial";
            }));
            assertTrue(trialStarted.await(5, TimeUnit.SECONDS));

            assertThrows(CircuitOpenException.class, () -> isolator.call("fs", this::ok));
            assertEquals(0, invocations.get());

            releaseTrial.countDown();
            assertEquals("trial", trial.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(CircuitState.CLOSED, isolator.getCircuitState("fs"));
        assertEquals("ok", isolator.call("fs", this::ok));
    }

    @Test
    void shouldNotifyEveryCircuitTransitionIncludingHalfOpen() throws Exception {
        List<String> seen = new ArrayList<>();
        isolator.addListener(new IsolationListener() {
            @Override
            public void onCircuitStateChange(String serverId, CircuitState from, CircuitState to) {
                seen.add(from + "->" + to);
            }
        });
        for (int i = 0; i < 3; i++) {
            assertThrows(ProviderConnectionException.class, () -> isolator.call("fs", this::failing));
        }
        assertEquals(1.0, meters.get("resilience4j.circuitbreaker.state")
                .tag("name", "fs").tag("state", "open").gauge().value());

        clock.advance(Duration.ofSeconds(30).plusMillis(1));
        assertEquals("ok", isolator.call("fs", this::ok));

        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), seen);
        assertEquals(1.0, meters.get("resilience4j.circuitbreaker.state")
                .tag("name", "fs").tag("state", "closed").gauge().value());
    }

    @Test
    void shouldDropOutcomeOfCallThatOutlivedReset() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> stale = pool.submit(() -> isolator.call("fs", () -> {
                started.countDown();
                assertTrue(finish.await(5, TimeUnit.SECONDS));
                throw new ProviderFatalException("fs", "invalid credentials");
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            isolator.reset("fs");
            finish.countDown();
            assertThrows(Exception.class, () -> stale.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertFalse(isolator.isQuarantined("fs"));
        assertEquals(0, isolator.getErrorStats("fs").getTotalErrors());
        assertEquals("ok", isolator.call("fs", this::ok));
    }

    @Test
    void shouldNotCountLocalRejections() throws Exception {
        for (int i = 0; i < 5; i++) {
            assertThrows(ServerUnavailableException.class, () -> isolator.call("fs", () -> {
                throw new ServerUnavailableException("fs", ServerState.STOPPED);
            }));
        }
        assertEquals(CircuitState.CLOSED, isolator.getCircuitState("fs"));
        assertEquals(0, isolator.getErrorStats("fs").getTotalErrors());
    }

    @Test
    void shouldQuarantineImmediatelyOnFatal() {
        List<String> quarantined = new ArrayList<>();
        isolator.addListener(new IsolationListener() {
            @Override
            public void onQuarantined(String serverId, String reason) {
                quarantined.add(serverId);
            }
        });

        assertThrows(ProviderFatalException.class, () -> isolator.call("fs", () -> {
            throw new ProviderFatalException("fs", "invalid credentials");
        }));

        assertTrue(isolator.isQuarantined("fs"));
        assertEquals(List.of("fs"), quarantined);
        assertEquals(CircuitState.CLOSED, isolator.getCircuitState("fs"));

        clock.advance(Duration.ofDays(1));
        assertThrows(QuarantinedServerException.class, () -> isolator.call("fs", this::ok));
        assertEquals(0, invocations.get());

        ErrorStats stats = isolator.getErrorStats("fs");
        assertTrue(stats.isQuarantined());
        assertEquals(1, stats.getQuarantineCount());
        assertEquals(1L, stats.getErrorsByCategory().get(FailureCategory.FATAL));
    }

    @Test
    void shouldQuarantineAfterRepeatedFailedTrialCalls() {
        ErrorIsolator strict = new ErrorIsolator(IsolationSettings.builder()
                .failureThreshold(3)
                .quarantineThreshold(5)
                .build(), clock, meters);

        for (int i = 0; i < 3; i++) {
            assertThrows(ProviderConnectionException.class, () -> strict.call("fs", this::failing));
        }
        clock.advance(strict.getSettings().getOpenCooldown().plusMillis(1));
        assertThrows(ProviderConnectionException.class, () -> strict.call("fs", this::failing));
        assertFalse(strict.isQuarantined("fs"));

        clock.advance(Duration.ofSeconds(61));
        assertThrows(ProviderConnectionException.class, () -> strict.call("fs", this::failing));
        assertTrue(strict.isQuarantined("fs"));
        assertEquals(5, strict.getErrorStats("fs").getConsecutiveErrors());
    }

    @Test
    void shouldCountOnlyConsecutiveFailuresTowardQuarantine() throws Exception {
        ErrorIsolator strict = new ErrorIsolator(IsolationSettings.builder()
                .failureThreshold(3)
                .quarantineThreshold(4)
                .build(), clock, meters);

        for (int round = 0; round < 3; round++) {
            for (int i = 0; i < 2; i++) {
                assertThrows(ProviderConnectionException.class, () -> strict.call("fs", this::failing));
            }
            assertEquals("ok", strict.call("fs", this::ok));
        }

        assertFalse(strict.isQuarantined("fs"));
        assertEquals(6, strict.getErrorStats("fs").getTotalErrors());
        assertEquals(0, strict.getErrorStats("fs").getConsecutiveErrors());
    }

    @Test
    void shouldStayQuarantinedUntilCleared() throws Exception {
        isolator.quarantine("fs", "operator");
        clock.advance(Duration.ofHours(2));
        assertTrue(isolator.isQuarantined("fs"));
        assertEquals("operator", isolator.getQuarantineReason("fs"));

        assertTrue(isolator.clearQuarantine("fs"));
        assertFalse(isolator.clearQuarantine("fs"));
        assertEquals("ok", isolator.call("fs", this::ok));
        assertEquals(0, isolator.getErrorStats("fs").getConsecutiveErrors());
    }
}
