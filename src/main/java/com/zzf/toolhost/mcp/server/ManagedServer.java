package com.zzf.toolhost.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.toolhost.mcp.config.ServerConfig;
import com.zzf.toolhost.mcp.error.ProviderConnectionException;
import com.zzf.toolhost.mcp.error.ProviderFatalException;
import com.zzf.toolhost.mcp.error.ProviderProtocolException;
import com.zzf.toolhost.mcp.error.ProviderTimeoutException;
import com.zzf.toolhost.mcp.error.QuarantinedServerException;
import com.zzf.toolhost.mcp.error.ServerUnavailableException;
import com.zzf.toolhost.mcp.error.ToolProviderException;
import com.zzf.toolhost.mcp.isolation.ErrorIsolator;
import com.zzf.toolhost.mcp.isolation.FailureCategory;
import com.zzf.toolhost.mcp.isolation.FailureClassifier;
import com.zzf.toolhost.mcp.status.StatusTracker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个工具提供方的生命周期管理.
 * <p>
 * Owns exactly one {@link ProviderConnection}. Lifecycle methods are synchronized on the
 * instance; {@link #callTool} only reads the current connection and may run concurrently.
 * Blocking provider work runs on {@code workers} so every operation is bounded by a timeout.
 * A timed-out call is interrupted and {@link #callTool} returns only once its worker has
 * finished; a worker that ignores the interrupt for {@code cancelGrace} costs the connection.
 */
@Slf4j
public class ManagedServer {

    private final ProviderConnector connector;
    private final StatusTracker statusTracker;
    private final ErrorIsolator errorIsolator;
    public static final Duration DEFAULT_CANCEL_GRACE = Duration.ofSeconds(5);

    private final ExecutorService workers;
    private final ObjectMapper objectMapper;
    private final DiagnosticBuffer diagnostics;
    private final Duration cancelGrace;

    private volatile ServerConfig config;
    private volatile ProviderConnection connection;

    public ManagedServer(ServerConfig config,
                         ProviderConnector connector,
                         StatusTracker statusTracker,
                         ErrorIsolator errorIsolator,
                         ExecutorService workers,
                         ObjectMapper objectMapper,
                         int diagnosticCapacity) {
        this(config, connector, statusTracker, errorIsolator, workers, objectMapper, diagnosticCapacity,
                DEFAULT_CANCEL_GRACE);
    }

    public ManagedServer(ServerConfig config,
                         ProviderConnector connector,
                         StatusTracker statusTracker,
                         ErrorIsolator errorIsolator,
                         ExecutorService workers,
                         ObjectMapper objectMapper,
                         int diagnosticCapacity,
                         Duration cancelGrace) {
        this.config = config;
        this.connector = connector;
        this.statusTracker = statusTracker;
        this.errorIsolator = errorIsolator;
        this.workers = workers;
        this.objectMapper = objectMapper;
        this.diagnostics = new DiagnosticBuffer(diagnosticCapacity);
        this.cancelGrace = cancelGrace;
        statusTracker.setMetadata(getId(), "name", config.getName());
        statusTracker.setMetadata(getId(), "transport", config.getTransport().name().toLowerCase());
    }

    public String getId() {
        return config.getId();
    }

    public String getName() {
        return config.getName();
    }

    public ServerConfig getConfig() {
        return config;
    }

    public ServerState getState() {
        return statusTracker.getStatus(getId());
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public void enable() {
        config = config.withEnabled(true);
        statusTracker.recordEvent(getId(), "enabled", Collections.emptyMap());
    }

    /**
     * Marks the server disabled. Does not stop it; the registry does that under its lock.
     */
    public void disable() {
        config = config.withEnabled(false);
        statusTracker.recordEvent(getId(), "disabled", Collections.emptyMap());
    }

    public boolean isQuarantined() {
        return errorIsolator.isQuarantined(getId());
    }

    public List<String> getCapturedDiagnostics() {
        return diagnostics.snapshot();
    }

    public long getDroppedDiagnostics() {
        return diagnostics.getDropped();
    }

    /**
     * Connects to the provider.
     *
     * @return {@code false} if already running
     * @throws QuarantinedServerException if the server is quarantined
     * @throws ServerUnavailableException if the server is disabled or mid-transition
     * @throws ProviderTimeoutException if the connection is not established in time
     * @throws ProviderConnectionException if the connection fails
     */
    public synchronized boolean start(Duration timeout) {
        String id = getId();
        if (isQuarantined()) {
            throw new QuarantinedServerException(id, errorIsolator.getQuarantineReason(id));
        }
        if (!isEnabled()) {
            throw new ServerUnavailableException(id, getState(), "server " + id + " is disabled");
        }
        ServerState state = getState();
        if (state == ServerState.RUNNING) {
            return false;
        }
        if (!state.canTransitionTo(ServerState.STARTING)) {
            throw new ServerUnavailableException(id, state, "server " + id + " cannot start from state " + state.label());
        }
        transition(ServerState.STARTING);
        long t0 = System.currentTimeMillis();
        CompletableFuture<ProviderConnection> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return connector.connect(config, diagnostics);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, workers);
        try {
            ProviderConnection conn = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            connection = conn;
            transition(ServerState.RUNNING);
            long elapsed = System.currentTimeMillis() - t0;
            statusTracker.recordEvent(id, "started", Map.of("duration_ms", elapsed));
            log.info("mcp.start id={} name={} transport={} durationMs={}",
                    id, getName(), config.getTransport(), elapsed);
            return true;
        } catch (TimeoutException e) {
            closeWhenConnected(pending);
            failStart("start_timeout", "start timed out after " + timeout.toMillis() + "ms");
            throw new ProviderTimeoutException(id, "start", timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeWhenConnected(pending);
            failStart("start_interrupted", "start interrupted");
            throw new ProviderConnectionException(id, "start of " + id + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            failStart("start_failed", describe(cause));
            if (cause instanceof ToolProviderException) {
                throw (ToolProviderException) cause;
            }
            throw new ProviderConnectionException(id, "failed to start " + id + ": " + describe(cause), cause);
        }
    }

    /**
     * Closes the connection, forcing termination if graceful close exceeds {@code grace}.
     *
     * @return {@code false} if there was nothing to stop
     */
    public synchronized boolean stop(Duration grace) {
        String id = getId();
        ServerState state = getState();
        if (!state.canTransitionTo(ServerState.STOPPING)) {
            return false;
        }
        transition(ServerState.STOPPING);
        ProviderConnection conn = connection;
        connection = null;
        boolean forced = false;
        if (conn != null) {
            forced = !closeWithin(conn, grace);
        }
        transition(ServerState.STOPPED);
        statusTracker.recordEvent(id, "stopped", Map.of("forced", forced));
        log.info("mcp.stop id={} forced={}", id, forced);
        return true;
    }

    /**
     * Moves a stopped server into QUARANTINED. Called by the registry after the isolator
     * quarantines this server.
     */
    public synchronized void markQuarantined(String reason) {
        ServerState state = getState();
        if (state == ServerState.QUARANTINED) {
            return;
        }
        if (!state.canTransitionTo(ServerState.QUARANTINED)) {
            throw new IllegalStateException("cannot quarantine " + getId() + " from state " + state.label());
        }
        transition(ServerState.QUARANTINED);
        statusTracker.setMetadata(getId(), "quarantine_reason", reason);
    }

    /**
     * QUARANTINED to STOPPED once the quarantine flag is cleared.
     */
    public synchronized boolean releaseQuarantine() {
        if (getState() != ServerState.QUARANTINED || isQuarantined()) {
            return false;
        }
        transition(ServerState.STOPPED);
        statusTracker.setMetadata(getId(), "quarantine_reason", null);
        return true;
    }

    /**
     * Invokes a tool on the provider.
     *
     * @throws ServerUnavailableException if the server is not RUNNING
     * @throws ProviderTimeoutException if the call exceeds {@code timeout}
     */
    public ToolCallResult callTool(String toolName, Map<String, Object> arguments, Duration timeout) {
        String id = getId();
        ProviderConnection conn = connection;
        ServerState state = getState();
        if (state != ServerState.RUNNING || conn == null) {
            throw new ServerUnavailableException(id, state);
        }
        String argumentsJson = toJson(arguments);
        long t0 = System.currentTimeMillis();
        AtomicBoolean claimed = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);
        Future<String> pending = workers.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return null;
            }
            try {
                return conn.callTool(toolName, argumentsJson);
            } finally {
                finished.countDown();
            }
        });
        try {
            String output = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = System.currentTimeMillis() - t0;
            statusTracker.setMetadata(id, "last_latency_ms", elapsed);
            return ToolCallResult.builder()
                    .serverId(id)
                    .toolName(toolName)
                    .output(output)
                    .durationMs(elapsed)
                    .build();
        } catch (TimeoutException e) {
            statusTracker.recordEvent(id, "call_timeout", Map.of("tool", toolName, "timeout_ms", timeout.toMillis()));
            cancelCall(conn, toolName, pending, claimed, finished);
            throw new ProviderTimeoutException(id, "call " + toolName, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelCall(conn, toolName, pending, claimed, finished);
            throw new ProviderConnectionException(id, "call " + toolName + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            Map<String, Object> details = new HashMap<>();
            details.put("tool", toolName);
            details.put("error", describe(cause));
            statusTracker.recordEvent(id, "call_failed", details);
            throw translate(toolName, cause);
        }
    }

    public List<ToolDescriptor> listTools(Duration timeout) {
        String id = getId();
        ProviderConnection conn = connection;
        if (getState() != ServerState.RUNNING || conn == null) {
            throw new ServerUnavailableException(id, getState());
        }
        Future<List<ToolDescriptor>> pending = workers.submit(conn::listTools);
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new ProviderTimeoutException(id, "list tools", timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.cancel(true);
            throw new ProviderConnectionException(id, "list tools interrupted", e);
        } catch (ExecutionException e) {
            throw translate("tools/list", e.getCause() == null ? e : e.getCause());
        }
    }

    private boolean closeWithin(ProviderConnection conn, Duration grace) {
        CompletableFuture<Void> closing = CompletableFuture.runAsync(() -> {
            try {
                conn.close();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, workers);
        try {
            closing.get(grace.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            closing.cancel(true);
            log.warn("mcp.stop_forced id={} graceMs={}", getId(), grace.toMillis());
            diagnostics.accept("graceful close exceeded " + grace.toMillis() + "ms, terminating");
            conn.terminate();
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            conn.terminate();
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("mcp.close_failed id={} err={}", getId(), describe(cause));
            diagnostics.accept("close failed: " + describe(cause));
            conn.terminate();
            return true;
        }
    }

    /**
     * Interrupts a call that is being given up on and waits for its worker to leave the
     * provider. A worker still busy after {@code cancelGrace} takes the connection down with it.
     */
    private void cancelCall(ProviderConnection conn, String toolName, Future<?> pending,
                            AtomicBoolean claimed, CountDownLatch finished) {
        if (claimed.compareAndSet(false, true)) {
            pending.cancel(false);
            return;
        }
        pending.cancel(true);
        boolean interrupted = Thread.interrupted();
        try {
            if (finished.await(cancelGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        abandonConnection(conn, toolName + " ignored cancellation for " + cancelGrace.toMillis() + "ms");
    }

    private synchronized void abandonConnection(ProviderConnection conn, String reason) {
        log.warn("mcp.call_abandoned id={} reason={}", getId(), reason);
        diagnostics.accept("terminating connection: " + reason);
        conn.terminate();
        if (connection != conn || getState() != ServerState.RUNNING) {
            return;
        }
        connection = null;
        statusTracker.recordEvent(getId(), "call_abandoned", Map.of("error", reason));
        transition(ServerState.ERROR);
    }

    private void failStart(String eventType, String message) {
        String id = getId();
        log.warn("mcp.start_failed id={} event={} err={}", id, eventType, message);
        diagnostics.accept(eventType + ": " + message);
        statusTracker.recordEvent(id, eventType, Map.of("error", message));
        transition(ServerState.ERROR);
    }

    private ToolProviderException translate(String toolName, Throwable cause) {
        if (cause instanceof ToolProviderException) {
            return (ToolProviderException) cause;
        }
        String id = getId();
        String message = toolName + " failed on " + id + ": " + describe(cause);
        FailureCategory category = FailureClassifier.classify(cause);
        switch (category) {
            case FATAL:
                return new ProviderFatalException(id, message, cause);
            case TRANSIENT:
                return new ProviderConnectionException(id, message, cause);
            default:
                return new ProviderProtocolException(id, message, cause);
        }
    }

    private String toJson(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments == null ? Collections.emptyMap() : arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("tool arguments are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private void transition(ServerState target) {
        ServerState current = getState();
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("illegal transition " + current + " -> " + target + " for " + getId());
        }
        statusTracker.setStatus(getId(), target);
    }

    /**
     * The connect attempt may still succeed after we gave up on it. Close that connection.
     */
    private void closeWhenConnected(CompletableFuture<ProviderConnection> pending) {
        pending.whenComplete((late, err) -> {
            if (late != null) {
                log.info("mcp.late_connection_closed id={}", getId());
                closeQuietly(late);
            }
        });
    }

    private void closeQuietly(ProviderConnection conn) {
        try {
            conn.close();
        } catch (Exception e) {
            log.warn("mcp.late_close_failed id={} err={}", getId(), describe(e));
            conn.terminate();
        }
    }

    private static String describe(Throwable error) {
        String msg = error.getMessage();
        return msg == null || msg.isBlank() ? error.getClass().getSimpleName() : msg;
    }
}
