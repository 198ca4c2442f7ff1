package com.zzf.toolhost.mcp.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.toolhost.mcp.config.ServerConfig;
import com.zzf.toolhost.mcp.error.ConfigurationException;
import com.zzf.toolhost.mcp.error.ProviderConnectionException;
import com.zzf.toolhost.mcp.error.ServerNotFoundException;
import com.zzf.toolhost.mcp.error.ToolProviderException;
import com.zzf.toolhost.mcp.gate.ConcurrencyGate;
import com.zzf.toolhost.mcp.gate.ToolAccessClass;
import com.zzf.toolhost.mcp.isolation.CircuitState;
import com.zzf.toolhost.mcp.isolation.ErrorIsolator;
import com.zzf.toolhost.mcp.isolation.ErrorStats;
import com.zzf.toolhost.mcp.isolation.IsolationListener;
import com.zzf.toolhost.mcp.retry.RetryManager;
import com.zzf.toolhost.mcp.retry.RetryStats;
import com.zzf.toolhost.mcp.server.ManagedServer;
import com.zzf.toolhost.mcp.server.ProviderConnector;
import com.zzf.toolhost.mcp.server.ServerState;
import com.zzf.toolhost.mcp.server.ToolCallResult;
import com.zzf.toolhost.mcp.server.ToolDescriptor;
import com.zzf.toolhost.mcp.status.ServerEvent;
import com.zzf.toolhost.mcp.status.ServerSummary;
import com.zzf.toolhost.mcp.status.StatusTracker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 工具服务器注册表, 协调生命周期, 状态, 隔离与重试.
 * <p>
 * Lifecycle operations on the same id are serialized by a per-id lock; different ids
 * proceed in parallel. Lifecycle methods return {@code false} for expected failures and
 * throw only for programming errors. {@link #callTool} throws typed
 * {@link ToolProviderException}s.
 */
@Slf4j
public class ServerRegistry implements IsolationListener {

    private final ProviderConnector connector;
    private final StatusTracker statusTracker;
    private final ErrorIsolator errorIsolator;
    private final RetryManager retryManager;
    private final ConcurrencyGate concurrencyGate;
    private final ExecutorService workers;
    private final ObjectMapper objectMapper;
    private final RegistrySettings settings;

    private final Map<String, ManagedServer> servers = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Object registration = new Object();

    public ServerRegistry(ProviderConnector connector,
                          StatusTracker statusTracker,
                          ErrorIsolator errorIsolator,
                          RetryManager retryManager,
                          ConcurrencyGate concurrencyGate,
                          ExecutorService workers,
                          ObjectMapper objectMapper,
                          RegistrySettings settings) {
        this.connector = connector;
        this.statusTracker = statusTracker;
        this.errorIsolator = errorIsolator;
        this.retryManager = retryManager;
        this.concurrencyGate = concurrencyGate;
        this.workers = workers;
        this.objectMapper = objectMapper;
        this.settings = settings;
        errorIsolator.addListener(this);
    }

    // ---- registration ----

    /**
     * @return the server id
     * @throws ConfigurationException if the id or name is already registered
     */
    public String register(ServerConfig config) {
        Objects.requireNonNull(config, "config");
        String id = config.getId();
        synchronized (registration) {
            if (servers.containsKey(id)) {
                throw new ConfigurationException(id, "server id already registered: " + id);
            }
            ensureNameFree(config.getName(), id);
            statusTracker.clear(id);
            errorIsolator.reset(id);
            retryManager.resetStats(id);
            servers.put(id, newServer(config));
        }
        statusTracker.recordEvent(id, "registered", Map.of("name", config.getName()));
        log.info("registry.register id={} name={} transport={}", id, config.getName(), config.getTransport());
        return id;
    }

    public boolean remove(String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return withLock(serverId, server -> {
            stopQuietly(server);
            servers.remove(serverId);
            statusTracker.clear(serverId);
            errorIsolator.reset(serverId);
            retryManager.resetStats(serverId);
            locks.remove(serverId);
            log.info("registry.remove id={}", serverId);
            return true;
        });
    }

    /**
     * Replaces a server's config. A server that was running is restarted with the new one.
     *
     * @return {@code false} if the id is unknown or the restart failed
     */
    public boolean update(ServerConfig config) {
        Objects.requireNonNull(config, "config");
        String id = config.getId();
        return withLock(id, current -> {
            synchronized (registration) {
                ensureNameFree(config.getName(), id);
            }
            boolean wasRunning = current.getState() == ServerState.RUNNING;
            stopQuietly(current);
            ManagedServer replacement = newServer(config);
            servers.put(id, replacement);
            statusTracker.recordEvent(id, "updated", Map.of("name", config.getName()));
            log.info("registry.update id={} name={} restart={}", id, config.getName(), wasRunning);
            return !wasRunning || startLocked(replacement);
        });
    }

    public Optional<ManagedServer> get(String serverId) {
        return serverId == null ? Optional.empty() : Optional.ofNullable(servers.get(serverId));
    }

    public Optional<ManagedServer> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return servers.values().stream()
                .filter(s -> s.getName().equals(name))
                .findFirst();
    }

    public List<ServerInfo> list() {
        List<ServerInfo> infos = new ArrayList<>();
        for (ManagedServer server : servers.values()) {
            infos.add(infoOf(server));
        }
        infos.sort((a, b) -> a.getName().compareTo(b.getName()));
        return infos;
    }

    public Optional<ServerInfo> getServerStatus(String serverId) {
        return get(serverId).map(this::infoOf);
    }

    /**
     * Ids of servers that are running, enabled and not quarantined.
     */
    public List<String> getAvailableServers() {
        List<String> ids = new ArrayList<>();
        for (ManagedServer server : servers.values()) {
            if (server.getState() == ServerState.RUNNING && server.isEnabled() && !server.isQuarantined()) {
                ids.add(server.getId());
            }
        }
        Collections.sort(ids);
        return ids;
    }

    // ---- lifecycle ----

    public boolean start(String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return withLock(serverId, this::startLocked);
    }

    public boolean stop(String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return withLock(serverId, server -> server.stop(settings.getStopTimeout()));
    }

    /**
     * Stops the server and replaces it with a fresh instance built from its config. Only a
     * server that was running is started again.
     *
     * @return {@code false} if the id is unknown, the server is quarantined or the restart failed
     */
    public boolean reload(String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return withLock(serverId, server -> {
            if (server.isQuarantined()) {
                log.info("registry.reload_refused id={} reason=quarantined", serverId);
                return false;
            }
            boolean wasRunning = server.getState() == ServerState.RUNNING;
            stopQuietly(server);
            ManagedServer replacement = newServer(server.getConfig());
            servers.put(serverId, replacement);
            statusTracker.recordEvent(serverId, "reload", Map.of("restart", wasRunning));
            log.info("registry.reload id={} restart={}", serverId, wasRunning);
            return !wasRunning || startLocked(replacement);
        });
    }

    /**
     * Starts every enabled server in parallel.
     */
    public Map<String, OperationReport> startAll() {
        return forAll(true, this::start);
    }

    public Map<String, OperationReport> stopAll() {
        return forAll(false, this::stop);
    }

    public boolean enable(String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return withLock(serverId, server -> {
            server.enable();
            return true;
        });
    }

    /**
     * Disables and stops the server.
     */
    public boolean disable(String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return withLock(serverId, server -> {
            server.disable();
            stopQuietly(server);
            return true;
        });
    }

    /**
     * Lifts quarantine and moves the server back to STOPPED. The server is not restarted.
     *
     * @return {@code false} if the id is unknown or the server was not quarantined
     */
    public boolean clearQuarantine(String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return withLock(serverId, server -> {
            boolean cleared = errorIsolator.clearQuarantine(serverId);
            boolean released = server.releaseQuarantine();
            if (cleared || released) {
                statusTracker.recordEvent(serverId, "quarantine_cleared", Collections.emptyMap());
                log.info("registry.quarantine_cleared id={}", serverId);
            }
            return cleared || released;
        });
    }

    public void shutdown() {
        log.info("registry.shutdown servers={}", servers.size());
        stopAll();
    }

    // ---- dispatch ----

    /**
     * Calls a tool through the gate, retry and breaker layers.
     *
     * @param timeout per-attempt timeout, {@code null} for the configured default
     * @throws ServerNotFoundException if the id is unknown
     */
    public ToolCallResult callTool(String serverId, String toolName, Map<String, Object> arguments, Duration timeout) {
        Objects.requireNonNull(toolName, "toolName");
        ManagedServer server = servers.get(serverId);
        if (server == null) {
            throw new ServerNotFoundException(serverId);
        }
        Duration perAttempt = timeout == null ? settings.getCallTimeout() : timeout;
        try {
            return concurrencyGate.run(toolName, () ->
                    retryManager.execute(serverId, () ->
                            errorIsolator.call(serverId, () -> server.callTool(toolName, arguments, perAttempt))));
        } catch (ToolProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderConnectionException(serverId, "call " + toolName + " interrupted", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderConnectionException(serverId, "call " + toolName + " failed: " + e.getMessage(), e);
        }
    }

    public List<ToolDescriptor> listTools(String serverId) {
        return require(serverId).listTools(settings.getCallTimeout());
    }

    // ---- status ----

    public ServerSummary getServerSummary(String serverId) {
        require(serverId);
        return statusTracker.getServerSummary(serverId);
    }

    public List<ServerEvent> getEvents(String serverId, int limit) {
        require(serverId);
        return statusTracker.getEvents(serverId, limit);
    }

    public List<String> getCapturedDiagnostics(String serverId) {
        return require(serverId).getCapturedDiagnostics();
    }

    public ErrorStats getErrorStats(String serverId) {
        require(serverId);
        return errorIsolator.getErrorStats(serverId);
    }

    public RetryStats getRetryStats(String serverId) {
        require(serverId);
        return retryManager.getStats(serverId);
    }

    /**
     * Per-server retry counters plus the aggregate under {@code "*"}.
     */
    public Map<String, RetryStats> getAllRetryStats() {
        Map<String, RetryStats> out = new TreeMap<>(retryManager.getAllStats());
        out.put("*", retryManager.getStats());
        return out;
    }

    /**
     * Operator override: closes the breaker and forgets its failure window. Quarantine is untouched.
     */
    public boolean resetCircuit(String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        if (!servers.containsKey(serverId)) {
            return false;
        }
        errorIsolator.forceClose(serverId);
        statusTracker.recordEvent(serverId, "circuit_reset", Collections.emptyMap());
        return true;
    }

    public Map<ToolAccessClass, GateStatus> getGateStatus() {
        Map<ToolAccessClass, GateStatus> out = new EnumMap<>(ToolAccessClass.class);
        for (ToolAccessClass cls : new ToolAccessClass[]{ToolAccessClass.WRITE, ToolAccessClass.EXECUTE}) {
            out.put(cls, new GateStatus(concurrencyGate.isBusy(cls), concurrencyGate.queueLength(cls)));
        }
        return out;
    }

    // ---- isolation callbacks ----

    @Override
    public void onCircuitStateChange(String serverId, CircuitState from, CircuitState to) {
        if (servers.containsKey(serverId)) {
            statusTracker.recordEvent(serverId, "circuit_state", Map.of("from", from.name(), "to", to.name()));
        }
    }

    @Override
    public void onQuarantined(String serverId, String reason) {
        if (!servers.containsKey(serverId)) {
            return;
        }
        withLock(serverId, server -> {
            stopQuietly(server);
            try {
                server.markQuarantined(reason);
            } catch (IllegalStateException e) {
                log.error("registry.quarantine_failed id={} state={}", serverId, server.getState(), e);
                return false;
            }
            statusTracker.recordEvent(serverId, "quarantined", Map.of("reason", reason));
            log.warn("registry.quarantined id={} reason={}", serverId, reason);
            return true;
        });
    }

    // ---- internals ----

    private boolean startLocked(ManagedServer server) {
        try {
            return server.start(settings.getStartTimeout());
        } catch (ToolProviderException e) {
            log.warn("registry.start_failed id={} code={} err={}", server.getId(), e.getErrorCode(), e.getMessage());
            statusTracker.recordEvent(server.getId(), "start_rejected",
                    Map.of("code", e.getErrorCode(), "error", String.valueOf(e.getMessage())));
            return false;
        }
    }

    private void stopQuietly(ManagedServer server) {
        try {
            server.stop(settings.getStopTimeout());
        } catch (RuntimeException e) {
            log.warn("registry.stop_failed id={} err={}", server.getId(), e.toString());
        }
    }

    private Map<String, OperationReport> forAll(boolean enabledOnly, Function<String, Boolean> op) {
        Map<String, CompletableFuture<OperationReport>> futures = new LinkedHashMap<>();
        for (ManagedServer server : servers.values()) {
            if (enabledOnly && !server.isEnabled()) {
                continue;
            }
            String id = server.getId();
            futures.put(id, CompletableFuture.supplyAsync(() -> report(id, op), workers));
        }
        Map<String, OperationReport> reports = new LinkedHashMap<>();
        futures.forEach((id, future) -> reports.put(id, future.join()));
        return reports;
    }

    private OperationReport report(String serverId, Function<String, Boolean> op) {
        long t0 = System.currentTimeMillis();
        boolean ok;
        String message;
        try {
            ok = Boolean.TRUE.equals(op.apply(serverId));
            message = ok ? "ok" : "no change";
        } catch (RuntimeException e) {
            log.error("registry.bulk_failed id={}", serverId, e);
            ok = false;
            message = e.toString();
        }
        if (!ok && errorIsolator.isQuarantined(serverId)) {
            message = "quarantined: " + errorIsolator.getQuarantineReason(serverId);
        }
        return OperationReport.builder()
                .serverId(serverId)
                .success(ok)
                .state(statusTracker.getStatus(serverId))
                .message(message)
                .durationMs(System.currentTimeMillis() - t0)
                .build();
    }

    private boolean withLock(String serverId, Function<ManagedServer, Boolean> action) {
        ReentrantLock lock = locks.computeIfAbsent(serverId, k -> new ReentrantLock());
        lock.lock();
        while (locks.get(serverId) != lock) {
            // removed while we waited
            lock.unlock();
            lock = locks.computeIfAbsent(serverId, k -> new ReentrantLock());
            lock.lock();
        }
        try {
            ManagedServer server = servers.get(serverId);
            if (server == null) {
                log.debug("registry.not_found id={}", serverId);
                return false;
            }
            return Boolean.TRUE.equals(action.apply(server));
        } finally {
            lock.unlock();
        }
    }

    private ManagedServer require(String serverId) {
        ManagedServer server = serverId == null ? null : servers.get(serverId);
        if (server == null) {
            throw new ServerNotFoundException(serverId);
        }
        return server;
    }

    private void ensureNameFree(String name, String ownerId) {
        for (ManagedServer other : servers.values()) {
            if (!other.getId().equals(ownerId) && other.getName().equals(name)) {
                throw new ConfigurationException(ownerId, "server name already registered: " + name);
            }
        }
    }

    private ManagedServer newServer(ServerConfig config) {
        return new ManagedServer(config, connector, statusTracker, errorIsolator, workers, objectMapper,
                settings.getDiagnosticCapacity(), settings.getStopTimeout());
    }

    private ServerInfo infoOf(ManagedServer server) {
        String id = server.getId();
        ErrorStats errors = errorIsolator.getErrorStats(id);
        Duration uptime = statusTracker.getUptime(id);
        Object latency = statusTracker.getMetadata(id, "last_latency_ms");
        return ServerInfo.builder()
                .id(id)
                .name(server.getName())
                .transport(server.getConfig().getTransport().name().toLowerCase())
                .enabled(server.isEnabled())
                .state(server.getState())
                .quarantined(errors.isQuarantined())
                .quarantineReason(errors.getQuarantineReason())
                .circuitState(errors.getCircuitState())
                .uptimeMs(uptime == null ? null : uptime.toMillis())
                .lastError(errors.getLastError())
                .lastLatencyMs(latency instanceof Number ? ((Number) latency).longValue() : null)
                .droppedDiagnostics(server.getDroppedDiagnostics())
                .build();
    }
}
