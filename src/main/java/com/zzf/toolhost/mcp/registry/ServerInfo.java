package com.zzf.toolhost.mcp.registry;

import com.zzf.toolhost.mcp.isolation.CircuitState;
import com.zzf.toolhost.mcp.server.ServerState;
import lombok.Builder;
import lombok.Value;

/**
 * 服务器列表视图.
 */
@Value
@Builder
public class ServerInfo {
    String id;
    String name;
    String transport;
    boolean enabled;
    ServerState state;
    boolean quarantined;
    String quarantineReason;
    CircuitState circuitState;
    /** {@code null} if never started. */
    Long uptimeMs;
    String lastError;
    Long lastLatencyMs;
    long droppedDiagnostics;
}
