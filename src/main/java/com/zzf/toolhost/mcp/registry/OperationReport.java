package com.zzf.toolhost.mcp.registry;

import com.zzf.toolhost.mcp.server.ServerState;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one server's part in a bulk start or stop.
 */
@Value
@Builder
public class OperationReport {
    String serverId;
    boolean success;
    ServerState state;
    String message;
    long durationMs;
}
