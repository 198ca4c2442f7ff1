package com.zzf.toolhost.mcp.status;

import com.zzf.toolhost.mcp.server.ServerState;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of one server's tracked status.
 */
@Value
@Builder
public class ServerSummary {
    String serverId;
    ServerState state;
    Map<String, Object> metadata;
    Duration uptime;
    Instant startTime;
    Instant stopTime;
    int recentEventsCount;
    Instant lastEventTime;
}
