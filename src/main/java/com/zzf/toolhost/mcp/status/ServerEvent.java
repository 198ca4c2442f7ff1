package com.zzf.toolhost.mcp.status;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
public class ServerEvent {
    Instant timestamp;
    String serverId;
    String eventType;
    Map<String, Object> details;

    public ServerEvent(Instant timestamp, String serverId, String eventType, Map<String, Object> details) {
        this.timestamp = timestamp;
        this.serverId = serverId;
        this.eventType = eventType;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }
}
