package com.zzf.toolhost.mcp.isolation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of one server's failure bookkeeping.
 */
@Value
@Builder
public class ErrorStats {
    String serverId;
    long totalErrors;
    int consecutiveErrors;
    Map<FailureCategory, Long> errorsByCategory;
    String lastError;
    Instant lastErrorTime;
    boolean quarantined;
    int quarantineCount;
    Instant quarantinedAt;
    String quarantineReason;
    CircuitState circuitState;

    public static ErrorStats empty(String serverId) {
        return ErrorStats.builder()
                .serverId(serverId)
                .errorsByCategory(Map.of())
                .circuitState(CircuitState.CLOSED)
                .build();
    }
}
