package com.zzf.toolhost.mcp.retry;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Retry counters, aggregate or per server.
 */
@Value
@Builder
public class RetryStats {
    long totalCalls;
    long totalAttempts;
    long successfulCalls;
    long failedCalls;
    /** Calls that needed more than one attempt. */
    long retriedCalls;
    Instant lastRetry;

    public double getAverageAttempts() {
        return totalCalls == 0 ? 0.0 : (double) totalAttempts / totalCalls;
    }

    public static RetryStats empty() {
        return RetryStats.builder().build();
    }
}
