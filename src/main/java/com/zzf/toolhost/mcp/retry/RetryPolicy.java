package com.zzf.toolhost.mcp.retry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    /** Fraction of the computed delay added or removed at random. */
    @Builder.Default
    double jitter = 0.25;

    @Builder.Default
    Duration minDelay = Duration.ofMillis(100);

    @Builder.Default
    BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL_JITTER;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }
}
