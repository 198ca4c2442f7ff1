package com.zzf.toolhost.mcp.isolation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Breaker and quarantine thresholds shared by every server.
 */
@Value
@Builder
public class IsolationSettings {

    /** Consecutive failures that open the breaker. */
    @Builder.Default
    int failureThreshold = 3;

    /** Sliding window size for the M-of-W rule. */
    @Builder.Default
    int windowSize = 10;

    /** Failures within the window that open the breaker. */
    @Builder.Default
    int windowFailureThreshold = 5;

    @Builder.Default
    Duration openCooldown = Duration.ofSeconds(30);

    @Builder.Default
    double cooldownMultiplier = 2.0;

    @Builder.Default
    Duration maxOpenCooldown = Duration.ofMinutes(5);

    /** Consecutive counted failures (across breaker cycles) that quarantine a server. */
    @Builder.Default
    int quarantineThreshold = 10;

    public static IsolationSettings defaults() {
        return IsolationSettings.builder().build();
    }

    public void validate() {
        if (failureThreshold <= 0 || windowSize <= 0 || windowFailureThreshold <= 0) {
            throw new IllegalArgumentException("breaker thresholds must be positive");
        }
        if (windowFailureThreshold > windowSize) {
            throw new IllegalArgumentException("windowFailureThreshold must not exceed windowSize");
        }
        if (quarantineThreshold <= failureThreshold) {
            throw new IllegalArgumentException("quarantineThreshold must exceed failureThreshold");
        }
        if (openCooldown.isNegative() || maxOpenCooldown.compareTo(openCooldown) < 0) {
            throw new IllegalArgumentException("maxOpenCooldown must be >= openCooldown");
        }
        if (cooldownMultiplier < 1.0) {
            throw new IllegalArgumentException("cooldownMultiplier must be >= 1.0");
        }
    }
}
