package com.zzf.toolhost.mcp.isolation;

public enum FailureCategory {
    /** Timeouts, resets, refused connections, overload. Retried and counted. */
    TRANSIENT,
    /** Malformed or unexpected provider response. Counted, not retried. */
    PROTOCOL,
    /** Unrecoverable provider signal. Quarantines immediately. */
    FATAL,
    /** Invalid server definition. Never counted. */
    CONFIGURATION,
    /** Call refused locally (not running, breaker open, quarantined). Never counted. */
    REJECTED;

    public boolean isCounted() {
        return this == TRANSIENT || this == PROTOCOL || this == FATAL;
    }

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
