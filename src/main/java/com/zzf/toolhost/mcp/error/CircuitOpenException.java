package com.zzf.toolhost.mcp.error;

public class CircuitOpenException extends ToolProviderException {

    private final long retryAfterMs;

    public CircuitOpenException(String serverId, long retryAfterMs) {
        super("CIRCUIT_OPEN", serverId,
                "circuit breaker for server " + serverId + " is open, retry in " + retryAfterMs + " ms");
        this.retryAfterMs = retryAfterMs;
    }

    public CircuitOpenException(String serverId, String message) {
        super("CIRCUIT_OPEN", serverId, message);
        this.retryAfterMs = 0;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
