package com.zzf.toolhost.mcp.isolation;

/**
 * Callback for breaker and quarantine transitions. Invoked on the thread that caused the
 * transition, outside the isolator's record locks.
 */
public interface IsolationListener {

    default void onCircuitStateChange(String serverId, CircuitState from, CircuitState to) {
    }

    default void onQuarantined(String serverId, String reason) {
    }

    default void onQuarantineCleared(String serverId) {
    }
}
