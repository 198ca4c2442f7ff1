package com.zzf.toolhost.mcp.isolation;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
