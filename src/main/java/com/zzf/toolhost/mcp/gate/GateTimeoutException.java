package com.zzf.toolhost.mcp.gate;

import com.zzf.toolhost.mcp.error.ToolProviderException;

import java.time.Duration;

public class GateTimeoutException extends ToolProviderException {

    public GateTimeoutException(String toolName, ToolAccessClass cls, Duration timeout) {
        super("GATE_TIMEOUT", null,
                cls + " gate for tool " + toolName + " not acquired within " + timeout.toMillis() + " ms");
    }
}
