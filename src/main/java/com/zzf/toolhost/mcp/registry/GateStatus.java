package com.zzf.toolhost.mcp.registry;

import lombok.Value;

@Value
public class GateStatus {
    boolean busy;
    int queueLength;
}
