package com.zzf.toolhost.mcp.server;

import lombok.Builder;
import lombok.Value;

/**
 * 单次工具调用结果.
 */
@Value
@Builder
public class ToolCallResult {
    String serverId;
    String toolName;
    String output;
    long durationMs;
}
