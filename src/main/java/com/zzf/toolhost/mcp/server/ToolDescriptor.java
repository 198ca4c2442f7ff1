package com.zzf.toolhost.mcp.server;

import lombok.Value;

@Value
public class ToolDescriptor {
    String name;
    String description;
}
