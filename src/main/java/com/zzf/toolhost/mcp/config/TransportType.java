package com.zzf.toolhost.mcp.config;

import java.util.Locale;

public enum TransportType {
    STDIO,
    HTTP,
    SSE;

    public static TransportType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "stdio":
                return STDIO;
            case "http":
            case "streamable-http":
            case "streamable_http":
                return HTTP;
            case "sse":
                return SSE;
            default:
                return null;
        }
    }
}
