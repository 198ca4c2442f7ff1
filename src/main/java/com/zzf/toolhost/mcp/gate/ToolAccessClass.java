package com.zzf.toolhost.mcp.gate;

import java.util.Locale;

public enum ToolAccessClass {
    /** No side effects. Never gated. */
    READ,
    /** File mutation. */
    WRITE,
    /** Shell or process execution. */
    EXECUTE;

    public static ToolAccessClass fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
