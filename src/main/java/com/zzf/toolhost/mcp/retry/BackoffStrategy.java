package com.zzf.toolhost.mcp.retry;

import java.util.Locale;

public enum BackoffStrategy {
    FIXED,
    LINEAR,
    EXPONENTIAL,
    EXPONENTIAL_JITTER;

    public static BackoffStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return EXPONENTIAL_JITTER;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return EXPONENTIAL;
        }
    }
}
