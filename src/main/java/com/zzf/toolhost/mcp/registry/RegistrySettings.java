package com.zzf.toolhost.mcp.registry;

import com.zzf.toolhost.mcp.server.DiagnosticBuffer;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class RegistrySettings {
    @Builder.Default
    Duration startTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration stopTimeout = Duration.ofSeconds(5);
    @Builder.Default
    Duration callTimeout = Duration.ofSeconds(60);
    @Builder.Default
    int diagnosticCapacity = DiagnosticBuffer.DEFAULT_CAPACITY;

    public static RegistrySettings defaults() {
        return RegistrySettings.builder().build();
    }
}
