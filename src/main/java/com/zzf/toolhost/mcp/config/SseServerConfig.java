package com.zzf.toolhost.mcp.config;

/**
 * Legacy HTTP+SSE provider.
 */
public final class SseServerConfig extends RemoteServerConfig {

    private SseServerConfig(Builder builder) {
        super(builder);
    }

    @Override
    public TransportType getTransport() {
        return TransportType.SSE;
    }

    @Override
    public SseServerConfig withEnabled(boolean enabled) {
        return new Builder()
                .id(getId())
                .name(getName())
                .timeout(getTimeout())
                .enabled(enabled)
                .url(getUrl())
                .headers(getHeaders())
                .preResolved()
                .build();
    }

    public static final class Builder extends RemoteBuilder<Builder> {
        @Override
        public SseServerConfig build() {
            return new SseServerConfig(this);
        }
    }
}
