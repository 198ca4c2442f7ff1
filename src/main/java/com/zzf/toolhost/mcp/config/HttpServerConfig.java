package com.zzf.toolhost.mcp.config;

/**
 * Streamable HTTP provider.
 */
public final class HttpServerConfig extends RemoteServerConfig {

    private HttpServerConfig(Builder builder) {
        super(builder);
    }

    @Override
    public TransportType getTransport() {
        return TransportType.HTTP;
    }

    @Override
    public HttpServerConfig withEnabled(boolean enabled) {
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
        public HttpServerConfig build() {
            return new HttpServerConfig(this);
        }
    }
}
