package com.zzf.toolhost.mcp.config;

import com.zzf.toolhost.mcp.error.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Shared shape of network-reachable providers (streamable HTTP and SSE).
 */
public abstract class RemoteServerConfig extends ServerConfig {

    private final String url;
    private final Map<String, String> headers;

    protected RemoteServerConfig(RemoteBuilder<?> builder) {
        super(builder);
        String resolved = builder.resolve(builder.url);
        this.url = validateUrl(getId(), getName(), resolved);
        this.headers = builder.resolveValues(builder.headers);
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    private static String validateUrl(String id, String name, String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException(id, "server '" + name + "' requires a url");
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!"http".equals(scheme) && !"https".equals(scheme)) {
                throw new ConfigurationException(id, "server '" + name + "' url must be http(s): " + trimmed);
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new ConfigurationException(id, "server '" + name + "' url has no host: " + trimmed);
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException(id, "server '" + name + "' url is malformed: " + e.getMessage());
        }
        return trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        RemoteServerConfig that = (RemoteServerConfig) o;
        return url.equals(that.url) && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), url, headers);
    }

    @SuppressWarnings("unchecked")
    public abstract static class RemoteBuilder<B extends RemoteBuilder<B>> extends ServerConfig.Builder<B> {
        private String url;
        private final Map<String, String> headers = new LinkedHashMap<>();

        public B url(String url) {
            this.url = url;
            return (B) this;
        }

        public B headers(Map<String, String> headers) {
            this.headers.clear();
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return (B) this;
        }

        public B header(String name, String value) {
            this.headers.put(name, value);
            return (B) this;
        }
    }
}
