package com.zzf.toolhost.mcp.config;

import com.zzf.toolhost.mcp.error.ConfigurationException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Immutable definition of one tool provider. One subclass per transport; all
 * validation happens in the constructors so an instance is always usable.
 */
public abstract class ServerConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String id;
    private final String name;
    private final boolean enabled;
    private final Duration timeout;

    protected ServerConfig(Builder<?> builder) {
        String rawId = builder.id == null ? "" : builder.id.trim();
        this.id = rawId.isEmpty() ? UUID.randomUUID().toString() : rawId;
        String rawName = builder.name == null ? "" : builder.name.trim();
        if (rawName.isEmpty()) {
            throw new ConfigurationException(id, "server name must not be empty");
        }
        this.name = rawName;
        this.enabled = builder.enabled;
        Duration t = builder.timeout == null ? DEFAULT_TIMEOUT : builder.timeout;
        if (t.isNegative() || t.isZero()) {
            throw new ConfigurationException(id, "timeout must be positive, got " + t);
        }
        this.timeout = t;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public abstract TransportType getTransport();

    /**
     * Copy of this config with a different enabled flag.
     */
    public abstract ServerConfig withEnabled(boolean enabled);

    public static StdioServerConfig.Builder stdio() {
        return new StdioServerConfig.Builder();
    }

    public static HttpServerConfig.Builder http() {
        return new HttpServerConfig.Builder();
    }

    public static SseServerConfig.Builder sse() {
        return new SseServerConfig.Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ServerConfig that = (ServerConfig) o;
        return enabled == that.enabled && id.equals(that.id) && name.equals(that.name) && timeout.equals(that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, enabled, timeout);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", name=" + name + ", enabled=" + enabled + "}";
    }

    @SuppressWarnings("unchecked")
    public abstract static class Builder<B extends Builder<B>> {
        private String id;
        private String name;
        private boolean enabled = true;
        private Duration timeout;
        private Function<String, String> environment = System::getenv;
        private boolean preResolved;

        public B id(String id) {
            this.id = id;
            return (B) this;
        }

        public B name(String name) {
            this.name = name;
            return (B) this;
        }

        public B enabled(boolean enabled) {
            this.enabled = enabled;
            return (B) this;
        }

        public B timeout(Duration timeout) {
            this.timeout = timeout;
            return (B) this;
        }

        /**
         * Placeholder lookup used while building. Defaults to the process environment.
         */
        public B environment(Map<String, String> environment) {
            Map<String, String> copy = Map.copyOf(environment);
            this.environment = copy::get;
            return (B) this;
        }

        /**
         * Marks values as already resolved, used when copying an existing config.
         */
        B preResolved() {
            this.preResolved = true;
            return (B) this;
        }

        String resolve(String value) {
            return preResolved ? value : EnvTemplates.resolve(value, environment);
        }

        Map<String, String> resolveValues(Map<String, String> values) {
            return preResolved ? Map.copyOf(values) : EnvTemplates.resolveValues(values, environment);
        }

        List<String> resolveAll(List<String> values) {
            return preResolved ? List.copyOf(values) : EnvTemplates.resolveAll(values, environment);
        }

        public abstract ServerConfig build();
    }
}
