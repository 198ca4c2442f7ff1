package com.zzf.toolhost.config;

import com.zzf.toolhost.mcp.config.ServerConfig;
import com.zzf.toolhost.mcp.config.TransportType;
import com.zzf.toolhost.mcp.error.ConfigurationException;
import com.zzf.toolhost.mcp.gate.ToolAccessClass;
import com.zzf.toolhost.mcp.isolation.IsolationSettings;
import com.zzf.toolhost.mcp.registry.RegistrySettings;
import com.zzf.toolhost.mcp.retry.BackoffStrategy;
import com.zzf.toolhost.mcp.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * toolhost.* 配置项.
 */
@ConfigurationProperties(prefix = "toolhost")
public class ToolHostProperties {
    private String clientName = "tool-host";
    private boolean logTraffic = false;
    private boolean autoStart = true;
    private int eventCapacity = 1000;
    private int eventRetentionDays = 7;
    private int diagnosticCapacity = 1000;
    private Duration startTimeout = Duration.ofSeconds(30);
    private Duration stopTimeout = Duration.ofSeconds(5);
    private Duration callTimeout = Duration.ofSeconds(60);
    private final Breaker breaker = new Breaker();
    private final Quarantine quarantine = new Quarantine();
    private final Retry retry = new Retry();
    private final Gate gate = new Gate();
    private List<Server> servers = new ArrayList<>();

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public boolean isLogTraffic() {
        return logTraffic;
    }

    public void setLogTraffic(boolean logTraffic) {
        this.logTraffic = logTraffic;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public int getEventCapacity() {
        return eventCapacity;
    }

    public void setEventCapacity(int eventCapacity) {
        this.eventCapacity = eventCapacity;
    }

    public int getEventRetentionDays() {
        return eventRetentionDays;
    }

    public void setEventRetentionDays(int eventRetentionDays) {
        this.eventRetentionDays = eventRetentionDays;
    }

    public int getDiagnosticCapacity() {
        return diagnosticCapacity;
    }

    public void setDiagnosticCapacity(int diagnosticCapacity) {
        this.diagnosticCapacity = diagnosticCapacity;
    }

    public Duration getStartTimeout() {
        return startTimeout;
    }

    public void setStartTimeout(Duration startTimeout) {
        this.startTimeout = startTimeout;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public void setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = stopTimeout;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public Quarantine getQuarantine() {
        return quarantine;
    }

    public Retry getRetry() {
        return retry;
    }

    public Gate getGate() {
        return gate;
    }

    public List<Server> getServers() {
        return servers;
    }

    public void setServers(List<Server> servers) {
        this.servers = servers == null ? new ArrayList<>() : servers;
    }

    public IsolationSettings toIsolationSettings() {
        return IsolationSettings.builder()
                .failureThreshold(breaker.failureThreshold)
                .windowSize(breaker.windowSize)
                .windowFailureThreshold(breaker.windowFailureThreshold)
                .openCooldown(breaker.openCooldown)
                .cooldownMultiplier(breaker.cooldownMultiplier)
                .maxOpenCooldown(breaker.maxOpenCooldown)
                .quarantineThreshold(quarantine.threshold)
                .build();
    }

    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.builder()
                .maxAttempts(retry.maxAttempts)
                .baseDelay(retry.baseDelay)
                .multiplier(retry.multiplier)
                .maxDelay(retry.maxDelay)
                .jitter(retry.jitter)
                .minDelay(retry.minDelay)
                .strategy(BackoffStrategy.fromString(retry.strategy))
                .build();
    }

    public RegistrySettings toRegistrySettings() {
        return RegistrySettings.builder()
                .startTimeout(startTimeout)
                .stopTimeout(stopTimeout)
                .callTimeout(callTimeout)
                .diagnosticCapacity(diagnosticCapacity)
                .build();
    }

    public static class Breaker {
        private int failureThreshold = 3;
        private int windowSize = 10;
        private int windowFailureThreshold = 5;
        private Duration openCooldown = Duration.ofSeconds(30);
        private double cooldownMultiplier = 2.0;
        private Duration maxOpenCooldown = Duration.ofMinutes(5);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public int getWindowFailureThreshold() {
            return windowFailureThreshold;
        }

        public void setWindowFailureThreshold(int windowFailureThreshold) {
            this.windowFailureThreshold = windowFailureThreshold;
        }

        public Duration getOpenCooldown() {
            return openCooldown;
        }

        public void setOpenCooldown(Duration openCooldown) {
            this.openCooldown = openCooldown;
        }

        public double getCooldownMultiplier() {
            return cooldownMultiplier;
        }

        public void setCooldownMultiplier(double cooldownMultiplier) {
            this.cooldownMultiplier = cooldownMultiplier;
        }

        public Duration getMaxOpenCooldown() {
            return maxOpenCooldown;
        }

        public void setMaxOpenCooldown(Duration maxOpenCooldown) {
            this.maxOpenCooldown = maxOpenCooldown;
        }
    }

    public static class Quarantine {
        private int threshold = 10;

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(30);
        private double jitter = 0.25;
        private Duration minDelay = Duration.ofMillis(100);
        private String strategy = "exponential_jitter";

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public Duration getMinDelay() {
            return minDelay;
        }

        public void setMinDelay(Duration minDelay) {
            this.minDelay = minDelay;
        }

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }
    }

    public static class Gate {
        private String defaultClass = "read";
        private Map<String, String> overrides = new LinkedHashMap<>();

        public String getDefaultClass() {
            return defaultClass;
        }

        public void setDefaultClass(String defaultClass) {
            this.defaultClass = defaultClass;
        }

        public Map<String, String> getOverrides() {
            return overrides;
        }

        public void setOverrides(Map<String, String> overrides) {
            this.overrides = overrides == null ? new LinkedHashMap<>() : overrides;
        }

        public Map<String, ToolAccessClass> resolvedOverrides() {
            Map<String, ToolAccessClass> out = new LinkedHashMap<>();
            overrides.forEach((tool, cls) -> out.put(tool, ToolAccessClass.fromString(cls)));
            return out;
        }
    }

    /**
     * One provider declared in configuration.
     */
    public static class Server {
        private String id;
        private String name;
        private String transport = "stdio";
        private boolean enabled = true;
        private Duration timeout;
        private String command;
        private List<String> args = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();
        private String url;
        private Map<String, String> headers = new LinkedHashMap<>();

        public ServerConfig toConfig() {
            TransportType type = TransportType.fromString(transport);
            if (type == null) {
                throw new ConfigurationException(id, "unknown transport '" + transport + "' for server " + name);
            }
            switch (type) {
                case HTTP:
                    return ServerConfig.http()
                            .id(id).name(name).enabled(enabled).timeout(timeout)
                            .url(url).headers(headers)
                            .build();
                case SSE:
                    return ServerConfig.sse()
                            .id(id).name(name).enabled(enabled).timeout(timeout)
                            .url(url).headers(headers)
                            .build();
                default:
                    return ServerConfig.stdio()
                            .id(id).name(name).enabled(enabled).timeout(timeout)
                            .command(command).args(args).env(env)
                            .build();
            }
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getTransport() {
            return transport;
        }

        public void setTransport(String transport) {
            this.transport = transport;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public List<String> getArgs() {
            return args;
        }

        public void setArgs(List<String> args) {
            this.args = args;
        }

        public Map<String, String> getEnv() {
            return env;
        }

        public void setEnv(Map<String, String> env) {
            this.env = env;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }
    }
}
