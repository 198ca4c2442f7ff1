package com.zzf.toolhost.mcp.config;

import com.zzf.toolhost.mcp.error.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider launched as a subprocess and spoken to over stdin/stdout.
 */
public final class StdioServerConfig extends ServerConfig {

    private final String command;
    private final List<String> args;
    private final Map<String, String> env;

    private StdioServerConfig(Builder builder) {
        super(builder);
        if (builder.command == null || builder.command.isBlank()) {
            throw new ConfigurationException(getId(), "stdio server '" + getName() + "' requires a command");
        }
        this.command = builder.command.trim();
        this.args = builder.resolveAll(builder.args);
        this.env = builder.resolveValues(builder.env);
    }

    @Override
    public TransportType getTransport() {
        return TransportType.STDIO;
    }

    public String getCommand() {
        return command;
    }

    public List<String> getArgs() {
        return args;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    /**
     * Command line as passed to the process launcher.
     */
    public List<String> commandLine() {
        List<String> out = new ArrayList<>();
        out.add(command);
        out.addAll(args);
        return out;
    }

    @Override
    public StdioServerConfig withEnabled(boolean enabled) {
        return new Builder()
                .id(getId())
                .name(getName())
                .timeout(getTimeout())
                .enabled(enabled)
                .command(command)
                .args(args)
                .env(env)
                .preResolved()
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        StdioServerConfig that = (StdioServerConfig) o;
        return command.equals(that.command) && args.equals(that.args) && env.equals(that.env);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), command, args, env);
    }

    public static final class Builder extends ServerConfig.Builder<Builder> {
        private String command;
        private final List<String> args = new ArrayList<>();
        private final Map<String, String> env = new LinkedHashMap<>();

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder args(List<String> args) {
            this.args.clear();
            if (args != null) {
                this.args.addAll(args);
            }
            return this;
        }

        public Builder arg(String arg) {
            this.args.add(arg);
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env.clear();
            if (env != null) {
                this.env.putAll(env);
            }
            return this;
        }

        public Builder env(String key, String value) {
            this.env.put(key, value);
            return this;
        }

        @Override
        public StdioServerConfig build() {
            return new StdioServerConfig(this);
        }
    }
}
