package com.zzf.toolhost.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.toolhost.mcp.error.ConfigurationException;
import com.zzf.toolhost.mcp.gate.ConcurrencyGate;
import com.zzf.toolhost.mcp.gate.ToolAccessClass;
import com.zzf.toolhost.mcp.gate.ToolClassificationTable;
import com.zzf.toolhost.mcp.isolation.ErrorIsolator;
import com.zzf.toolhost.mcp.registry.ServerRegistry;
import com.zzf.toolhost.mcp.retry.RetryManager;
import com.zzf.toolhost.mcp.retry.Sleeper;
import com.zzf.toolhost.mcp.server.McpProviderConnector;
import com.zzf.toolhost.mcp.server.ProviderConnector;
import com.zzf.toolhost.mcp.status.StatusTracker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableConfigurationProperties(ToolHostProperties.class)
public class ToolHostConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock toolHostClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService mcpWorkers() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mcp-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public StatusTracker statusTracker(ToolHostProperties props, Clock clock) {
        return new StatusTracker(props.getEventCapacity(), clock);
    }

    @Bean
    public ErrorIsolator errorIsolator(ToolHostProperties props, Clock clock, MeterRegistry meterRegistry) {
        return new ErrorIsolator(props.toIsolationSettings(), clock, meterRegistry);
    }

    @Bean
    public RetryManager retryManager(ToolHostProperties props, ErrorIsolator errorIsolator,
                                     Clock clock, MeterRegistry meterRegistry) {
        return new RetryManager(props.toRetryPolicy(), errorIsolator::isCircuitOpen, Sleeper.THREAD, clock, meterRegistry);
    }

    @Bean
    public ConcurrencyGate concurrencyGate(ToolHostProperties props) {
        ToolAccessClass defaultClass = ToolAccessClass.fromString(props.getGate().getDefaultClass());
        return new ConcurrencyGate(new ToolClassificationTable(props.getGate().resolvedOverrides(), defaultClass));
    }

    @Bean
    @ConditionalOnMissingBean
    public ProviderConnector providerConnector(ToolHostProperties props) {
        return new McpProviderConnector(props.getClientName(), props.isLogTraffic());
    }

    @Bean(destroyMethod = "shutdown")
    public ServerRegistry serverRegistry(ProviderConnector connector,
                                         StatusTracker statusTracker,
                                         ErrorIsolator errorIsolator,
                                         RetryManager retryManager,
                                         ConcurrencyGate concurrencyGate,
                                         ExecutorService mcpWorkers,
                                         ObjectMapper objectMapper,
                                         ToolHostProperties props) {
        return new ServerRegistry(connector, statusTracker, errorIsolator, retryManager, concurrencyGate,
                mcpWorkers, objectMapper, props.toRegistrySettings());
    }

    /**
     * Registers the servers declared under toolhost.servers and optionally starts them.
     */
    @Bean
    public ApplicationRunner configuredServers(ServerRegistry registry, ToolHostProperties props) {
        return args -> {
            int registered = 0;
            for (ToolHostProperties.Server server : props.getServers()) {
                try {
                    registry.register(server.toConfig());
                    registered++;
                } catch (ConfigurationException e) {
                    log.error("toolhost.config.invalid name={} err={}", server.getName(), e.getMessage());
                }
            }
            log.info("toolhost.config.loaded servers={} autoStart={}", registered, props.isAutoStart());
            if (props.isAutoStart() && registered > 0) {
                registry.startAll().forEach((id, report) ->
                        log.info("toolhost.autostart id={} success={} state={} msg={}",
                                id, report.isSuccess(), report.getState(), report.getMessage()));
            }
        };
    }
}
