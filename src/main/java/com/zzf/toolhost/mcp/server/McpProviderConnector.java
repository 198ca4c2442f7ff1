package com.zzf.toolhost.mcp.server;

import com.zzf.toolhost.mcp.config.RemoteServerConfig;
import com.zzf.toolhost.mcp.config.ServerConfig;
import com.zzf.toolhost.mcp.config.StdioServerConfig;
import com.zzf.toolhost.mcp.error.ConfigurationException;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.mcp.client.DefaultMcpClient;
import dev.langchain4j.mcp.client.McpClient;
import dev.langchain4j.mcp.client.transport.McpTransport;
import dev.langchain4j.mcp.client.transport.http.HttpMcpTransport;
import dev.langchain4j.mcp.client.transport.http.StreamableHttpMcpTransport;
import dev.langchain4j.mcp.client.transport.stdio.StdioMcpTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 基于 langchain4j-mcp 的连接器, 支持 stdio / streamable http / sse 三种传输.
 */
@Slf4j
public class McpProviderConnector implements ProviderConnector {

    private final String clientName;
    private final boolean logTraffic;

    public McpProviderConnector(String clientName, boolean logTraffic) {
        this.clientName = clientName;
        this.logTraffic = logTraffic;
        StderrCapture.install();
    }

    @Override
    public ProviderConnection connect(ServerConfig config, DiagnosticSink diagnostics) {
        McpTransport transport = createTransport(config);
        log.info("mcp.connect id={} name={} transport={}", config.getId(), config.getName(), config.getTransport());
        // the stdio transport starts its stderr reader while the client initializes
        try (StderrCapture.Binding ignored = StderrCapture.bind(diagnostics)) {
            McpClient client = new DefaultMcpClient.Builder()
                    .key(config.getId())
                    .clientName(clientName)
                    .transport(transport)
                    .initializationTimeout(config.getTimeout())
                    .toolExecutionTimeout(config.getTimeout())
                    .logHandler(message -> diagnostics.accept(
                            "[" + message.level() + "] " + (message.logger() == null ? "" : message.logger() + ": ") + message.data()))
                    .build();
            return new McpProviderConnection(config.getId(), client, transport);
        }
    }

    McpTransport createTransport(ServerConfig config) {
        switch (config.getTransport()) {
            case STDIO: {
                StdioServerConfig stdio = (StdioServerConfig) config;
                return new StdioMcpTransport.Builder()
                        .command(stdio.commandLine())
                        .environment(stdio.getEnv())
                        .logEvents(logTraffic)
                        .build();
            }
            case HTTP: {
                RemoteServerConfig remote = (RemoteServerConfig) config;
                return new StreamableHttpMcpTransport.Builder()
                        .url(remote.getUrl())
                        .customHeaders(remote.getHeaders())
                        .timeout(config.getTimeout())
                        .logRequests(logTraffic)
                        .logResponses(logTraffic)
                        .build();
            }
            case SSE: {
                RemoteServerConfig remote = (RemoteServerConfig) config;
                return new HttpMcpTransport.Builder()
                        .sseUrl(remote.getUrl())
                        .customHeaders(remote.getHeaders())
                        .timeout(config.getTimeout())
                        .logRequests(logTraffic)
                        .logResponses(logTraffic)
                        .build();
            }
            default:
                throw new ConfigurationException(config.getId(), "unsupported transport: " + config.getTransport());
        }
    }

    static final class McpProviderConnection implements ProviderConnection {

        private final String serverId;
        private final McpClient client;
        private final McpTransport transport;

        McpProviderConnection(String serverId, McpClient client, McpTransport transport) {
            this.serverId = serverId;
            this.client = client;
            this.transport = transport;
        }

        @Override
        public List<ToolDescriptor> listTools() {
            List<ToolDescriptor> tools = new ArrayList<>();
            for (ToolSpecification spec : client.listTools()) {
                tools.add(new ToolDescriptor(spec.name(), spec.description()));
            }
            return tools;
        }

        @Override
        public String callTool(String toolName, String argumentsJson) {
            ToolExecutionRequest request = ToolExecutionRequest.builder()
                    .id(UUID.randomUUID().toString())
                    .name(toolName)
                    .arguments(argumentsJson)
                    .build();
            return client.executeTool(request);
        }

        @Override
        public void close() throws Exception {
            client.close();
        }

        @Override
        public void terminate() {
            try {
                transport.close();
            } catch (Exception e) {
                log.warn("mcp.terminate_failed id={} err={}", serverId, e.toString());
            }
        }
    }
}
