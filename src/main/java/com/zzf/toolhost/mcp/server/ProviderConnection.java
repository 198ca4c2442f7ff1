package com.zzf.toolhost.mcp.server;

import java.util.List;

/**
 * An established session with one tool provider.
 * <p>
 * Calls block; {@link ManagedServer} bounds them with its own timeouts.
 */
public interface ProviderConnection extends AutoCloseable {

    List<ToolDescriptor> listTools() throws Exception;

    /**
     * @param argumentsJson JSON object with the tool arguments
     * @return the provider's textual result
     */
    String callTool(String toolName, String argumentsJson) throws Exception;

    /**
     * Graceful shutdown.
     */
    @Override
    void close() throws Exception;

    /**
     * Last resort after {@link #close()} did not finish in time.
     */
    default void terminate() {
    }
}
