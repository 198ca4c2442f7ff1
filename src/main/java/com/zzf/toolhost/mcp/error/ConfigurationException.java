package com.zzf.toolhost.mcp.error;

/**
 * Invalid server definition. Raised at construction or registration, never retried.
 */
public class ConfigurationException extends ToolProviderException {

    public ConfigurationException(String serverId, String message) {
        super("INVALID_CONFIG", serverId, message);
    }
}
