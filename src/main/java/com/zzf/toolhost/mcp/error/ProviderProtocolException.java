package com.zzf.toolhost.mcp.error;

/**
 * Malformed or unexpected response from a provider.
 */
public class ProviderProtocolException extends ToolProviderException {

    public ProviderProtocolException(String serverId, String message) {
        super("PROVIDER_PROTOCOL", serverId, message);
    }

    public ProviderProtocolException(String serverId, String message, Throwable cause) {
        super("PROVIDER_PROTOCOL", serverId, message, cause);
    }
}
