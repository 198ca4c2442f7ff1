package com.zzf.toolhost.mcp.error;

public class ProviderConnectionException extends ToolProviderException {

    public ProviderConnectionException(String serverId, String message) {
        super("PROVIDER_CONNECTION", serverId, message);
    }

    public ProviderConnectionException(String serverId, String message, Throwable cause) {
        super("PROVIDER_CONNECTION", serverId, message, cause);
    }
}
