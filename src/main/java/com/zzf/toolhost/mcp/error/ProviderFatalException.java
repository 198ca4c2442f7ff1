package com.zzf.toolhost.mcp.error;

/**
 * Explicit unrecoverable signal from a provider. Quarantines the server immediately.
 */
public class ProviderFatalException extends ToolProviderException {

    public ProviderFatalException(String serverId, String message) {
        super("PROVIDER_FATAL", serverId, message);
    }

    public ProviderFatalException(String serverId, String message, Throwable cause) {
        super("PROVIDER_FATAL", serverId, message, cause);
    }
}
