package com.zzf.toolhost.mcp.error;

import java.time.Duration;

public class ProviderTimeoutException extends ToolProviderException {

    public ProviderTimeoutException(String serverId, String operation, Duration timeout) {
        super("PROVIDER_TIMEOUT", serverId,
                operation + " on server " + serverId + " timed out after " + timeout.toMillis() + " ms");
    }

    public ProviderTimeoutException(String serverId, String message, Throwable cause) {
        super("PROVIDER_TIMEOUT", serverId, message, cause);
    }
}
