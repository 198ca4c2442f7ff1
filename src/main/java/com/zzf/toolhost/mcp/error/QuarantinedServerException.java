package com.zzf.toolhost.mcp.error;

public class QuarantinedServerException extends ToolProviderException {

    public QuarantinedServerException(String serverId, String reason) {
        super("SERVER_QUARANTINED", serverId,
                "server " + serverId + " is quarantined (" + reason + "), clear quarantine before restart");
    }
}
