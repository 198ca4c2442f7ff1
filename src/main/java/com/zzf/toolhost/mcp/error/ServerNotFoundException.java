package com.zzf.toolhost.mcp.error;

public class ServerNotFoundException extends ToolProviderException {

    public ServerNotFoundException(String serverId) {
        super("SERVER_NOT_FOUND", serverId, "server not found: " + serverId);
    }
}
