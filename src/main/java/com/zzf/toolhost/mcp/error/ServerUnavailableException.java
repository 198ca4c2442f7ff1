package com.zzf.toolhost.mcp.error;

import com.zzf.toolhost.mcp.server.ServerState;

/**
 * The server exists but is not in a state that accepts tool calls.
 */
public class ServerUnavailableException extends ToolProviderException {

    private final ServerState state;

    public ServerUnavailableException(String serverId, ServerState state) {
        super("SERVER_UNAVAILABLE", serverId, "server " + serverId + " is not available (state=" + state + ")");
        this.state = state;
    }

    public ServerUnavailableException(String serverId, ServerState state, String message) {
        super("SERVER_UNAVAILABLE", serverId, message);
        this.state = state;
    }

    public ServerState getState() {
        return state;
    }
}
