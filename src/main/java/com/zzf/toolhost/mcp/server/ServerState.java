package com.zzf.toolhost.mcp.server;

import java.util.EnumSet;
import java.util.Set;

/**
 * 服务器生命周期状态. 所有变更都必须经过 {@link #canTransitionTo(ServerState)} 校验.
 */
public enum ServerState {
    STOPPED,
    STARTING,
    RUNNING,
    STOPPING,
    ERROR,
    QUARANTINED;

    private Set<ServerState> next;

    static {
        STOPPED.next = EnumSet.of(STARTING, QUARANTINED);
        STARTING.next = EnumSet.of(RUNNING, ERROR);
        RUNNING.next = EnumSet.of(STOPPING, ERROR);
        STOPPING.next = EnumSet.of(STOPPED);
        ERROR.next = EnumSet.of(STARTING, STOPPING, QUARANTINED);
        QUARANTINED.next = EnumSet.of(STOPPED);
    }

    public boolean canTransitionTo(ServerState target) {
        return target != null && next.contains(target);
    }

    public String label() {
        return name().toLowerCase();
    }
}
