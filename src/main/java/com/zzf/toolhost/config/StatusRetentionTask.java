package com.zzf.toolhost.config;

import com.zzf.toolhost.mcp.status.StatusTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期清理过期的服务事件.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatusRetentionTask {

    private final StatusTracker statusTracker;
    private final ToolHostProperties props;

    @Scheduled(fixedDelayString = "${toolhost.event-cleanup-interval:PT1H}",
            initialDelayString = "${toolhost.event-cleanup-interval:PT1H}")
    public void purgeExpiredEvents() {
        int removed = statusTracker.cleanupOldData(props.getEventRetentionDays());
        log.debug("status.retention days={} removed={}", props.getEventRetentionDays(), removed);
    }
}
