package com.zzf.toolhost.mcp.status;

import com.zzf.toolhost.mcp.server.ServerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 服务器状态追踪 (状态, 启停时间, 元数据, 有界事件日志).
 * <p>
 * Safe under concurrent writers. Every read returns a copy, never a live reference.
 */
@Slf4j
public class StatusTracker {

    public static final int DEFAULT_EVENT_CAPACITY = 1000;
    public static final String STATE_CHANGE_EVENT = "state_change";

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final int eventCapacity;
    private final Clock clock;

    public StatusTracker() {
        this(DEFAULT_EVENT_CAPACITY, Clock.systemUTC());
    }

    public StatusTracker(int eventCapacity, Clock clock) {
        if (eventCapacity <= 0) {
            throw new IllegalArgumentException("eventCapacity must be positive");
        }
        this.eventCapacity = eventCapacity;
        this.clock = clock;
    }

    public void setStatus(String serverId, ServerState state) {
        Entry entry = entry(serverId);
        synchronized (entry) {
            ServerState previous = entry.state;
            entry.state = state;
            Instant now = clock.instant();
            if (state == ServerState.RUNNING) {
                entry.startTime = now;
                entry.stopTime = null;
            } else if (state == ServerState.STOPPED && entry.startTime != null) {
                entry.stopTime = now;
            }
            Map<String, Object> details = new HashMap<>();
            details.put("old_state", previous == null ? null : previous.label());
            details.put("new_state", state.label());
            appendEvent(entry, new ServerEvent(now, serverId, STATE_CHANGE_EVENT, nullSafe(details)));
        }
        log.debug("status.set id={} state={}", serverId, state);
    }

    /**
     * @return the current state, {@link ServerState#STOPPED} for servers never seen
     */
    public ServerState getStatus(String serverId) {
        Entry entry = entries.get(serverId);
        if (entry == null) {
            return ServerState.STOPPED;
        }
        synchronized (entry) {
            return entry.state == null ? ServerState.STOPPED : entry.state;
        }
    }

    /**
     * Elapsed time since the last start while running, the last start to stop span once
     * stopped, or {@code null} if the server was never started.
     */
    public Duration getUptime(String serverId) {
        Entry entry = entries.get(serverId);
        if (entry == null) {
            return null;
        }
        synchronized (entry) {
            return uptimeOf(entry);
        }
    }

    public void setMetadata(String serverId, String key, Object value) {
        Entry entry = entry(serverId);
        synchronized (entry) {
            if (value == null) {
                entry.metadata.remove(key);
            } else {
                entry.metadata.put(key, value);
            }
        }
    }

    public Object getMetadata(String serverId, String key) {
        Entry entry = entries.get(serverId);
        if (entry == null) {
            return null;
        }
        synchronized (entry) {
            return entry.metadata.get(key);
        }
    }

    public void recordEvent(String serverId, String eventType, Map<String, Object> details) {
        Entry entry = entry(serverId);
        synchronized (entry) {
            appendEvent(entry, new ServerEvent(clock.instant(), serverId, eventType, nullSafe(details)));
        }
    }

    /**
     * Most recent {@code limit} events, oldest first.
     */
    public List<ServerEvent> getEvents(String serverId, int limit) {
        Entry entry = entries.get(serverId);
        if (entry == null || limit <= 0) {
            return Collections.emptyList();
        }
        synchronized (entry) {
            int size = entry.events.size();
            int skip = Math.max(0, size - limit);
            List<ServerEvent> out = new ArrayList<>(size - skip);
            Iterator<ServerEvent> it = entry.events.iterator();
            for (int i = 0; it.hasNext(); i++) {
                ServerEvent event = it.next();
                if (i >= skip) {
                    out.add(event);
                }
            }
            return Collections.unmodifiableList(out);
        }
    }

    public List<ServerEvent> getEvents(String serverId) {
        return getEvents(serverId, eventCapacity);
    }

    /**
     * Drops events older than {@code days} days for every tracked server.
     *
     * @return number of events removed
     */
    public int cleanupOldData(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(Math.max(0, days)));
        int removed = 0;
        for (Entry entry : entries.values()) {
            synchronized (entry) {
                while (!entry.events.isEmpty() && entry.events.peekFirst().getTimestamp().isBefore(cutoff)) {
                    entry.events.pollFirst();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.info("status.cleanup removed={} cutoff={}", removed, cutoff);
        }
        return removed;
    }

    public ServerSummary getServerSummary(String serverId) {
        Entry entry = entries.get(serverId);
        if (entry == null) {
            return ServerSummary.builder()
                    .serverId(serverId)
                    .state(ServerState.STOPPED)
                    .metadata(Collections.emptyMap())
                    .build();
        }
        synchronized (entry) {
            ServerEvent last = entry.events.peekLast();
            return ServerSummary.builder()
                    .serverId(serverId)
                    .state(entry.state == null ? ServerState.STOPPED : entry.state)
                    .metadata(Collections.unmodifiableMap(new LinkedHashMap<>(entry.metadata)))
                    .uptime(uptimeOf(entry))
                    .startTime(entry.startTime)
                    .stopTime(entry.stopTime)
                    .recentEventsCount(entry.events.size())
                    .lastEventTime(last == null ? null : last.getTimestamp())
                    .build();
        }
    }

    public Set<String> getTrackedServers() {
        return Set.copyOf(entries.keySet());
    }

    /**
     * Forgets everything tracked for a server.
     */
    public void clear(String serverId) {
        entries.remove(serverId);
    }

    private Entry entry(String serverId) {
        if (serverId == null) {
            throw new IllegalArgumentException("serverId is null");
        }
        return entries.computeIfAbsent(serverId, k -> new Entry());
    }

    private void appendEvent(Entry entry, ServerEvent event) {
        if (entry.events.size() >= eventCapacity) {
            entry.events.pollFirst();
        }
        entry.events.addLast(event);
    }

    private Duration uptimeOf(Entry entry) {
        if (entry.startTime == null) {
            return null;
        }
        if (entry.state == ServerState.RUNNING || entry.stopTime == null) {
            return Duration.between(entry.startTime, clock.instant());
        }
        return Duration.between(entry.startTime, entry.stopTime);
    }

    private static Map<String, Object> nullSafe(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new HashMap<>();
        for (Map.Entry<String, Object> e : details.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    private static final class Entry {
        private ServerState state;
        private Instant startTime;
        private Instant stopTime;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final Deque<ServerEvent> events = new ArrayDeque<>();
    }
}
