package com.zzf.toolhost.api;

import com.zzf.toolhost.mcp.error.QuarantinedServerException;
import com.zzf.toolhost.mcp.error.ServerNotFoundException;
import com.zzf.toolhost.mcp.gate.ToolAccessClass;
import com.zzf.toolhost.mcp.isolation.ErrorStats;
import com.zzf.toolhost.mcp.registry.GateStatus;
import com.zzf.toolhost.mcp.registry.OperationReport;
import com.zzf.toolhost.mcp.registry.ServerInfo;
import com.zzf.toolhost.mcp.registry.ServerRegistry;
import com.zzf.toolhost.mcp.retry.RetryStats;
import com.zzf.toolhost.mcp.server.ServerState;
import com.zzf.toolhost.mcp.server.ToolCallResult;
import com.zzf.toolhost.mcp.server.ToolDescriptor;
import com.zzf.toolhost.mcp.status.ServerEvent;
import com.zzf.toolhost.mcp.status.ServerSummary;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * MCP 服务器管理接口.
 */
@Slf4j
@RestController
@RequestMapping("/api/mcp/servers")
@RequiredArgsConstructor
public class McpServerController {

    private final ServerRegistry registry;

    @Data
    public static class ActionResult {
        private final String serverId;
        private final String action;
        private final boolean success;
        private final ServerState state;
    }

    @Data
    public static class ToolCallRequest {
        private Map<String, Object> arguments;
        private Long timeoutMs;
    }

    @GetMapping
    public List<ServerInfo> list() {
        return registry.list();
    }

    @GetMapping("/available")
    public List<String> available() {
        return registry.getAvailableServers();
    }

    @GetMapping("/retry-stats")
    public Map<String, RetryStats> allRetryStats() {
        return registry.getAllRetryStats();
    }

    @GetMapping("/gate")
    public Map<ToolAccessClass, GateStatus> gate() {
        return registry.getGateStatus();
    }

    @GetMapping("/{id}")
    public ServerInfo get(@PathVariable("id") String id) {
        return registry.getServerStatus(id).orElseThrow(() -> new ServerNotFoundException(id));
    }

    @GetMapping("/{id}/summary")
    public ServerSummary summary(@PathVariable("id") String id) {
        return registry.getServerSummary(id);
    }

    @GetMapping("/{id}/events")
    public List<ServerEvent> events(@PathVariable("id") String id,
                                    @RequestParam(value = "limit", defaultValue = "100") int limit) {
        return registry.getEvents(id, limit);
    }

    @GetMapping("/{id}/diagnostics")
    public List<String> diagnostics(@PathVariable("id") String id) {
        return registry.getCapturedDiagnostics(id);
    }

    @GetMapping("/{id}/errors")
    public ErrorStats errors(@PathVariable("id") String id) {
        return registry.getErrorStats(id);
    }

    @GetMapping("/{id}/retry-stats")
    public RetryStats retryStats(@PathVariable("id") String id) {
        return registry.getRetryStats(id);
    }

    @GetMapping("/{id}/tools")
    public List<ToolDescriptor> tools(@PathVariable("id") String id) {
        return registry.listTools(id);
    }

    @PostMapping("/{id}/tools/{tool}")
    public ToolCallResult callTool(@PathVariable("id") String id,
                                   @PathVariable("tool") String tool,
                                   @RequestBody(required = false) ToolCallRequest request) {
        Map<String, Object> args = request == null ? null : request.getArguments();
        Duration timeout = request == null || request.getTimeoutMs() == null
                ? null : Duration.ofMillis(request.getTimeoutMs());
        return registry.callTool(id, tool, args, timeout);
    }

    @PostMapping("/{id}/start")
    public ActionResult start(@PathVariable("id") String id) {
        ServerInfo info = get(id);
        if (info.isQuarantined()) {
            throw new QuarantinedServerException(id, info.getQuarantineReason());
        }
        return act(id, "start", registry::start);
    }

    @PostMapping("/{id}/stop")
    public ActionResult stop(@PathVariable("id") String id) {
        return act(id, "stop", registry::stop);
    }

    @PostMapping("/{id}/reload")
    public ActionResult reload(@PathVariable("id") String id) {
        ServerInfo info = get(id);
        if (info.isQuarantined()) {
            throw new QuarantinedServerException(id, info.getQuarantineReason());
        }
        return act(id, "reload", registry::reload);
    }

    @PostMapping("/{id}/enable")
    public ActionResult enable(@PathVariable("id") String id) {
        return act(id, "enable", registry::enable);
    }

    @PostMapping("/{id}/disable")
    public ActionResult disable(@PathVariable("id") String id) {
        return act(id, "disable", registry::disable);
    }

    @PostMapping("/{id}/clear-quarantine")
    public ActionResult clearQuarantine(@PathVariable("id") String id) {
        return act(id, "clear-quarantine", registry::clearQuarantine);
    }

    @PostMapping("/{id}/reset-circuit")
    public ActionResult resetCircuit(@PathVariable("id") String id) {
        return act(id, "reset-circuit", registry::resetCircuit);
    }

    @DeleteMapping("/{id}")
    public ActionResult remove(@PathVariable("id") String id) {
        get(id);
        boolean ok = registry.remove(id);
        return new ActionResult(id, "remove", ok, ServerState.STOPPED);
    }

    @PostMapping("/start-all")
    public Map<String, OperationReport> startAll() {
        return registry.startAll();
    }

    @PostMapping("/stop-all")
    public Map<String, OperationReport> stopAll() {
        return registry.stopAll();
    }

    private ActionResult act(String id, String action, Predicate<String> op) {
        get(id);
        boolean ok = op.test(id);
        log.info("api.{} id={} success={}", action, id, ok);
        ServerState state = registry.getServerStatus(id).map(ServerInfo::getState).orElse(null);
        return new ActionResult(id, action, ok, state);
    }
}
