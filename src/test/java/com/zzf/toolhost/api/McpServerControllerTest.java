package com.zzf.toolhost.api;

import com.zzf.toolhost.mcp.error.CircuitOpenException;
import com.zzf.toolhost.mcp.gate.ToolAccessClass;
import com.zzf.toolhost.mcp.isolation.CircuitState;
import com.zzf.toolhost.mcp.registry.GateStatus;
import com.zzf.toolhost.mcp.registry.OperationReport;
import com.zzf.toolhost.mcp.registry.ServerInfo;
import com.zzf.toolhost.mcp.registry.ServerRegistry;
import com.zzf.toolhost.mcp.retry.RetryStats;
import com.zzf.toolhost.mcp.server.ServerState;
import com.zzf.toolhost.mcp.server.ToolCallResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(McpServerController.class)
class McpServerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ServerRegistry registry;

    private static ServerInfo info(String id, ServerState state, boolean quarantined) {
        return ServerInfo.builder()
                .id(id)
                .name(id)
                .transport("stdio")
                .enabled(true)
                .state(state)
                .quarantined(quarantined)
                .quarantineReason(quarantined ? "fatal error: token revoked" : null)
                .circuitState(CircuitState.CLOSED)
                .build();
    }

    @Test
    void shouldListServers() throws Exception {
        when(registry.list()).thenReturn(List.of(info("fs", ServerState.RUNNING, false)));

        mockMvc.perform(get("/api/mcp/servers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("fs"))
                .andExpect(jsonPath("$[0].state").value("RUNNING"));
    }

    @Test
    void shouldReturnNotFoundForUnknownServer() throws Exception {
        when(registry.getServerStatus("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/mcp/servers/ghost/start"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SERVER_NOT_FOUND"));
    }

    @Test
    void shouldExplainQuarantineOnStart() throws Exception {
        when(registry.getServerStatus("fs")).thenReturn(Optional.of(info("fs", ServerState.QUARANTINED, true)));

        mockMvc.perform(post("/api/mcp/servers/fs/start"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SERVER_QUARANTINED"));
        verify(registry, never()).start(anyString());
    }

    @Test
    void shouldStartServer() throws Exception {
        when(registry.getServerStatus("fs"))
                .thenReturn(Optional.of(info("fs", ServerState.STOPPED, false)))
                .thenReturn(Optional.of(info("fs", ServerState.RUNNING, false)));
        when(registry.start("fs")).thenReturn(true);

        mockMvc.perform(post("/api/mcp/servers/fs/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.state").value("RUNNING"));
    }

    @Test
    void shouldReportBulkStart() throws Exception {
        when(registry.startAll()).thenReturn(Map.of("fs", OperationReport.builder()
                .serverId("fs").success(false).state(ServerState.ERROR).message("connection refused").build()));

        mockMvc.perform(post("/api/mcp/servers/start-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fs.success").value(false))
                .andExpect(jsonPath("$.fs.state").value("ERROR"));
    }

    @Test
    void shouldCallToolAndMapBreakerRejection() throws Exception {
        when(registry.callTool(eq("fs"), eq("read_file"), any(), eq(Duration.ofMillis(2000))))
                .thenReturn(ToolCallResult.builder().serverId("fs").toolName("read_file").output("hello").durationMs(3).build());
        when(registry.callTool(eq("fs"), eq("grep"), any(), any()))
                .thenThrow(new CircuitOpenException("fs", 15_000L));

        mockMvc.perform(post("/api/mcp/servers/fs/tools/read_file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"arguments\":{\"path\":\"README.md\"},\"timeoutMs\":2000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value("hello"));

        mockMvc.perform(post("/api/mcp/servers/fs/tools/grep")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"arguments\":{}}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("CIRCUIT_OPEN"));
    }

    @Test
    void shouldExposeGateAndRetryStats() throws Exception {
        when(registry.getGateStatus()).thenReturn(Map.of(ToolAccessClass.WRITE, new GateStatus(true, 2)));
        when(registry.getAllRetryStats()).thenReturn(Map.of("*", RetryStats.builder().totalCalls(4).totalAttempts(6).build()));

        mockMvc.perform(get("/api/mcp/servers/gate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.WRITE.busy").value(true))
                .andExpect(jsonPath("$.WRITE.queueLength").value(2));

        mockMvc.perform(get("/api/mcp/servers/retry-stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['*'].totalAttempts").value(6))
                .andExpect(jsonPath("$['*'].averageAttempts").value(1.5));
    }

    @Test
    void shouldResetCircuit() throws Exception {
        when(registry.getServerStatus("fs")).thenReturn(Optional.of(info("fs", ServerState.RUNNING, false)));
        when(registry.resetCircuit("fs")).thenReturn(true);

        mockMvc.perform(post("/api/mcp/servers/fs/reset-circuit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(registry).resetCircuit("fs");
    }
}
