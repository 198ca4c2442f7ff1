package com.zzf.toolhost;

import com.zzf.toolhost.mcp.registry.ServerRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.metrics.AutoConfigureMetrics;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@AutoConfigureMetrics
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class ToolHostApplicationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ServerRegistry registry;

    @Test
    public void testHealthEndpoint() {
        ResponseEntity<String> resp = restTemplate.getForEntity("http://localhost:" + port + "/actuator/health", String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertTrue(resp.getBody().contains("\"status\""));
    }

    @Test
    public void testPrometheusEndpoint() {
        ResponseEntity<String> resp = restTemplate.getForEntity("http://localhost:" + port + "/actuator/prometheus", String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertTrue(resp.getBody().contains("# TYPE"));
    }

    @Test
    public void testServerListStartsEmpty() {
        ResponseEntity<String> resp = restTemplate.getForEntity("http://localhost:" + port + "/api/mcp/servers", String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertEquals("[]", resp.getBody());
        assertTrue(registry.list().isEmpty());
    }

    @Test
    public void testUnknownServerIsNotFound() {
        ResponseEntity<String> resp = restTemplate.getForEntity("http://localhost:" + port + "/api/mcp/servers/ghost/summary", String.class);
        assertEquals(HttpStatus.NOT_FOUND, resp.getStatusCode());
        assertTrue(resp.getBody().contains("SERVER_NOT_FOUND"));
    }
}
