package com.foundryrelay.app.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.foundryrelay.gateway.connection.ConnectionRegistry;
import com.foundryrelay.gateway.correlation.RequestCorrelator;
import com.foundryrelay.gateway.websocket.WebSocketConfig;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Instant;

/**
 * Health probe and API index. Neither requires an API key.
 */
@RestController
public class HealthEndpoint {

    static final String VERSION = "1.0.0";

    private final ObjectMapper mapper;
    private final ConnectionRegistry registry;
    private final RequestCorrelator correlator;

    public HealthEndpoint(ObjectMapper mapper, ConnectionRegistry registry, RequestCorrelator correlator) {
        this.mapper = mapper;
        this.registry = registry;
        this.correlator = correlator;
    }

    /**
     * Liveness probe. Returns 200 while the JVM is serving requests.
     */
    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("timestamp", Instant.now().toString());
        node.put("version", VERSION);
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        var relay = node.putObject("relay");
        relay.put("connectedClients", registry.listIds().size());
        relay.put("pendingRequests", correlator.pendingCount());

        var memory = node.putObject("memory");
        Runtime rt = Runtime.getRuntime();
        memory.put("used_mb", (rt.totalMemory() - rt.freeMemory()) / (1024 * 1024));
        memory.put("max_mb", rt.maxMemory() / (1024 * 1024));
        return node;
    }

    @GetMapping("/api/docs")
    public ObjectNode docs() {
        var node = mapper.createObjectNode();
        node.put("message", "Foundry Relay Server API");
        node.put("version", VERSION);
        var endpoints = node.putArray("endpoints");
        endpoint(endpoints.addObject(), "GET", "/health", "Server health check");
        endpoint(endpoints.addObject(), "GET", "/api/docs", "API documentation");
        endpoint(endpoints.addObject(), "GET", "/api/status", "Connected clients (no API key)");
        endpoint(endpoints.addObject(), "POST", "/api/search", "Search entities");
        endpoint(endpoints.addObject(), "GET", "/api/entity/{uuid}", "Get entity by UUID");
        endpoint(endpoints.addObject(), "POST", "/api/entity", "Create entity");
        endpoint(endpoints.addObject(), "PUT", "/api/entity/{uuid}", "Update entity");
        endpoint(endpoints.addObject(), "DELETE", "/api/entity/{uuid}", "Delete entity");
        endpoint(endpoints.addObject(), "POST", "/api/roll", "Perform a dice roll");
        endpoint(endpoints.addObject(), "GET", "/api/rolls", "Recent rolls");
        endpoint(endpoints.addObject(), "POST", "/api/macro/{uuid}", "Execute a macro");
        endpoint(endpoints.addObject(), "GET", "/api/macros", "List macros");
        endpoint(endpoints.addObject(), "GET", "/api/hotbar", "Hotbar contents");
        endpoint(endpoints.addObject(), "GET", "/api/structure", "World folder structure");
        endpoint(endpoints.addObject(), "GET", "/api/contents", "Folder or compendium contents");
        endpoint(endpoints.addObject(), "GET", "/api/selected", "Selected tokens");
        endpoint(endpoints.addObject(), "POST", "/api/select", "Select tokens");
        endpoint(endpoints.addObject(), "POST", "/api/execute", "Execute JavaScript");
        endpoint(endpoints.addObject(), "WS", WebSocketConfig.PEER_PATH + "?id={id}&token={token}",
                "Peer connection endpoint");
        return node;
    }

    private static void endpoint(ObjectNode node, String method, String path, String description) {
        node.put("method", method);
        node.put("path", path);
        node.put("description", description);
    }
}
