package com.foundryrelay.app.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.foundryrelay.gateway.connection.ConnectionRegistry;
import com.foundryrelay.gateway.protocol.RelayMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST facade over the peer. Each call becomes one outbound message whose
 * correlated response is returned as the body.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class RelayApiController {

    private final PeerCommandService commands;
    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;

    public RelayApiController(PeerCommandService commands, ConnectionRegistry registry, ObjectMapper objectMapper) {
        this.commands = commands;
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    // --- Entities & search ---

    @PostMapping("/search")
    public JsonNode search(@RequestBody(required = false) JsonNode body) {
        JsonNode query = field(body, "query");
        require(query, "Query parameter is required");
        return commands.send(RelayMessage.of("perform-search")
                .with("query", query)
                .with("filter", field(body, "filter")));
    }

    @GetMapping("/entity/{uuid}")
    public JsonNode getEntity(@PathVariable String uuid) {
        return commands.send(RelayMessage.of("get-entity").with("uuid", uuid));
    }

    @PostMapping("/entity")
    public JsonNode createEntity(@RequestBody(required = false) JsonNode body) {
        JsonNode type = field(body, "type");
        JsonNode data = field(body, "data");
        if (!isPresent(type) || !isPresent(data)) {
            throw new IllegalArgumentException("Type and data parameters are required");
        }
        return commands.send(RelayMessage.of("create-entity")
                .with("entityType", type)
                .with("data", data));
    }

    @PutMapping("/entity/{uuid}")
    public JsonNode updateEntity(@PathVariable String uuid, @RequestBody(required = false) JsonNode body) {
        JsonNode data = field(body, "data");
        require(data, "Data parameter is required");
        return commands.send(RelayMessage.of("update-entity")
                .with("uuid", uuid)
                .with("data", data));
    }

    @DeleteMapping("/entity/{uuid}")
    public JsonNode deleteEntity(@PathVariable String uuid) {
        return commands.send(RelayMessage.of("delete-entity").with("uuid", uuid));
    }

    // --- Dice ---

    @PostMapping("/roll")
    public JsonNode roll(@RequestBody(required = false) JsonNode body) {
        JsonNode formula = field(body, "formula");
        require(formula, "Formula parameter is required");
        return commands.send(RelayMessage.of("perform-roll")
                .with("formula", formula)
                .with("actor", field(body, "actor")));
    }

    @GetMapping("/rolls")
    public JsonNode rolls() {
        return commands.send(RelayMessage.of("get-rolls"));
    }

    // --- Macros & scripting ---

    @PostMapping("/macro/{uuid}")
    public JsonNode executeMacro(@PathVariable String uuid, @RequestBody(required = false) JsonNode body) {
        return commands.send(RelayMessage.of("execute-macro")
                .with("uuid", uuid)
                .with("args", field(body, "args")));
    }

    @GetMapping("/macros")
    public JsonNode macros() {
        return commands.send(RelayMessage.of("get-macros"));
    }

    @GetMapping("/hotbar")
    public JsonNode hotbar(@RequestParam(required = false) String page) {
        return commands.send(RelayMessage.of("get-hotbar").with("page", parsePage(page)));
    }

    @PostMapping("/execute")
    public JsonNode execute(@RequestBody(required = false) JsonNode body) {
        JsonNode code = field(body, "code");
        require(code, "Code parameter is required");
        return commands.send(RelayMessage.of("execute-js").with("script", code));
    }

    // --- World structure & selection ---

    @GetMapping("/structure")
    public JsonNode structure() {
        return commands.send(RelayMessage.of("get-structure"));
    }

    @GetMapping("/contents")
    public JsonNode contents(@RequestParam(required = false) String path) {
        return commands.send(RelayMessage.of("get-contents").with("path", path));
    }

    @GetMapping("/selected")
    public JsonNode selected() {
        return commands.send(RelayMessage.of("get-selected-entities"));
    }

    @PostMapping("/select")
    public JsonNode select(@RequestBody(required = false) JsonNode body) {
        return commands.send(RelayMessage.of("select-entities").with("criteria", field(body, "criteria")));
    }

    // --- Status ---

    /**
     * Connected peers. Does not require an API key.
     */
    @GetMapping("/status")
    public ObjectNode status() {
        List<String> clients = registry.listIds();
        ObjectNode node = objectMapper.createObjectNode();
        node.put("connectedClients", clients.size());
        var array = node.putArray("clients");
        for (String id : clients) {
            array.add(id);
        }
        node.put("status", clients.isEmpty() ? "no-clients" : "connected");
        node.put("timestamp", Instant.now().toString());
        return node;
    }

    // --- Helpers ---

    private static JsonNode field(JsonNode body, String name) {
        return body != null ? body.get(name) : null;
    }

    private static void require(JsonNode value, String message) {
        if (!isPresent(value)) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Absent, null, empty-string, false and zero all count as missing.
     */
    static boolean isPresent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0;
        }
        return true;
    }

    /**
     * Hotbar page from the query string; unparseable or zero means "current page".
     */
    static Integer parsePage(String page) {
        if (page == null || page.isBlank()) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(page.trim());
            return parsed != 0 ? parsed : null;
        } catch (NumberFormatException e) {
            log.debug("http:hotbar ignoring page={}", page);
            return null;
        }
    }
}
