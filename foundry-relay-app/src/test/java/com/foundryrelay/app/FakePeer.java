package com.foundryrelay.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Test stand-in for the game client: a real WebSocket client that records
 * inbound frames and can answer correlated requests.
 */
class FakePeer implements AutoCloseable {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();
    private final CompletableFuture<CloseStatus> closed = new CompletableFuture<>();
    private volatile Function<JsonNode, ObjectNode> responder;
    private WebSocketSession session;

    static FakePeer connect(int port, String id, String token) throws Exception {
        FakePeer peer = new FakePeer();
        StringBuilder uri = new StringBuilder("ws://127.0.0.1:").append(port).append("/ws");
        String sep = "?";
        if (id != null) {
            uri.append(sep).append("id=").append(URLEncoder.encode(id, StandardCharsets.UTF_8));
            sep = "&";
        }
        if (token != null) {
            uri.append(sep).append("token=").append(URLEncoder.encode(token, StandardCharsets.UTF_8));
        }
        peer.session = new StandardWebSocketClient().execute(peer.handler(), new WebSocketHttpHeaders(),
                URI.create(uri.toString())).get(5, TimeUnit.SECONDS);
        return peer;
    }

    /**
     * Answer every correlated request with the responder's frame; the
     * {@code requestId} is copied from the request.
     */
    FakePeer respondWith(Function<JsonNode, ObjectNode> responder) {
        this.responder = responder;
        return this;
    }

    JsonNode nextFrame() throws InterruptedException {
        return frames.poll(5, TimeUnit.SECONDS);
    }

    JsonNode nextFrameOfType(String type) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            JsonNode frame = frames.poll(deadline - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
            if (frame != null && type.equals(frame.path("type").asText())) {
                return frame;
            }
        }
        return null;
    }

    void send(String raw) throws Exception {
        session.sendMessage(new TextMessage(raw));
    }

    CloseStatus awaitClose() throws Exception {
        return closed.get(5, TimeUnit.SECONDS);
    }

    boolean isOpen() {
        return session.isOpen() && !closed.isDone();
    }

    @Override
    public void close() throws Exception {
        if (session.isOpen()) {
            session.close();
        }
    }

    private TextWebSocketHandler handler() {
        return new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession s, TextMessage message) throws Exception {
                JsonNode frame = MAPPER.readTree(message.getPayload());
                frames.add(frame);
                Function<JsonNode, ObjectNode> reply = responder;
                if (reply != null && frame.hasNonNull("requestId")) {
                    ObjectNode response = reply.apply(frame);
                    response.put("requestId", frame.get("requestId").asText());
                    s.sendMessage(new TextMessage(MAPPER.writeValueAsString(response)));
                }
            }

            @Override
            public void afterConnectionClosed(WebSocketSession s, CloseStatus status) {
                closed.complete(status);
            }
        };
    }
}
