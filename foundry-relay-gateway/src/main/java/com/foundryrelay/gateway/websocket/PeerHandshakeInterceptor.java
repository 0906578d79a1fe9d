package com.foundryrelay.gateway.websocket;

import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies the {@code id} and {@code token} query parameters into the session
 * attributes. The handshake is never refused here; admission decides once the
 * socket is open so the peer receives a close code.
 */
public class PeerHandshakeInterceptor implements HandshakeInterceptor {

    @Override
    public boolean beforeHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @NonNull Map<String, Object> attributes) {
        Map<String, String> params = parseQuery(request.getURI().getRawQuery());
        String id = params.get("id");
        if (id != null) {
            attributes.put(PeerWebSocketHandler.ATTR_CONNECTION_ID, id);
        }
        String token = params.get("token");
        if (token != null) {
            attributes.put(PeerWebSocketHandler.ATTR_TOKEN, token);
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote != null && remote.getAddress() != null) {
            attributes.put(PeerWebSocketHandler.ATTR_REMOTE_ADDR, remote.getAddress().getHostAddress());
        }
        return true;
    }

    @Override
    public void afterHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @Nullable Exception exception) {
    }

    /**
     * Decode a raw query string. The first occurrence of a name wins; pairs
     * without {@code =} are ignored.
     */
    static Map<String, String> parseQuery(@Nullable String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            params.putIfAbsent(name, value);
        }
        return params;
    }
}
