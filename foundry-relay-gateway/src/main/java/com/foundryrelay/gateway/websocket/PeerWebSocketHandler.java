package com.foundryrelay.gateway.websocket;

import com.foundryrelay.gateway.connection.AdmissionException;
import com.foundryrelay.gateway.connection.ConnectionRegistry;
import com.foundryrelay.gateway.connection.PeerConnection;
import com.foundryrelay.gateway.dispatch.MessageDispatcher;
import com.foundryrelay.gateway.protocol.RelayCloseCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Binds peer WebSocket sessions to the relay core. Admission runs once the
 * socket is open, using the id and token captured during the handshake.
 */
@Slf4j
public class PeerWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_CONNECTION_ID = "relay.connectionId";
    static final String ATTR_TOKEN = "relay.token";
    static final String ATTR_REMOTE_ADDR = "relay.remoteAddr";
    private static final String ATTR_PEER = "relay.peer";

    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final ConnectionRegistry registry;
    private final MessageDispatcher dispatcher;
    private final int sendBufferLimit;

    public PeerWebSocketHandler(ConnectionRegistry registry, MessageDispatcher dispatcher, int sendBufferLimit) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.sendBufferLimit = sendBufferLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var attrs = session.getAttributes();
        String connectionId = (String) attrs.get(ATTR_CONNECTION_ID);
        String token = (String) attrs.get(ATTR_TOKEN);
        log.debug("ws:in:open session={} conn={} remote={}", session.getId(), connectionId, attrs.get(ATTR_REMOTE_ADDR));

        WebSocketPeerChannel channel = new WebSocketPeerChannel(session, SEND_TIME_LIMIT_MS, sendBufferLimit);
        try {
            PeerConnection connection = registry.admit(connectionId, token, channel);
            attrs.put(ATTR_PEER, connection);
        } catch (AdmissionException e) {
            RelayCloseCode closeCode = e.closeCode();
            channel.close(closeCode.code(), closeCode.reason());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        PeerConnection connection = peer(session);
        if (connection == null) {
            return;
        }
        dispatcher.onFrame(connection, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        PeerConnection connection = peer(session);
        if (connection != null) {
            dispatcher.onError(connection, exception);
        } else {
            log.debug("ws:error session={}: {}", session.getId(), exception.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        PeerConnection connection = peer(session);
        if (connection != null) {
            dispatcher.onClose(connection, status.getCode(), status.getReason());
        }
    }

    private static PeerConnection peer(WebSocketSession session) {
        return (PeerConnection) session.getAttributes().get(ATTR_PEER);
    }
}
