package com.foundryrelay.gateway.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foundryrelay.gateway.connection.ConnectionRegistry;
import com.foundryrelay.gateway.connection.PeerConnection;
import com.foundryrelay.gateway.correlation.RequestCorrelator;
import com.foundryrelay.gateway.protocol.MessageKind;
import com.foundryrelay.gateway.protocol.MessageTypes;
import com.foundryrelay.gateway.protocol.RelayMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Routes inbound peer frames: keepalive, correlated responses, and
 * unsolicited events. Also the single entry point for socket close and
 * transport errors.
 */
@Slf4j
public class MessageDispatcher {

    static final String INVALID_FORMAT = "Invalid message format";

    private final ConnectionRegistry registry;
    private final RequestCorrelator correlator;
    private final ObjectMapper objectMapper;

    public MessageDispatcher(ConnectionRegistry registry, RequestCorrelator correlator, ObjectMapper objectMapper) {
        this.registry = registry;
        this.correlator = correlator;
        this.objectMapper = objectMapper;
    }

    /**
     * Handle one text frame. Malformed frames get an error reply; the
     * connection stays open.
     */
    public void onFrame(PeerConnection connection, String rawFrame) {
        RelayMessage message;
        try {
            message = RelayMessage.parse(rawFrame, objectMapper);
        } catch (RelayMessage.MalformedFrameException e) {
            log.warn("ws:in:invalid conn={}: {}", connection.getId(), e.getMessage());
            reply(connection, RelayMessage.of(MessageTypes.ERROR).with(MessageTypes.FIELD_ERROR, INVALID_FORMAT));
            return;
        }

        connection.touchActivity();
        MessageKind kind = message.kind();
        log.debug("ws:in conn={} type={} kind={}", connection.getId(), message.type(), kind);

        switch (kind) {
            case PING -> {
                connection.touchLiveness();
                reply(connection, RelayMessage.of(MessageTypes.PONG));
            }
            case PONG -> connection.touchLiveness();
            case CORRELATED -> {
                if (!correlator.resolve(message.requestId(), message)) {
                    onEvent(connection, message);
                }
            }
            case EVENT -> onEvent(connection, message);
        }
    }

    /**
     * The socket closed, from either side.
     */
    public void onClose(PeerConnection connection, int code, String reason) {
        connection.markClosed();
        registry.release(connection);
        log.info("ws:close conn={} code={} reason={}", connection.getId(), code, reason);
    }

    /**
     * The transport reported an error. The connection is treated as gone.
     */
    public void onError(PeerConnection connection, Throwable cause) {
        log.warn("ws:error conn={}: {}", connection.getId(), cause.getMessage());
        connection.markClosed();
        registry.release(connection);
    }

    private void onEvent(PeerConnection connection, RelayMessage message) {
        log.debug("ws:event conn={} type={} requestId={} (unhandled)",
                connection.getId(), message.type(), message.requestId());
    }

    private void reply(PeerConnection connection, RelayMessage message) {
        try {
            connection.send(message);
        } catch (IOException e) {
            log.warn("ws:reply failed conn={} type={}: {}", connection.getId(), message.type(), e.getMessage());
        }
    }
}
