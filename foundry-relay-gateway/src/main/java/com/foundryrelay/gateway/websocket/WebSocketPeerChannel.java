package com.foundryrelay.gateway.websocket;

import com.foundryrelay.gateway.connection.PeerChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link PeerChannel} over a Spring WebSocket session. Writes go through a
 * {@link ConcurrentWebSocketSessionDecorator} so callers on different threads
 * cannot interleave frames.
 */
@Slf4j
public class WebSocketPeerChannel implements PeerChannel {

    private final WebSocketSession session;

    public WebSocketPeerChannel(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    /**
     * Overflowing the send buffer or time limit, or writing to a session that
     * is closing, surfaces as an {@link IOException} like any other write failure.
     */
    @Override
    public void send(String text) throws IOException {
        try {
            session.sendMessage(new TextMessage(text));
        } catch (SessionLimitExceededException | IllegalStateException e) {
            throw new IOException("send failed on session " + session.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.debug("ws:close error session={}: {}", session.getId(), e.getMessage());
        }
    }
}
