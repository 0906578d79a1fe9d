package com.foundryrelay.gateway.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foundryrelay.common.logging.CredentialMask;
import com.foundryrelay.gateway.protocol.RelayCloseCode;
import com.foundryrelay.gateway.protocol.RelayMessage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * An admitted peer socket and its liveness bookkeeping.
 * <p>
 * All timestamps come from the registry's monotonic clock.
 */
@Slf4j
public class PeerConnection {

    @Getter
    private final String id;
    private final String credential;
    private final PeerChannel channel;
    private final ObjectMapper objectMapper;
    private final LongSupplier clock;
    @Getter
    private final long admittedAt;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile long lastActivity;
    private volatile long lastLiveness;

    public PeerConnection(String id, String credential, PeerChannel channel, ObjectMapper objectMapper,
            LongSupplier clock) {
        this.id = id;
        this.credential = credential;
        this.channel = channel;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.admittedAt = clock.getAsLong();
        this.lastActivity = admittedAt;
        this.lastLiveness = admittedAt;
    }

    /** The admission credential, masked for logging. */
    public String getMaskedCredential() {
        return CredentialMask.mask(credential);
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isOpen() {
        return !closed.get() && channel.isOpen();
    }

    /**
     * Serialize and write a message.
     *
     * @throws IOException if the connection is closed or the write fails
     */
    public void send(RelayMessage message) throws IOException {
        if (!isOpen()) {
            throw new IOException("connection " + id + " is closed");
        }
        channel.send(message.toJson(objectMapper));
        log.debug("ws:out conn={} type={} requestId={}", id, message.type(), message.requestId());
    }

    /**
     * Close the underlying socket with an application close code. Only the
     * first call has any effect.
     */
    public void close(RelayCloseCode code) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        enterClosed();
        try {
            channel.close(code.code(), code.reason());
        } catch (RuntimeException e) {
            log.warn("ws:close failed conn={} code={}: {}", id, code.code(), e.getMessage());
        }
    }

    /**
     * Record that the socket is gone without sending a close frame.
     */
    public void markClosed() {
        closed.set(true);
        enterClosed();
    }

    private synchronized void enterClosed() {
        state = ConnectionState.CLOSED;
    }

    boolean isClosed() {
        return closed.get();
    }

    synchronized void markAdmitted() {
        if (state == ConnectionState.CONNECTING) {
            state = ConnectionState.ADMITTED;
        }
    }

    /**
     * An inbound frame arrived.
     */
    public synchronized void touchActivity() {
        lastActivity = clock.getAsLong();
        if (state == ConnectionState.ADMITTED || state == ConnectionState.IDLE) {
            state = ConnectionState.ACTIVE;
        }
    }

    /**
     * A ping or pong arrived.
     */
    public void touchLiveness() {
        lastLiveness = clock.getAsLong();
    }

    /**
     * @return true if the state changed
     */
    synchronized boolean markIdle() {
        if (state == ConnectionState.ADMITTED || state == ConnectionState.ACTIVE) {
            state = ConnectionState.IDLE;
            return true;
        }
        return false;
    }

    public long idleMillis() {
        return clock.getAsLong() - lastActivity;
    }

    public long livenessAgeMillis() {
        return clock.getAsLong() - lastLiveness;
    }

    @Override
    public String toString() {
        return "PeerConnection{id=" + id + ", channel=" + channel.id() + ", state=" + state + "}";
    }
}
