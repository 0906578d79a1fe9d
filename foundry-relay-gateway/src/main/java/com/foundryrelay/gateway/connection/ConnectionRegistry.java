package com.foundryrelay.gateway.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foundryrelay.common.infra.MonotonicClock;
import com.foundryrelay.common.logging.CredentialMask;
import com.foundryrelay.gateway.auth.CredentialValidator;
import com.foundryrelay.gateway.protocol.MessageTypes;
import com.foundryrelay.gateway.protocol.RelayCloseCode;
import com.foundryrelay.gateway.protocol.RelayErrorCode;
import com.foundryrelay.gateway.protocol.RelayMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Admitted peer connections keyed by connection id, in admission order.
 * <p>
 * Admission, supersession and primary selection are serialized under one
 * lock. A superseding connection keeps the slot of the one it replaces, so it
 * inherits that connection's position when choosing the primary.
 */
@Slf4j
public class ConnectionRegistry {

    static final String WELCOME_TEXT = "Successfully connected to Foundry relay server";

    private final CredentialValidator credentialValidator;
    private final ObjectMapper objectMapper;
    private final LongSupplier clock;
    private final Map<String, PeerConnection> connections = new LinkedHashMap<>();
    private final Object lock = new Object();

    public ConnectionRegistry(CredentialValidator credentialValidator, ObjectMapper objectMapper) {
        this(credentialValidator, objectMapper, MonotonicClock.SYSTEM);
    }

    public ConnectionRegistry(CredentialValidator credentialValidator, ObjectMapper objectMapper,
            LongSupplier clock) {
        this.credentialValidator = credentialValidator;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Validate and register a new peer socket. A live connection already
     * holding {@code connectionId} is closed with
     * {@link RelayCloseCode#SUPERSEDED} before the new one takes its place.
     *
     * @throws AdmissionException if the id or credential is missing, or the
     *                            credential is rejected
     */
    public PeerConnection admit(String connectionId, String credential, PeerChannel channel) {
        if (isBlank(connectionId) || isBlank(credential)) {
            log.warn("ws:reject channel={} reason=missing_identity", channel.id());
            throw new AdmissionException(RelayErrorCode.MISSING_IDENTITY, "Missing client ID or token");
        }
        if (!credentialValidator.isValid(credential)) {
            log.warn("ws:reject conn={} credential={} reason=invalid_credential",
                    connectionId, CredentialMask.mask(credential));
            throw new AdmissionException(RelayErrorCode.INVALID_CREDENTIAL, "Invalid authentication token");
        }

        PeerConnection connection = new PeerConnection(connectionId, credential, channel, objectMapper, clock);
        PeerConnection previous;
        synchronized (lock) {
            previous = connections.put(connectionId, connection);
            connection.markAdmitted();
        }
        if (previous != null) {
            previous.close(RelayCloseCode.SUPERSEDED);
            log.info("ws:supersede conn={} old={} new={}", connectionId, previous.toString(), channel.id());
        }
        log.info("ws:admit conn={} channel={} credential={} live={}",
                connectionId, channel.id(), connection.getMaskedCredential(), size());

        sendWelcome(connection);
        return connection;
    }

    /**
     * Drop the entry for {@code connectionId}, whichever connection holds it.
     */
    public void remove(String connectionId) {
        PeerConnection removed;
        synchronized (lock) {
            removed = connections.remove(connectionId);
        }
        if (removed != null) {
            removed.markClosed();
            log.info("ws:remove conn={} live={}", connectionId, size());
        }
    }

    /**
     * Drop {@code connection} only if it still holds its id.
     *
     * @return true if the entry was removed
     */
    public boolean release(PeerConnection connection) {
        boolean removed;
        synchronized (lock) {
            removed = connections.remove(connection.getId(), connection);
        }
        if (removed) {
            log.info("ws:release conn={} live={}", connection.getId(), size());
        }
        return removed;
    }

    /**
     * Ids of live connections in admission order.
     */
    public List<String> listIds() {
        synchronized (lock) {
            List<String> ids = new ArrayList<>(connections.size());
            for (PeerConnection connection : connections.values()) {
                if (connection.isOpen()) {
                    ids.add(connection.getId());
                }
            }
            return ids;
        }
    }

    /**
     * The oldest surviving connection by admission order.
     */
    public Optional<PeerConnection> primary() {
        synchronized (lock) {
            for (PeerConnection connection : connections.values()) {
                if (connection.isOpen()) {
                    return Optional.of(connection);
                }
            }
            return Optional.empty();
        }
    }

    public Optional<PeerConnection> get(String connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(connections.get(connectionId));
        }
    }

    public boolean isConnected(String connectionId) {
        return get(connectionId).map(PeerConnection::isOpen).orElse(false);
    }

    public int size() {
        synchronized (lock) {
            return connections.size();
        }
    }

    /**
     * Snapshot of registered connections in admission order.
     */
    public List<PeerConnection> connections() {
        synchronized (lock) {
            return new ArrayList<>(connections.values());
        }
    }

    /**
     * Best-effort send to every live connection except {@code excludeConnectionId}.
     *
     * @return number of connections the message was written to
     */
    public int broadcast(RelayMessage message, String excludeConnectionId) {
        int delivered = 0;
        for (PeerConnection connection : connections()) {
            if (connection.getId().equals(excludeConnectionId) || !connection.isOpen()) {
                continue;
            }
            if (trySend(connection, message)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * @return false if the connection is unknown, closed, or the write failed
     */
    public boolean sendTo(String connectionId, RelayMessage message) {
        Optional<PeerConnection> connection = get(connectionId);
        if (connection.isEmpty() || !connection.get().isOpen()) {
            return false;
        }
        return trySend(connection.get(), message);
    }

    private void sendWelcome(PeerConnection connection) {
        RelayMessage welcome = RelayMessage.of(MessageTypes.CONNECTED)
                .with("message", WELCOME_TEXT)
                .with("timestamp", Instant.now().toString());
        trySend(connection, welcome);
    }

    private boolean trySend(PeerConnection connection, RelayMessage message) {
        try {
            connection.send(message);
            return true;
        } catch (IOException e) {
            log.warn("ws:send failed conn={} type={}: {}", connection.getId(), message.type(), e.getMessage());
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
