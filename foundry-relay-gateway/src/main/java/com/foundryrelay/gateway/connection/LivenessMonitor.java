package com.foundryrelay.gateway.connection;

import com.foundryrelay.gateway.protocol.MessageTypes;
import com.foundryrelay.gateway.protocol.RelayCloseCode;
import com.foundryrelay.gateway.protocol.RelayMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Periodic liveness pass over the registry. Quiet connections are marked
 * {@link ConnectionState#IDLE} and pinged; when a stale threshold is set,
 * connections that have not exchanged a ping or pong within it are closed.
 */
@Slf4j
public class LivenessMonitor {

    private final ConnectionRegistry registry;
    private final long idleAfterMs;
    private final long staleAfterMs;

    /**
     * @param staleAfterMs 0 disables stale closing
     */
    public LivenessMonitor(ConnectionRegistry registry, long idleAfterMs, long staleAfterMs) {
        if (idleAfterMs <= 0) {
            throw new IllegalArgumentException("idleAfterMs must be positive");
        }
        this.registry = registry;
        this.idleAfterMs = idleAfterMs;
        this.staleAfterMs = Math.max(0, staleAfterMs);
    }

    public CheckResult check() {
        int pinged = 0;
        int closed = 0;
        for (PeerConnection connection : registry.connections()) {
            if (!connection.isOpen()) {
                continue;
            }
            if (staleAfterMs > 0 && connection.livenessAgeMillis() >= staleAfterMs) {
                log.warn("ws:stale conn={} livenessAgeMs={}", connection.getId(), connection.livenessAgeMillis());
                connection.close(RelayCloseCode.STALE);
                registry.release(connection);
                closed++;
                continue;
            }
            if (connection.idleMillis() >= idleAfterMs) {
                if (connection.markIdle()) {
                    log.debug("ws:idle conn={}", connection.getId());
                }
                try {
                    connection.send(RelayMessage.of(MessageTypes.PING));
                    pinged++;
                } catch (IOException e) {
                    log.warn("ws:ping failed conn={}: {}", connection.getId(), e.getMessage());
                }
            }
        }
        if (pinged > 0 || closed > 0) {
            log.debug("liveness: pinged={} closed={}", pinged, closed);
        }
        return new CheckResult(pinged, closed);
    }

    public record CheckResult(int pinged, int closed) {
    }
}
