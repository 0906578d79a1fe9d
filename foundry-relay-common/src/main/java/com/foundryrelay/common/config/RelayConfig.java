package com.foundryrelay.common.config;

import lombok.Data;

/**
 * Root configuration type for the relay.
 * Loaded from the JSON config file by {@link ConfigService}.
 */
@Data
public class RelayConfig {

    /** Peer socket, correlation and liveness settings. */
    private GatewayConfig gateway;

    /** Credential store settings. */
    private AuthConfig auth;

    // --- Nested config types ---

    @Data
    public static class GatewayConfig {
        /** Per-call timeout used by the REST facade when waiting on the peer. */
        private long requestTimeoutMs = 30_000;
        /** Interval between pending-request sweeps. */
        private long sweepIntervalMs = 30_000;
        /** Pending requests at least this old are force-expired by the sweep. */
        private long sweepMaxAgeMs = 60_000;
        /** Interval between liveness checks. */
        private long livenessIntervalMs = 5_000;
        /** A connection with no inbound frame for this long is idle and gets pinged. */
        private long idleAfterMs = 15_000;
        /** Close connections whose last ping/pong is older than this; 0 disables. */
        private long staleAfterMs = 0;
        /** Largest inbound text frame accepted by the WebSocket container. */
        private int maxTextMessageBytes = 10 * 1024 * 1024;
    }

    @Data
    public static class AuthConfig {
        /** API key store location; {@code ~} expands to the user home. */
        private String keysFile = "~/.foundry-relay/api-keys.json";
        /** Create a {@code default-server} key when the store file does not exist. */
        private boolean createDefaultKey = true;
        /** Print the generated default key in clear text instead of masked. */
        private boolean logDefaultKey = false;
    }
}
