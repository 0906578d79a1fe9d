package com.foundryrelay.gateway.connection;

/**
 * Lifecycle of a peer connection:
 * {@code CONNECTING -> ADMITTED -> (ACTIVE <-> IDLE) -> CLOSED}.
 */
public enum ConnectionState {
    CONNECTING,
    ADMITTED,
    ACTIVE,
    IDLE,
    CLOSED;

    public boolean isLive() {
        return this == ADMITTED || this == ACTIVE || this == IDLE;
    }
}
