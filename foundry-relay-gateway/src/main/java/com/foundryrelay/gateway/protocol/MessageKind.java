package com.foundryrelay.gateway.protocol;

/**
 * How the relay core treats an inbound frame. Everything the core does not
 * own is an {@link #EVENT} or a {@link #CORRELATED} response; the payload of
 * either is never inspected beyond its {@code requestId}.
 */
public enum MessageKind {
    /** Liveness request; answered with {@code pong}. */
    PING,
    /** Liveness acknowledgment. */
    PONG,
    /** Carries a {@code requestId} and may settle a pending request. */
    CORRELATED,
    /** Unsolicited event from the peer. */
    EVENT
}
