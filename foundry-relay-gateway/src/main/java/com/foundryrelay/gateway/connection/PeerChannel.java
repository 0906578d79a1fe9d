package com.foundryrelay.gateway.connection;

import java.io.IOException;

/**
 * Transport under a {@link PeerConnection}. Implementations must accept
 * concurrent {@link #send} calls without interleaving frames.
 */
public interface PeerChannel {

    /** Transport-level identifier, used in logs only. */
    String id();

    boolean isOpen();

    void send(String text) throws IOException;

    void close(int code, String reason);
}
