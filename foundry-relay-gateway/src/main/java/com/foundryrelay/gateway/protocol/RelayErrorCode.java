package com.foundryrelay.gateway.protocol;

/**
 * Every failure the relay can report. Admission codes end at the socket
 * boundary; per-request codes surface through the correlator's future.
 */
public enum RelayErrorCode {
    /** Connection id or credential missing from the handshake. */
    MISSING_IDENTITY,
    /** Credential rejected by the authentication gate. */
    INVALID_CREDENTIAL,
    /** No admitted peer to address. */
    NO_PEER_CONNECTED,
    /** The frame could not be written to the peer socket. */
    DELIVERY_FAILURE,
    /** The per-call deadline elapsed. */
    REQUEST_TIMEOUT,
    /** The periodic sweep found the request too old. */
    REQUEST_EXPIRED,
    /** The peer answered with an error indicator. */
    PEER_ERROR,
    /** An inbound frame could not be interpreted. */
    PROTOCOL_ERROR
}
