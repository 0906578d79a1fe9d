package com.foundryrelay.gateway.protocol;

/**
 * Application close codes (4000-4999 range) sent to peer sockets.
 */
public enum RelayCloseCode {

    MISSING_IDENTITY(4001, "Missing client ID or token"),
    INVALID_CREDENTIAL(4002, "Invalid authentication token"),
    SUPERSEDED(4004, "Duplicate connection"),
    STALE(4008, "Liveness timeout");

    private final int code;
    private final String reason;

    RelayCloseCode(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public String reason() {
        return CloseReason.truncate(reason);
    }

    /**
     * Close code for a rejected admission.
     */
    public static RelayCloseCode forAdmissionFailure(RelayErrorCode error) {
        return switch (error) {
            case MISSING_IDENTITY -> MISSING_IDENTITY;
            case INVALID_CREDENTIAL -> INVALID_CREDENTIAL;
            default -> throw new IllegalArgumentException("not an admission error: " + error);
        };
    }
}
