package com.foundryrelay.gateway.protocol;

/**
 * Frame {@code type} values owned by the relay itself.
 */
public final class MessageTypes {

    private MessageTypes() {
    }

    public static final String PING = "ping";
    public static final String PONG = "pong";
    /** Welcome frame sent to a peer right after admission. */
    public static final String CONNECTED = "connected";
    /** Protocol error reply for frames that could not be parsed. */
    public static final String ERROR = "error";

    public static final String FIELD_TYPE = "type";
    public static final String FIELD_REQUEST_ID = "requestId";
    public static final String FIELD_ERROR = "error";
    public static final String FIELD_STATUS = "status";
}
