package com.foundryrelay.gateway.protocol;

import lombok.Getter;

/**
 * Failure raised by the relay core, tagged with a {@link RelayErrorCode}.
 */
@Getter
public class RelayException extends RuntimeException {

    private final RelayErrorCode code;

    public RelayException(RelayErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RelayException(RelayErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
