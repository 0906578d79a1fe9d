package com.foundryrelay.gateway.connection;

import com.foundryrelay.gateway.protocol.RelayCloseCode;
import com.foundryrelay.gateway.protocol.RelayErrorCode;
import com.foundryrelay.gateway.protocol.RelayException;

/**
 * A peer socket was refused by {@link ConnectionRegistry#admit}.
 */
public class AdmissionException extends RelayException {

    public AdmissionException(RelayErrorCode code, String message) {
        super(code, message);
    }

    public RelayCloseCode closeCode() {
        return RelayCloseCode.forAdmissionFailure(getCode());
    }
}
