package com.foundryrelay.app.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.foundryrelay.common.config.ConfigService;
import com.foundryrelay.gateway.correlation.RequestCorrelator;
import com.foundryrelay.gateway.protocol.RelayMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletionException;

/**
 * Blocking bridge from HTTP handlers to the peer: sends a message and waits
 * for the correlated response within the configured request timeout.
 */
@Slf4j
@Service
public class PeerCommandService {

    private final RequestCorrelator correlator;
    private final ConfigService configService;

    public PeerCommandService(RequestCorrelator correlator, ConfigService configService) {
        this.correlator = correlator;
        this.configService = configService;
    }

    /**
     * @return the peer's response frame
     * @throws com.foundryrelay.gateway.protocol.RelayException if the request
     *         could not be delivered or did not succeed in time
     */
    public JsonNode send(RelayMessage message) {
        Duration timeout = Duration.ofMillis(configService.loadConfig().getGateway().getRequestTimeoutMs());
        try {
            return correlator.enqueue(message, timeout).join().json();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
