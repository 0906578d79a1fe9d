package com.foundryrelay.gateway.websocket;

import com.foundryrelay.common.config.ConfigService;
import com.foundryrelay.common.config.RelayConfig;
import com.foundryrelay.gateway.connection.ConnectionRegistry;
import com.foundryrelay.gateway.dispatch.MessageDispatcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the peer endpoint at {@code /ws}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String PEER_PATH = "/ws";

    private final ConnectionRegistry registry;
    private final MessageDispatcher dispatcher;
    private final ConfigService configService;

    public WebSocketConfig(ConnectionRegistry registry, MessageDispatcher dispatcher, ConfigService configService) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.configService = configService;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry handlers) {
        handlers.addHandler(peerWebSocketHandler(), PEER_PATH)
                .addInterceptors(peerIdentityInterceptor())
                .setAllowedOrigins("*");
    }

    @Bean
    public PeerWebSocketHandler peerWebSocketHandler() {
        return new PeerWebSocketHandler(registry, dispatcher, gatewayConfig().getMaxTextMessageBytes());
    }

    @Bean
    public PeerHandshakeInterceptor peerIdentityInterceptor() {
        return new PeerHandshakeInterceptor();
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        int maxBytes = gatewayConfig().getMaxTextMessageBytes();
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxBytes);
        container.setMaxBinaryMessageBufferSize(maxBytes);
        return container;
    }

    private RelayConfig.GatewayConfig gatewayConfig() {
        return configService.loadConfig().getGateway();
    }
}
