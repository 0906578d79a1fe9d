package com.foundryrelay.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foundryrelay.common.config.ConfigService;
import com.foundryrelay.common.config.RelayConfig;
import com.foundryrelay.gateway.auth.ApiKeyManager;
import com.foundryrelay.gateway.auth.AuthService;
import com.foundryrelay.gateway.connection.ConnectionRegistry;
import com.foundryrelay.gateway.connection.LivenessMonitor;
import com.foundryrelay.gateway.correlation.RequestCorrelator;
import com.foundryrelay.gateway.dispatch.MessageDispatcher;
import com.foundryrelay.gateway.runtime.RelayMaintenance;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for relay core beans.
 */
@Configuration
public class GatewayBeanConfig {

    @Value("${relay.config.path:~/.foundry-relay/config.json}")
    private String configPath;

    /** Overrides {@code auth.keysFile} from the config file when set. */
    @Value("${relay.auth.keys-file:}")
    private String keysFileOverride;

    @Bean
    public ConfigService configService() {
        return new ConfigService(ConfigService.expandHome(configPath));
    }

    @Bean(destroyMethod = "close")
    public ApiKeyManager apiKeyManager(ConfigService configService) {
        RelayConfig.AuthConfig auth = configService.loadConfig().getAuth();
        String keysFile = keysFileOverride.isBlank() ? auth.getKeysFile() : keysFileOverride;
        ApiKeyManager manager = new ApiKeyManager(ConfigService.expandHome(keysFile));
        manager.load(auth.isCreateDefaultKey(), auth.isLogDefaultKey());
        return manager;
    }

    @Bean
    public AuthService authService(ApiKeyManager apiKeyManager) {
        return new AuthService(apiKeyManager);
    }

    @Bean
    public ConnectionRegistry connectionRegistry(AuthService authService, ObjectMapper objectMapper) {
        return new ConnectionRegistry(authService, objectMapper);
    }

    @Bean(destroyMethod = "close")
    public RequestCorrelator requestCorrelator(ConnectionRegistry connectionRegistry) {
        return new RequestCorrelator(connectionRegistry);
    }

    @Bean
    public MessageDispatcher messageDispatcher(ConnectionRegistry connectionRegistry,
            RequestCorrelator requestCorrelator, ObjectMapper objectMapper) {
        return new MessageDispatcher(connectionRegistry, requestCorrelator, objectMapper);
    }

    @Bean
    public LivenessMonitor livenessMonitor(ConnectionRegistry connectionRegistry, ConfigService configService) {
        RelayConfig.GatewayConfig gateway = configService.loadConfig().getGateway();
        return new LivenessMonitor(connectionRegistry, gateway.getIdleAfterMs(), gateway.getStaleAfterMs());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public RelayMaintenance relayMaintenance(RequestCorrelator requestCorrelator,
            LivenessMonitor livenessMonitor, ConfigService configService) {
        RelayConfig.GatewayConfig gateway = configService.loadConfig().getGateway();
        return new RelayMaintenance(requestCorrelator, livenessMonitor,
                gateway.getSweepIntervalMs(), gateway.getSweepMaxAgeMs(), gateway.getLivenessIntervalMs());
    }
}
