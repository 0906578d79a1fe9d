package com.foundryrelay.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("config.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "gateway": {
                    "requestTimeoutMs": 5000,
                    "sweepMaxAgeMs": 90000
                  },
                  "auth": {
                    "keysFile": "/tmp/keys.json",
                    "createDefaultKey": false
                  }
                }
                """;
        Files.writeString(configPath, json);

        RelayConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(5000, config.getGateway().getRequestTimeoutMs());
        assertEquals(90_000, config.getGateway().getSweepMaxAgeMs());
        // untouched fields keep their defaults
        assertEquals(30_000, config.getGateway().getSweepIntervalMs());
        assertEquals("/tmp/keys.json", config.getAuth().getKeysFile());
        assertFalse(config.getAuth().isCreateDefaultKey());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        RelayConfig config = new ConfigService(tempDir.resolve("nonexistent.json")).loadConfig();

        assertNotNull(config.getGateway());
        assertNotNull(config.getAuth());
        assertEquals(30_000, config.getGateway().getRequestTimeoutMs());
        assertEquals(0, config.getGateway().getStaleAfterMs());
        assertTrue(config.getAuth().isCreateDefaultKey());
    }

    @Test
    void loadConfig_missingSection_isFilledIn() throws IOException {
        Files.writeString(configPath, "{ \"auth\": { \"logDefaultKey\": true } }");

        RelayConfig config = new ConfigService(configPath).loadConfig();

        assertNotNull(config.getGateway());
        assertTrue(config.getAuth().isLogDefaultKey());
    }

    @Test
    void loadConfig_invalidJson_fallsBackToDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        RelayConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(60_000, config.getGateway().getSweepMaxAgeMs());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        ConfigService service = new ConfigService(configPath);
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_withDefault_usesDefault() {
        ConfigService service = new ConfigService(configPath);
        String result = service.substituteEnvVars("${__UNLIKELY_RELAY_VAR_XYZ:-fallback}");
        assertEquals("fallback", result);
    }

    @Test
    void substituteEnvVars_prefersEnvironmentValue() throws IOException {
        Map<String, String> env = Map.of("RELAY_KEYS", "/srv/relay/keys.json");
        Files.writeString(configPath, "{ \"auth\": { \"keysFile\": \"${RELAY_KEYS:-/tmp/unused.json}\" } }");

        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), env::get);

        assertEquals("/srv/relay/keys.json", service.loadConfig().getAuth().getKeysFile());
    }

    @Test
    void substituteEnvVars_unsetWithoutDefault_becomesEmpty() {
        ConfigService service = new ConfigService(configPath, Duration.ofMillis(200), name -> null);
        assertEquals("a--b", service.substituteEnvVars("a-${MISSING}-b"));
    }

    @Test
    void loadConfig_nonPositiveTimingsRevertToDefaults() throws IOException {
        Files.writeString(configPath, """
                { "gateway": { "requestTimeoutMs": 0, "sweepIntervalMs": -5, "staleAfterMs": -1, "idleAfterMs": 2000 } }
                """);

        RelayConfig.GatewayConfig gateway = new ConfigService(configPath).loadConfig().getGateway();

        assertEquals(30_000, gateway.getRequestTimeoutMs());
        assertEquals(30_000, gateway.getSweepIntervalMs());
        assertEquals(0, gateway.getStaleAfterMs());
        assertEquals(2000, gateway.getIdleAfterMs());
    }

    @Test
    void loadConfig_sweepMaxAgeNeverUndercutsRequestTimeout() throws IOException {
        Files.writeString(configPath, "{ \"gateway\": { \"requestTimeoutMs\": 120000 } }");

        RelayConfig.GatewayConfig gateway = new ConfigService(configPath).loadConfig().getGateway();

        assertEquals(120_000, gateway.getRequestTimeoutMs());
        assertEquals(120_000, gateway.getSweepMaxAgeMs());
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, "{ \"gateway\": { \"requestTimeoutMs\": 1000 } }");

        ConfigService service = new ConfigService(configPath);
        RelayConfig first = service.loadConfig();
        RelayConfig second = service.loadConfig();

        assertSame(first, second);
    }

    @Test
    void reloadConfig_picksUpChanges() throws IOException {
        Files.writeString(configPath, "{ \"gateway\": { \"requestTimeoutMs\": 1000 } }");
        ConfigService service = new ConfigService(configPath);
        assertEquals(1000, service.loadConfig().getGateway().getRequestTimeoutMs());

        Files.writeString(configPath, "{ \"gateway\": { \"requestTimeoutMs\": 2000 } }");
        assertEquals(2000, service.reloadConfig().getGateway().getRequestTimeoutMs());
    }

    @Test
    void expandHome_replacesTilde() {
        Path expanded = ConfigService.expandHome("~/relay/config.json");
        assertEquals(Path.of(System.getProperty("user.home"), "relay", "config.json"), expanded);
        assertEquals(Path.of("/etc/relay.json"), ConfigService.expandHome("/etc/relay.json"));
    }
}
