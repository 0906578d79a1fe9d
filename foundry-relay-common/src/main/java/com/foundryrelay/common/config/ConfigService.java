package com.foundryrelay.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads the relay's JSON configuration file.
 * <p>
 * {@code ${VAR}} and {@code ${VAR:-default}} references are resolved against
 * the environment before parsing. A missing or unreadable file yields the
 * built-in defaults. Results are cached briefly so hot paths can call
 * {@link #loadConfig()} freely.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_REF = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");
    private static final String CACHE_KEY = "relay";

    private final Path configPath;
    private final UnaryOperator<String> envLookup;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final LoadingCache<String, RelayConfig> cache;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        this(configPath, cacheTtl, System::getenv);
    }

    /**
     * @param envLookup resolves environment variable names; returns null when unset
     */
    public ConfigService(Path configPath, Duration cacheTtl, UnaryOperator<String> envLookup) {
        this.configPath = expandHome(configPath.toString());
        this.envLookup = envLookup;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build(key -> readConfig());
    }

    public RelayConfig loadConfig() {
        return cache.get(CACHE_KEY);
    }

    /**
     * Drop the cached copy and read the file again.
     */
    public RelayConfig reloadConfig() {
        cache.invalidate(CACHE_KEY);
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Expand a leading {@code ~} to the user home directory.
     */
    public static Path expandHome(String path) {
        if (path.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }

    private RelayConfig readConfig() {
        if (!Files.exists(configPath)) {
            log.info("config: {} not found, using defaults", configPath);
            return applyDefaults(new RelayConfig());
        }
        RelayConfig parsed;
        try {
            parsed = objectMapper.readValue(substituteEnvVars(Files.readString(configPath)), RelayConfig.class);
        } catch (IOException e) {
            log.error("config: failed to read {}, using defaults", configPath, e);
            return applyDefaults(new RelayConfig());
        }
        log.info("config: loaded {}", configPath);
        return applyDefaults(parsed != null ? parsed : new RelayConfig());
    }

    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_REF.matcher(raw);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = envLookup.apply(matcher.group(1));
            if (value == null) {
                value = matcher.group(2) != null ? matcher.group(2) : "";
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Fill in missing sections and replace out-of-range timings with their
     * defaults.
     */
    RelayConfig applyDefaults(RelayConfig config) {
        if (config.getGateway() == null) {
            config.setGateway(new RelayConfig.GatewayConfig());
        }
        if (config.getAuth() == null) {
            config.setAuth(new RelayConfig.AuthConfig());
        }

        RelayConfig.GatewayConfig gateway = config.getGateway();
        RelayConfig.GatewayConfig defaults = new RelayConfig.GatewayConfig();
        if (gateway.getRequestTimeoutMs() <= 0) {
            log.warn("config: gateway.requestTimeoutMs must be positive, using {}", defaults.getRequestTimeoutMs());
            gateway.setRequestTimeoutMs(defaults.getRequestTimeoutMs());
        }
        if (gateway.getSweepIntervalMs() <= 0) {
            log.warn("config: gateway.sweepIntervalMs must be positive, using {}", defaults.getSweepIntervalMs());
            gateway.setSweepIntervalMs(defaults.getSweepIntervalMs());
        }
        if (gateway.getSweepMaxAgeMs() <= 0) {
            log.warn("config: gateway.sweepMaxAgeMs must be positive, using {}", defaults.getSweepMaxAgeMs());
            gateway.setSweepMaxAgeMs(defaults.getSweepMaxAgeMs());
        }
        if (gateway.getSweepMaxAgeMs() < gateway.getRequestTimeoutMs()) {
            log.warn("config: gateway.sweepMaxAgeMs {} is below requestTimeoutMs, raising to {}",
                    gateway.getSweepMaxAgeMs(), gateway.getRequestTimeoutMs());
            gateway.setSweepMaxAgeMs(gateway.getRequestTimeoutMs());
        }
        if (gateway.getLivenessIntervalMs() <= 0) {
            log.warn("config: gateway.livenessIntervalMs must be positive, using {}", defaults.getLivenessIntervalMs());
            gateway.setLivenessIntervalMs(defaults.getLivenessIntervalMs());
        }
        if (gateway.getIdleAfterMs() <= 0) {
            log.warn("config: gateway.idleAfterMs must be positive, using {}", defaults.getIdleAfterMs());
            gateway.setIdleAfterMs(defaults.getIdleAfterMs());
        }
        if (gateway.getStaleAfterMs() < 0) {
            gateway.setStaleAfterMs(0);
        }
        if (gateway.getMaxTextMessageBytes() <= 0) {
            gateway.setMaxTextMessageBytes(defaults.getMaxTextMessageBytes());
        }
        return config;
    }
}
