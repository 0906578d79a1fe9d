package com.foundryrelay.gateway.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.foundryrelay.common.infra.JsonFile;
import com.foundryrelay.common.logging.CredentialMask;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Managed API key store, persisted as a JSON array in a single file.
 * <p>
 * Keys are looked up by their full value. Revoked keys stay in the file
 * (inactive) until deleted.
 */
@Slf4j
public class ApiKeyManager implements AutoCloseable {

    public static final String KEY_PREFIX = "fvtt_";
    public static final String DEFAULT_KEY_NAME = "default-server";
    private static final int KEY_BYTES = 32;
    private static final TypeReference<List<ApiKey>> KEY_LIST = new TypeReference<>() {
    };

    private final Path keysFile;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ApiKey> keys = new LinkedHashMap<>();
    private final ExecutorService persistExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "api-key-persist");
        t.setDaemon(true);
        return t;
    });

    public ApiKeyManager(Path keysFile) {
        this(keysFile, Clock.systemUTC());
    }

    public ApiKeyManager(Path keysFile, Clock clock) {
        this.keysFile = keysFile;
        this.clock = clock;
    }

    /**
     * Load keys from disk. When the file does not exist and
     * {@code createDefaultKey} is set, a {@value #DEFAULT_KEY_NAME} key is
     * generated and announced in the log.
     *
     * @return the default key if one was created
     */
    public Optional<ApiKey> load(boolean createDefaultKey, boolean logDefaultKey) {
        lock.lock();
        try {
            List<ApiKey> stored;
            try {
                stored = JsonFile.read(keysFile, KEY_LIST);
            } catch (IOException e) {
                log.error("Failed to load API keys from {}: {}", keysFile, e.getMessage());
                return Optional.empty();
            }
            keys.clear();
            if (stored != null) {
                for (ApiKey apiKey : stored) {
                    if (apiKey != null && apiKey.getKey() != null) {
                        keys.put(apiKey.getKey(), apiKey);
                    }
                }
                log.info("Loaded {} API key(s) from {}", keys.size(), keysFile);
                return Optional.empty();
            }
            if (!createDefaultKey) {
                log.info("No API key file at {}", keysFile);
                return Optional.empty();
            }
            ApiKey created = generate(DEFAULT_KEY_NAME, Map.of());
            log.info("Default API key created: {}",
                    logDefaultKey ? created.getKey() : CredentialMask.mask(created.getKey()));
            if (!logDefaultKey) {
                log.info("Full key is stored in {}", keysFile);
            }
            return Optional.of(created);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Generate and persist a new active key.
     */
    public ApiKey generate(String name, Map<String, Object> metadata) {
        byte[] bytes = new byte[KEY_BYTES];
        random.nextBytes(bytes);
        ApiKey apiKey = ApiKey.builder()
                .id(UUID.randomUUID().toString())
                .key(KEY_PREFIX + HexFormat.of().formatHex(bytes))
                .name(name)
                .createdAt(clock.instant().toString())
                .active(true)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .build();

        lock.lock();
        try {
            keys.put(apiKey.getKey(), apiKey);
            persist();
        } finally {
            lock.unlock();
        }
        return apiKey;
    }

    /**
     * True for a known, active key. A successful check stamps {@code lastUsed};
     * the file is updated in the background and a write failure does not
     * affect the result.
     */
    public boolean validate(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        lock.lock();
        try {
            ApiKey apiKey = keys.get(key);
            if (apiKey == null || !apiKey.isActive()) {
                return false;
            }
            apiKey.setLastUsed(clock.instant().toString());
        } finally {
            lock.unlock();
        }
        persistExecutor.execute(this::persistQuietly);
        return true;
    }

    /**
     * Mark a key inactive. Returns false for an unknown key.
     */
    public boolean revoke(String key) {
        lock.lock();
        try {
            ApiKey apiKey = keys.get(key);
            if (apiKey == null) {
                return false;
            }
            apiKey.setActive(false);
            persist();
            log.info("API key revoked: {}", CredentialMask.mask(key));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a key from the store entirely.
     */
    public boolean delete(String key) {
        lock.lock();
        try {
            if (keys.remove(key) == null) {
                return false;
            }
            persist();
            log.info("API key deleted: {}", CredentialMask.mask(key));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Issue a replacement with the same name and metadata and deactivate the
     * old key.
     */
    public Optional<ApiKey> rotate(String oldKey) {
        lock.lock();
        try {
            ApiKey existing = keys.get(oldKey);
            if (existing == null) {
                return Optional.empty();
            }
            ApiKey replacement = generate(existing.getName(), existing.getMetadata());
            existing.setActive(false);
            persist();
            log.info("API key rotated: {} -> {}",
                    CredentialMask.mask(oldKey), CredentialMask.mask(replacement.getKey()));
            return Optional.of(replacement);
        } finally {
            lock.unlock();
        }
    }

    /**
     * All keys with their values masked.
     */
    public List<ApiKey> list() {
        lock.lock();
        try {
            List<ApiKey> result = new ArrayList<>(keys.size());
            for (ApiKey apiKey : keys.values()) {
                result.add(apiKey.toBuilder().key(CredentialMask.mask(apiKey.getKey())).build());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public SecurityInfo securityInfo() {
        lock.lock();
        try {
            int active = (int) keys.values().stream().filter(ApiKey::isActive).count();
            return new SecurityInfo(keys.size(), active, keysFile.toString());
        } finally {
            lock.unlock();
        }
    }

    public Path getKeysFile() {
        return keysFile;
    }

    @Override
    public void close() {
        persistExecutor.shutdown();
        try {
            if (!persistExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                persistExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            persistExecutor.shutdownNow();
        }
    }

    // --- Persistence ---

    private void persist() {
        try {
            JsonFile.write(keysFile, new ArrayList<>(keys.values()));
        } catch (IOException e) {
            log.error("Failed to save API keys to {}: {}", keysFile, e.getMessage(), e);
        }
    }

    private void persistQuietly() {
        lock.lock();
        try {
            persist();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counters describing the key store.
     */
    public record SecurityInfo(int totalKeys, int activeKeys, String keysFile) {
    }
}
