package com.foundryrelay.gateway.correlation;

import com.foundryrelay.common.infra.MonotonicClock;
import com.foundryrelay.gateway.connection.ConnectionRegistry;
import com.foundryrelay.gateway.connection.PeerConnection;
import com.foundryrelay.gateway.protocol.RelayErrorCode;
import com.foundryrelay.gateway.protocol.RelayException;
import com.foundryrelay.gateway.protocol.RelayMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Sends requests to the primary peer and matches responses back to callers
 * by {@code requestId}.
 * <p>
 * Each pending request ends exactly once: by its response, its deadline, or
 * the sweep. Whichever removes the entry from the pending map first settles
 * the future; the others find nothing to do.
 */
@Slf4j
public class RequestCorrelator implements AutoCloseable {

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_SUFFIX_LENGTH = 7;

    private final ConnectionRegistry registry;
    private final LongSupplier clock;
    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "relay-request-timeout");
        t.setDaemon(true);
        return t;
    });

    public RequestCorrelator(ConnectionRegistry registry) {
        this(registry, MonotonicClock.SYSTEM);
    }

    public RequestCorrelator(ConnectionRegistry registry, LongSupplier clock) {
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Send {@code message} to the primary peer and return a future for its
     * response. A missing {@code requestId} is generated and written into
     * the message.
     * <p>
     * The future fails with a {@link RelayException} carrying
     * {@link RelayErrorCode#NO_PEER_CONNECTED}, {@link RelayErrorCode#DELIVERY_FAILURE},
     * {@link RelayErrorCode#REQUEST_TIMEOUT}, {@link RelayErrorCode#REQUEST_EXPIRED}
     * or {@link RelayErrorCode#PEER_ERROR}.
     *
     * @throws IllegalStateException if a request with the same id is already pending
     */
    public CompletableFuture<RelayMessage> enqueue(RelayMessage message, Duration timeout) {
        Optional<PeerConnection> primary = registry.primary();
        if (primary.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new RelayException(RelayErrorCode.NO_PEER_CONNECTED, "No FoundryVTT clients connected"));
        }

        String requestId = message.requestId();
        if (requestId == null) {
            requestId = generateRequestId();
            message.withRequestId(requestId);
        }

        PendingRequest entry = new PendingRequest(requestId, clock.getAsLong());
        if (pending.putIfAbsent(requestId, entry) != null) {
            throw new IllegalStateException("Request already pending: " + requestId);
        }

        long timeoutMs = timeout.toMillis();
        entry.timeoutTask = scheduler.schedule(
                () -> fail(entry, RelayErrorCode.REQUEST_TIMEOUT, "Request timeout after " + timeoutMs + "ms"),
                timeoutMs, TimeUnit.MILLISECONDS);

        PeerConnection target = primary.get();
        try {
            target.send(message);
            log.debug("relay:send conn={} type={} requestId={}", target.getId(), message.type(), requestId);
        } catch (IOException | RuntimeException e) {
            log.warn("relay:send failed conn={} requestId={}: {}", target.getId(), requestId, e.getMessage());
            fail(entry, RelayErrorCode.DELIVERY_FAILURE, "Failed to send message to FoundryVTT");
        }
        return entry.future;
    }

    /**
     * Complete the pending request matching {@code requestId}.
     *
     * @return false if nothing was pending under that id
     */
    public boolean resolve(String requestId, RelayMessage response) {
        if (requestId == null) {
            return false;
        }
        PendingRequest entry = pending.get(requestId);
        if (entry == null || !pending.remove(requestId, entry)) {
            return false;
        }
        entry.cancelTimer();

        if (response.isError()) {
            String text = response.errorText();
            entry.future.completeExceptionally(new RelayException(RelayErrorCode.PEER_ERROR,
                    text != null && !text.isEmpty() ? text : "Unknown error from peer"));
            log.debug("relay:resolve requestId={} error={}", requestId, text);
        } else {
            entry.future.complete(response);
            log.debug("relay:resolve requestId={}", requestId);
        }
        return true;
    }

    /**
     * Expire every pending request at least {@code maxAge} old.
     *
     * @return number of requests expired by this call
     */
    public int sweep(Duration maxAge) {
        long now = clock.getAsLong();
        long maxAgeMs = maxAge.toMillis();
        int expired = 0;
        for (PendingRequest entry : pending.values()) {
            if (now - entry.createdAt >= maxAgeMs
                    && fail(entry, RelayErrorCode.REQUEST_EXPIRED, "Request expired during cleanup")) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("relay:sweep expired={} remaining={}", expired, pending.size());
        }
        return expired;
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(String requestId) {
        return requestId != null && pending.containsKey(requestId);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    static String generateRequestId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder("req_").append(System.currentTimeMillis()).append('_');
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }

    private boolean fail(PendingRequest entry, RelayErrorCode code, String message) {
        if (!pending.remove(entry.requestId, entry)) {
            return false;
        }
        entry.cancelTimer();
        entry.future.completeExceptionally(new RelayException(code, message));
        if (code == RelayErrorCode.REQUEST_TIMEOUT) {
            log.warn("relay:timeout requestId={}", entry.requestId);
        }
        return true;
    }

    private static final class PendingRequest {
        final String requestId;
        final long createdAt;
        final CompletableFuture<RelayMessage> future = new CompletableFuture<>();
        volatile ScheduledFuture<?> timeoutTask;

        PendingRequest(String requestId, long createdAt) {
            this.requestId = requestId;
            this.createdAt = createdAt;
        }

        void cancelTimer() {
            ScheduledFuture<?> task = timeoutTask;
            if (task != null) {
                task.cancel(false);
            }
        }
    }
}
