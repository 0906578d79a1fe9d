package com.foundryrelay.gateway.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foundryrelay.gateway.auth.WorldIdValidator;
import com.foundryrelay.gateway.connection.ConnectionRegistry;
import com.foundryrelay.gateway.protocol.RelayErrorCode;
import com.foundryrelay.gateway.protocol.RelayException;
import com.foundryrelay.gateway.protocol.RelayMessage;
import com.foundryrelay.gateway.support.FakePeerChannel;
import com.foundryrelay.gateway.support.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RequestCorrelatorTest {

    private static final Duration LONG = Duration.ofSeconds(30);

    private final ObjectMapper mapper = new ObjectMapper();
    private ManualClock clock;
    private ConnectionRegistry registry;
    private RequestCorrelator correlator;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        registry = new ConnectionRegistry(WorldIdValidator::isValid, mapper, clock);
        correlator = new RequestCorrelator(registry, clock);
    }

    @AfterEach
    void tearDown() {
        correlator.close();
    }

    private FakePeerChannel admitPeer(String id) {
        FakePeerChannel channel = new FakePeerChannel(id);
        registry.admit(id, "abcdefgh12", channel);
        channel.clearFrames();
        return channel;
    }

    private static RelayErrorCode failureCode(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        RelayException cause = assertInstanceOf(RelayException.class, e.getCause());
        return cause.getCode();
    }

    private RelayMessage response(String requestId) {
        return RelayMessage.of("roll-result").withRequestId(requestId).with("total", 14);
    }

    @Test
    void enqueue_withoutPeerFailsImmediately() {
        RelayMessage message = RelayMessage.of("roll").with("formula", "1d20");

        CompletableFuture<RelayMessage> future = correlator.enqueue(message, Duration.ofMillis(2000));

        assertTrue(future.isCompletedExceptionally());
        assertEquals(RelayErrorCode.NO_PEER_CONNECTED, failureCode(future));
        assertFalse(message.hasRequestId(), "no id is stamped when nothing can be sent");
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void enqueue_stampsGeneratedIdAndSendsToPrimary() {
        FakePeerChannel peer = admitPeer("gm-1");
        RelayMessage message = RelayMessage.of("roll").with("formula", "1d20");

        correlator.enqueue(message, LONG);

        String requestId = message.requestId();
        assertNotNull(requestId);
        assertTrue(requestId.matches("^req_\\d+_[0-9a-z]{7}$"), requestId);
        assertTrue(correlator.isPending(requestId));
        JsonNode sent = peer.lastFrame();
        assertEquals("roll", sent.get("type").asText());
        assertEquals("1d20", sent.get("formula").asText());
        assertEquals(requestId, sent.get("requestId").asText());
    }

    @Test
    void enqueue_keepsCallerSuppliedId() {
        admitPeer("gm-1");

        correlator.enqueue(RelayMessage.of("get-rolls").withRequestId("caller-1"), LONG);

        assertTrue(correlator.isPending("caller-1"));
    }

    @Test
    void enqueue_duplicatePendingIdIsRejected() {
        admitPeer("gm-1");
        correlator.enqueue(RelayMessage.of("get-rolls").withRequestId("dup"), LONG);

        assertThrows(IllegalStateException.class,
                () -> correlator.enqueue(RelayMessage.of("get-rolls").withRequestId("dup"), LONG));
        assertEquals(1, correlator.pendingCount());
    }

    @Test
    void enqueue_sendsToOldestConnection() {
        FakePeerChannel first = admitPeer("gm-1");
        FakePeerChannel second = admitPeer("gm-2");

        correlator.enqueue(RelayMessage.of("get-structure"), LONG);

        assertEquals(1, first.framesOfType("get-structure").size());
        assertTrue(second.framesOfType("get-structure").isEmpty());
    }

    @Test
    void enqueue_writeFailureTearsDownEntry() {
        FakePeerChannel peer = admitPeer("gm-1");
        peer.failSends(true);
        RelayMessage message = RelayMessage.of("roll");

        CompletableFuture<RelayMessage> future = correlator.enqueue(message, LONG);

        assertEquals(RelayErrorCode.DELIVERY_FAILURE, failureCode(future));
        assertFalse(correlator.isPending(message.requestId()));
    }

    @Test
    void enqueue_uncheckedWriteFailureTearsDownEntry() {
        FakePeerChannel peer = admitPeer("gm-1");
        peer.failSendsWith(new IllegalStateException("session is closing"));
        RelayMessage message = RelayMessage.of("roll");

        CompletableFuture<RelayMessage> future = correlator.enqueue(message, LONG);

        assertEquals(RelayErrorCode.DELIVERY_FAILURE, failureCode(future));
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void resolve_completesWithResponseAndSecondResolveIsNoop() throws Exception {
        admitPeer("gm-1");
        RelayMessage request = RelayMessage.of("roll").with("formula", "1d20");
        CompletableFuture<RelayMessage> future = correlator.enqueue(request, LONG);
        String requestId = request.requestId();

        assertTrue(correlator.resolve(requestId, response(requestId)));
        RelayMessage result = future.get(1, TimeUnit.SECONDS);
        assertEquals(14, result.get("total").asInt());

        assertFalse(correlator.resolve(requestId, response(requestId)));
        assertSame(result, future.get());
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void resolve_unknownIdHasNoEffect() {
        admitPeer("gm-1");
        CompletableFuture<RelayMessage> future = correlator.enqueue(RelayMessage.of("roll"), LONG);

        assertFalse(correlator.resolve("nope", response("nope")));
        assertFalse(correlator.resolve(null, response("x")));
        assertFalse(future.isDone());
        assertEquals(1, correlator.pendingCount());
    }

    @Test
    void resolve_errorResponseFailsWithPeerError() {
        admitPeer("gm-1");
        RelayMessage request = RelayMessage.of("get-entity");
        CompletableFuture<RelayMessage> future = correlator.enqueue(request, LONG);

        correlator.resolve(request.requestId(),
                RelayMessage.of("entity-data").withRequestId(request.requestId()).with("error", "Entity not found"));

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        RelayException cause = assertInstanceOf(RelayException.class, e.getCause());
        assertEquals(RelayErrorCode.PEER_ERROR, cause.getCode());
        assertEquals("Entity not found", cause.getMessage());
    }

    @Test
    void resolve_statusErrorWithoutTextUsesDefaultMessage() {
        admitPeer("gm-1");
        RelayMessage request = RelayMessage.of("get-entity");
        CompletableFuture<RelayMessage> future = correlator.enqueue(request, LONG);

        correlator.resolve(request.requestId(),
                RelayMessage.of("entity-data").withRequestId(request.requestId()).with("status", "error"));

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertEquals("Unknown error from peer", e.getCause().getMessage());
    }

    @Test
    void timeout_silentPeerFailsAfterDeadline() {
        correlator.close();
        correlator = new RequestCorrelator(registry);
        admitPeer("gm-1");

        long start = System.nanoTime();
        CompletableFuture<RelayMessage> future = correlator.enqueue(RelayMessage.of("roll"), Duration.ofMillis(100));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        RelayException cause = assertInstanceOf(RelayException.class, e.getCause());
        assertEquals(RelayErrorCode.REQUEST_TIMEOUT, cause.getCode());
        assertEquals("Request timeout after 100ms", cause.getMessage());
        assertTrue(elapsedMs >= 95, "fired too early: " + elapsedMs + "ms");
        assertTrue(elapsedMs < 1_000, "fired too late: " + elapsedMs + "ms");
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void timeout_lateResponseIsDropped() throws Exception {
        admitPeer("gm-1");
        RelayMessage request = RelayMessage.of("roll");
        CompletableFuture<RelayMessage> future = correlator.enqueue(request, Duration.ofMillis(20));

        assertEquals(RelayErrorCode.REQUEST_TIMEOUT, failureCode(future));
        assertFalse(correlator.resolve(request.requestId(), response(request.requestId())));
    }

    @Test
    void sweep_expiresOnlyEntriesAtLeastMaxAge() {
        admitPeer("gm-1");
        RelayMessage old = RelayMessage.of("roll");
        CompletableFuture<RelayMessage> oldFuture = correlator.enqueue(old, LONG);
        clock.advance(60_000);
        RelayMessage young = RelayMessage.of("roll");
        CompletableFuture<RelayMessage> youngFuture = correlator.enqueue(young, LONG);
        clock.advance(59_999);

        int expired = correlator.sweep(Duration.ofMillis(60_000));

        assertEquals(1, expired);
        assertEquals(RelayErrorCode.REQUEST_EXPIRED, failureCode(oldFuture));
        assertFalse(youngFuture.isDone());
        assertTrue(correlator.isPending(young.requestId()));
    }

    @Test
    void sweep_isIdempotent() {
        admitPeer("gm-1");
        correlator.enqueue(RelayMessage.of("roll"), LONG);
        clock.advance(61_000);

        assertEquals(1, correlator.sweep(Duration.ofMillis(60_000)));
        assertEquals(0, correlator.sweep(Duration.ofMillis(60_000)));
    }

    @Test
    void pendingRequestsSurvivePeerDisconnect() {
        FakePeerChannel peer = admitPeer("gm-1");
        RelayMessage request = RelayMessage.of("roll");
        CompletableFuture<RelayMessage> future = correlator.enqueue(request, LONG);

        peer.drop();
        registry.remove("gm-1");

        assertFalse(future.isDone());
        assertTrue(correlator.isPending(request.requestId()));
    }

    @Test
    void concurrentResolveAndSweepSettleExactlyOnce() throws Exception {
        admitPeer("gm-1");
        int requests = 200;
        RelayMessage[] messages = new RelayMessage[requests];
        AtomicInteger settled = new AtomicInteger();
        for (int i = 0; i < requests; i++) {
            messages[i] = RelayMessage.of("roll");
            correlator.enqueue(messages[i], LONG).whenComplete((r, ex) -> settled.incrementAndGet());
        }
        clock.advance(60_000);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger resolved = new AtomicInteger();
        AtomicInteger expired = new AtomicInteger();
        try {
            for (int t = 0; t < 2; t++) {
                pool.submit(() -> {
                    start.await();
                    for (RelayMessage m : messages) {
                        if (correlator.resolve(m.requestId(), response(m.requestId()))) {
                            resolved.incrementAndGet();
                        }
                    }
                    return null;
                });
                pool.submit(() -> {
                    start.await();
                    expired.addAndGet(correlator.sweep(Duration.ofMillis(60_000)));
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(requests, resolved.get() + expired.get());
        assertEquals(requests, settled.get());
        assertEquals(0, correlator.pendingCount());
    }
}
