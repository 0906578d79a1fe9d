package com.foundryrelay.app;

import com.foundryrelay.gateway.connection.ConnectionRegistry;

import static org.junit.jupiter.api.Assertions.fail;

final class TestSupport {

    private TestSupport() {
    }

    /** Wait for sockets from earlier tests to be released. */
    static void awaitEmpty(ConnectionRegistry registry) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (registry.size() > 0) {
            if (System.currentTimeMillis() > deadline) {
                fail("peer connections still registered: " + registry.listIds());
            }
            Thread.sleep(20);
        }
    }
}
