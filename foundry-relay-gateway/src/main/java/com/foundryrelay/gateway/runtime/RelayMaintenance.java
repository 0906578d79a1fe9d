package com.foundryrelay.gateway.runtime;

import com.foundryrelay.common.infra.IntervalRunner;
import com.foundryrelay.gateway.connection.LivenessMonitor;
import com.foundryrelay.gateway.correlation.RequestCorrelator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Background upkeep: the pending-request sweep and the liveness check, each on
 * its own fixed-delay runner.
 */
@Slf4j
public class RelayMaintenance implements AutoCloseable {

    private final IntervalRunner sweepRunner;
    private final IntervalRunner livenessRunner;

    public RelayMaintenance(RequestCorrelator correlator, LivenessMonitor livenessMonitor,
            long sweepIntervalMs, long sweepMaxAgeMs, long livenessIntervalMs) {
        Duration maxAge = Duration.ofMillis(sweepMaxAgeMs);
        this.sweepRunner = new IntervalRunner("relay-sweep", sweepIntervalMs, () -> correlator.sweep(maxAge));
        this.livenessRunner = new IntervalRunner("relay-liveness", livenessIntervalMs, livenessMonitor::check);
    }

    public void start() {
        sweepRunner.start();
        livenessRunner.start();
        log.info("maintenance: started sweepEveryMs={} livenessEveryMs={}",
                sweepRunner.getIntervalMs(), livenessRunner.getIntervalMs());
    }

    public boolean isRunning() {
        return sweepRunner.isRunning() && livenessRunner.isRunning();
    }

    @Override
    public void close() {
        sweepRunner.close();
        livenessRunner.close();
        log.info("maintenance: stopped");
    }
}
