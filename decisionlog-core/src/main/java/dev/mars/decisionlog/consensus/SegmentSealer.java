/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.decisionlog.consensus;

import dev.mars.decisionlog.error.ForkDetectedException;
import dev.mars.decisionlog.error.LedgerException;
import dev.mars.decisionlog.error.QuorumTimeoutException;
import dev.mars.decisionlog.merkle.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background task that closes segments.
 * <p>
 * A segment is closed when {@code segmentSize} records are waiting, or when the seal
 * interval has passed with at least one record waiting. A missed quorum is retried on
 * a later tick. A fork stops the sealer: it needs an operator.
 */
public final class SegmentSealer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentSealer.class);

    /** Upper bound on the polling period. */
    static final long MAX_POLL_MS = 250;

    private final ConsensusCoordinator coordinator;
    private final RecordSource records;
    private final int segmentSize;
    private final long sealIntervalMs;
    private final ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> task;
    private volatile long lastSealAt = System.currentTimeMillis();
    private volatile boolean halted;

    public SegmentSealer(String nodeId, ConsensusCoordinator coordinator, RecordSource records,
                         int segmentSize, long sealIntervalMs) {
        this.coordinator = coordinator;
        this.records = records;
        this.segmentSize = segmentSize;
        this.sealIntervalMs = sealIntervalMs;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ledger-sealer-" + nodeId);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        long poll = Math.min(sealIntervalMs, MAX_POLL_MS);
        task = executor.scheduleWithFixedDelay(this::safeTick, poll, poll, TimeUnit.MILLISECONDS);
        LOG.info("Segment sealer started: segmentSize={}, sealInterval={} ms", segmentSize, sealIntervalMs);
    }

    public synchronized void cancel() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    /** True once a fork has stopped the sealer. */
    public boolean isHalted() {
        return halted;
    }

    /**
     * One sealing decision, on the calling thread.
     *
     * @return the segment sealed by this tick, if any
     */
    public Optional<Segment> tick() {
        if (halted) {
            return Optional.empty();
        }
        try {
            int waiting = records.unsealed(coordinator.sealedFrontier(), segmentSize).size();
            boolean full = waiting >= segmentSize;
            boolean due = waiting > 0 && System.currentTimeMillis() - lastSealAt >= sealIntervalMs;
            if (!full && !due) {
                return Optional.empty();
            }
            Optional<Segment> sealed = coordinator.closeSegment();
            if (sealed.isPresent()) {
                lastSealAt = System.currentTimeMillis();
            }
            return sealed;
        } catch (ForkDetectedException e) {
            halted = true;
            cancel();
            LOG.error("Segment sealing halted until operator resolution: {}", e.getMessage());
        } catch (QuorumTimeoutException e) {
            LOG.warn("Segment {} still pending quorum, will retry: {}", e.segmentNumber(), e.getMessage());
        } catch (LedgerException e) {
            LOG.warn("Segment sealing failed, will retry: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the periodic task
            LOG.error("Sealer tick failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        cancel();
        executor.shutdownNow();
    }
}
