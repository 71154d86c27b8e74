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
package dev.mars.decisionlog.sync;

import dev.mars.decisionlog.RetryBackoff;
import dev.mars.decisionlog.error.ForkDetectedException;
import dev.mars.decisionlog.error.LedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background, cancellable synchronization with the cluster.
 * <p>
 * Every {@code intervalMs} one round runs against the peers the
 * {@link GossipPeerSelector} picks. A peer that fails is skipped until its backoff
 * expires. A forked peer is not retried: forks need an operator.
 * Rounds run on a dedicated daemon thread and only go through {@link SyncPeer} calls.
 */
public final class SyncScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SyncScheduler.class);

    private final VectorClockSynchronizer synchronizer;
    private final GossipPeerSelector selector;
    private final RetryBackoff backoff;
    private final long intervalMs;
    private final ScheduledExecutorService executor;
    private final Map<String, PeerHealth> health = new ConcurrentHashMap<>();
    private volatile ScheduledFuture<?> task;

    public SyncScheduler(String nodeId, VectorClockSynchronizer synchronizer, GossipPeerSelector selector,
                         RetryBackoff backoff, long intervalMs) {
        this.synchronizer = synchronizer;
        this.selector = selector;
        this.backoff = backoff;
        this.intervalMs = intervalMs;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ledger-sync-" + nodeId);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = executor.scheduleWithFixedDelay(this::safeRound, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Background sync started: interval={} ms, fanout={}, peers={}",
                intervalMs, selector.fanout(), selector.peers().size());
    }

    /** Stops future rounds; a round in progress finishes its current batch. */
    public synchronized void cancel() {
        if (task != null) {
            task.cancel(false);
            task = null;
            LOG.info("Background sync cancelled");
        }
    }

    public boolean isRunning() {
        ScheduledFuture<?> t = task;
        return t != null && !t.isDone();
    }

    /**
     * Runs one round on the calling thread.
     *
     * @return reports of the peers synced this round
     */
    public List<SyncReport> runOnce() {
        List<SyncReport> reports = new ArrayList<>();
        long now = System.currentTimeMillis();
        for (SyncPeer peer : selector.nextRound()) {
            PeerHealth h = health.computeIfAbsent(peer.nodeId(), id -> new PeerHealth());
            if (h.forked || now < h.retryAt) {
                LOG.trace("Skipping {} (forked={}, retry in {} ms)", peer.nodeId(), h.forked, h.retryAt - now);
                continue;
            }
            try {
                reports.add(synchronizer.syncWith(peer));
                h.failures = 0;
                h.retryAt = 0;
            } catch (ForkDetectedException e) {
                h.forked = true;
                LOG.error("Sync with {} suspended until operator resolution: {}", peer.nodeId(), e.getMessage());
            } catch (LedgerException e) {
                h.failures++;
                long delay = backoff.delayMs(h.failures);
                h.retryAt = now + delay;
                LOG.warn("Sync with {} failed (attempt {}), retrying in {} ms: {}",
                        peer.nodeId(), h.failures, delay, e.getMessage());
            }
        }
        return reports;
    }

    /** True if syncing with {@code peerId} is suspended because of a fork. */
    public boolean isSuspended(String peerId) {
        PeerHealth h = health.get(peerId);
        return h != null && h.forked;
    }

    private void safeRound() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the periodic task
            LOG.error("Sync round failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        cancel();
        executor.shutdownNow();
    }

    private static final class PeerHealth {
        private volatile int failures;
        private volatile long retryAt;
        private volatile boolean forked;
    }
}
