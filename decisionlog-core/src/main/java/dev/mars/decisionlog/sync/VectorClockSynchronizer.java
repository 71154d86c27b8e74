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

import dev.mars.decisionlog.error.ForkDetectedException;
import dev.mars.decisionlog.error.IntegrityAlert;
import dev.mars.decisionlog.error.IntegrityAlertSink;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordSlot;
import dev.mars.decisionlog.record.VectorClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Exchanges records between this node and one peer.
 * <p>
 * A round runs in three steps:
 * <ol>
 *   <li><b>Fork probe.</b> For every origin both sides hold, compare the hashes at the
 *       shorter common length. Since each hash commits to its whole prefix, equal hashes
 *       mean equal chains up to there; otherwise bisect to the first divergent sequence.
 *       A fork aborts the round before anything is transferred.</li>
 *   <li><b>Pull.</b> Ask the peer for what lies beyond our frontier, batch by batch.</li>
 *   <li><b>Push.</b> The same in the other direction.</li>
 * </ol>
 * Deliveries are idempotent, so a round interrupted by a network failure can simply be
 * run again. A second round with no new records reports nothing.
 */
public final class VectorClockSynchronizer {

    private static final Logger LOG = LoggerFactory.getLogger(VectorClockSynchronizer.class);

    private final SyncPeer local;
    private final int maxBatchSize;
    private final IntegrityAlertSink alerts;

    public VectorClockSynchronizer(SyncPeer local, int maxBatchSize, IntegrityAlertSink alerts) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive: " + maxBatchSize);
        }
        this.local = local;
        this.maxBatchSize = maxBatchSize;
        this.alerts = alerts;
    }

    /**
     * Runs one synchronization round with {@code peer}.
     *
     * @throws ForkDetectedException    if the two sides hold divergent chains for some node
     * @throws PeerUnavailableException if the peer stops answering; already delivered records stay
     */
    public SyncReport syncWith(SyncPeer peer) {
        long started = System.currentTimeMillis();
        Optional<ForkEvidence> fork = probeForks(peer);
        if (fork.isPresent()) {
            ForkDetectedException e = fork.get().toException();
            LOG.error("Sync {} <-> {} aborted: {}", local.nodeId(), peer.nodeId(), e.getMessage());
            alerts.raise(IntegrityAlert.of(e));
            throw e;
        }

        int received = 0;
        int conflicts = 0;
        int rejected = 0;
        while (true) {
            List<AuditRecord> batch = peer.recordsAfter(local.frontier(), maxBatchSize);
            if (batch.isEmpty()) {
                break;
            }
            ReceiveResult result = local.receive(batch);
            failOnFork(result, peer);
            received += result.accepted();
            conflicts += result.conflicts();
            rejected += result.rejected();
            if (result.accepted() == 0) {
                break;
            }
        }

        int sent = 0;
        while (true) {
            List<AuditRecord> batch = local.recordsAfter(peer.frontier(), maxBatchSize);
            if (batch.isEmpty()) {
                break;
            }
            ReceiveResult result = peer.receive(batch);
            failOnFork(result, peer);
            sent += result.accepted();
            rejected += result.rejected();
            if (result.accepted() == 0) {
                break;
            }
        }

        SyncReport report = new SyncReport(peer.nodeId(), received, sent, conflicts, rejected);
        if (report.isEmpty()) {
            LOG.debug("Sync {} <-> {}: already in step", local.nodeId(), peer.nodeId());
        } else {
            LOG.info("Sync {} <-> {}: received={}, sent={}, conflicts={}, rejected={} in {} ms",
                    local.nodeId(), peer.nodeId(), received, sent, conflicts, rejected,
                    System.currentTimeMillis() - started);
        }
        return report;
    }

    /**
     * Finds the first divergent position across every origin both sides hold.
     */
    public Optional<ForkEvidence> probeForks(SyncPeer peer) {
        VectorClock mine = local.frontier();
        VectorClock theirs = peer.frontier();
        Set<String> origins = new TreeSet<>(mine.entries().keySet());
        origins.addAll(theirs.entries().keySet());

        for (String origin : origins) {
            long common = Math.min(mine.get(origin), theirs.get(origin));
            if (common == 0) {
                continue;
            }
            HashValue localTop = local.hashAt(origin, common - 1).orElse(HashValue.ZERO);
            HashValue remoteTop = peer.hashAt(origin, common - 1).orElse(HashValue.ZERO);
            if (localTop.equals(remoteTop)) {
                continue;
            }
            // Divergent at common - 1; equal hashes at k imply equal prefixes up to k
            long lo = 0;
            long hi = common - 1;
            while (lo < hi) {
                long mid = (lo + hi) >>> 1;
                if (sameAt(peer, origin, mid)) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            ForkEvidence evidence = new ForkEvidence(new RecordSlot(origin, lo),
                    local.hashAt(origin, lo).orElse(HashValue.ZERO),
                    peer.hashAt(origin, lo).orElse(HashValue.ZERO));
            LOG.debug("Fork probe {} <-> {}: {} diverges at {}", local.nodeId(), peer.nodeId(), origin, lo);
            return Optional.of(evidence);
        }
        return Optional.empty();
    }

    private boolean sameAt(SyncPeer peer, String origin, long sequence) {
        Optional<HashValue> a = local.hashAt(origin, sequence);
        return a.isPresent() && a.equals(peer.hashAt(origin, sequence));
    }

    private void failOnFork(ReceiveResult result, SyncPeer peer) {
        if (result.hasForks()) {
            ForkDetectedException e = result.forks().get(0).toException();
            // The receiving side has already raised the alert
            LOG.error("Sync {} <-> {} aborted mid-transfer: {}", local.nodeId(), peer.nodeId(), e.getMessage());
            throw e;
        }
    }
}
