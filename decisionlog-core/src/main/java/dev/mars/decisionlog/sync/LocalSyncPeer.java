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

import dev.mars.decisionlog.error.IntegrityAlert;
import dev.mars.decisionlog.error.IntegrityAlertSink;
import dev.mars.decisionlog.ledger.HashChainLedger;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.VectorClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link SyncPeer} view of one node: its own chain plus its replicas.
 * <p>
 * Inbound batches are planned with {@link MergePlan} and committed to the
 * {@link ReplicaStore}; the node's own chain is only ever read here.
 * <p>
 * Batches arrive through a bounded channel: one inbound thread applies them in
 * arrival order while callers wait for their result. When the channel is full a
 * batch is refused with {@link PeerUnavailableException} and the sender backs off.
 */
public final class LocalSyncPeer implements SyncPeer, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LocalSyncPeer.class);

    /** Batches waiting to be applied before new ones are refused. */
    public static final int DEFAULT_INBOUND_CAPACITY = 16;

    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    private final HashChainLedger ledger;
    private final ReplicaStore replicas;
    private final IntegrityAlertSink alerts;
    private final int inboundCapacity;
    private final ThreadPoolExecutor inbound;

    public LocalSyncPeer(HashChainLedger ledger, ReplicaStore replicas, IntegrityAlertSink alerts) {
        this(ledger, replicas, alerts, DEFAULT_INBOUND_CAPACITY);
    }

    /**
     * @param inboundCapacity batches that may wait behind the one being applied
     */
    public LocalSyncPeer(HashChainLedger ledger, ReplicaStore replicas, IntegrityAlertSink alerts,
                         int inboundCapacity) {
        if (inboundCapacity <= 0) {
            throw new IllegalArgumentException("inboundCapacity must be > 0");
        }
        this.ledger = ledger;
        this.replicas = replicas;
        this.alerts = alerts;
        this.inboundCapacity = inboundCapacity;
        this.inbound = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(inboundCapacity), r -> {
                    Thread t = new Thread(r, "ledger-inbound-" + ledger.nodeId());
                    t.setDaemon(true);
                    return t;
                }, new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public String nodeId() {
        return ledger.nodeId();
    }

    @Override
    public VectorClock frontier() {
        return replicas.frontier().advance(nodeId(), ledger.size());
    }

    @Override
    public Optional<HashValue> hashAt(String origin, long sequence) {
        if (!origin.equals(nodeId())) {
            return replicas.hashAt(origin, sequence);
        }
        if (sequence < 0 || sequence >= ledger.size()) {
            return Optional.empty();
        }
        return Optional.of(ledger.get(sequence).recordHash());
    }

    @Override
    public Optional<HashValue> headHash(String origin) {
        if (!origin.equals(nodeId())) {
            return replicas.headHash(origin);
        }
        return ledger.head().map(h -> h.recordHash());
    }

    @Override
    public List<AuditRecord> recordsAfter(VectorClock frontier, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        // Per origin, the first 'limit' missing records are enough: anything causally
        // before a record in the answer has a smaller clock weight and sorts ahead of it.
        List<AuditRecord> candidates = new ArrayList<>();
        long own = frontier.get(nodeId());
        candidates.addAll(ledger.readRange(own, own + limit));
        for (String origin : replicas.origins()) {
            long from = frontier.get(origin);
            candidates.addAll(replicas.read(origin, from, from + limit));
        }
        candidates.sort(MergePlan.DELIVERY_ORDER);
        List<AuditRecord> answer = candidates.size() > limit
                ? new ArrayList<>(candidates.subList(0, limit))
                : candidates;
        LOG.trace("{} offers {} records beyond {}", nodeId(), answer.size(), frontier);
        return answer;
    }

    @Override
    public ReceiveResult receive(List<AuditRecord> batch) {
        CompletableFuture<ReceiveResult> delivery;
        try {
            delivery = CompletableFuture.supplyAsync(() -> apply(batch), inbound);
        } catch (RejectedExecutionException e) {
            if (inbound.isShutdown()) {
                throw new PeerUnavailableException(nodeId(), "closed", e);
            }
            LOG.warn("{} refused batch of {} records: inbound channel full ({} waiting)", nodeId(), batch.size(),
                    inboundCapacity);
            throw new PeerUnavailableException(nodeId(), "inbound channel full", e);
        }
        try {
            return delivery.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /** Batches queued behind the one being applied. */
    public int inboundBacklog() {
        return inbound.getQueue().size();
    }

    /** Refuses new batches and waits for the queued ones to be applied. */
    @Override
    public void close() {
        inbound.shutdown();
        try {
            if (!inbound.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("{} inbound channel did not drain within {} s", nodeId(), CLOSE_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("{} interrupted while draining its inbound channel", nodeId());
        }
    }

    private ReceiveResult apply(List<AuditRecord> batch) {
        MergePlan plan = MergePlan.from(nodeId(), frontier(), this::hashAt, batch);
        for (AuditRecord r : plan.tampered()) {
            LOG.warn("{} rejected tampered record {} (stored hash {})", nodeId(), r.slot(), r.recordHash().shortHex());
        }
        for (CausalViolation v : plan.violations()) {
            LOG.warn("{} rejected {}: {}", nodeId(), v.slot(), v.reason());
        }
        if (plan.hasForks()) {
            for (ForkEvidence fork : plan.forks()) {
                alerts.raise(IntegrityAlert.of(fork.toException()));
            }
            LOG.error("{} refused batch of {} records: {} fork(s), first at {}", nodeId(), batch.size(),
                    plan.forks().size(), plan.forks().get(0).slot());
            return new ReceiveResult(0, plan.duplicates(), plan.rejected(), 0, plan.forks());
        }
        if (plan.requiresPersistence()) {
            replicas.commit(plan.accepted());
        }
        int conflicts = plan.concurrentWith(ledger.lastClock());
        LOG.debug("{} received {} records: {} accepted, {} duplicates, {} rejected, {} concurrent",
                nodeId(), batch.size(), plan.accepted().size(), plan.duplicates(), plan.rejected(), conflicts);
        return new ReceiveResult(plan.accepted().size(), plan.duplicates(), plan.rejected(), conflicts, List.of());
    }
}
