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
package dev.mars.decisionlog.node;

import dev.mars.decisionlog.DecisionLogConfig;
import dev.mars.decisionlog.RetryBackoff;
import dev.mars.decisionlog.consensus.ClusterMembership;
import dev.mars.decisionlog.consensus.ConsensusCoordinator;
import dev.mars.decisionlog.consensus.ConsensusPeer;
import dev.mars.decisionlog.consensus.OrderingStrategies;
import dev.mars.decisionlog.consensus.OrderingStrategy;
import dev.mars.decisionlog.consensus.Proposal;
import dev.mars.decisionlog.consensus.RecordSource;
import dev.mars.decisionlog.consensus.SegmentSealer;
import dev.mars.decisionlog.consensus.Vote;
import dev.mars.decisionlog.error.IntegrityAlertSink;
import dev.mars.decisionlog.error.LoggingAlertSink;
import dev.mars.decisionlog.ledger.HashChainLedger;
import dev.mars.decisionlog.merkle.MerkleVerifier;
import dev.mars.decisionlog.merkle.OpenSegment;
import dev.mars.decisionlog.merkle.Segment;
import dev.mars.decisionlog.notary.NotaryService;
import dev.mars.decisionlog.query.LedgerQuery;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordDraft;
import dev.mars.decisionlog.record.RecordSlot;
import dev.mars.decisionlog.record.VectorClock;
import dev.mars.decisionlog.storage.FileLedgerStorage;
import dev.mars.decisionlog.storage.InMemoryLedgerStorage;
import dev.mars.decisionlog.storage.LedgerStorage;
import dev.mars.decisionlog.sync.GossipPeerSelector;
import dev.mars.decisionlog.sync.LocalSyncPeer;
import dev.mars.decisionlog.sync.ReceiveResult;
import dev.mars.decisionlog.sync.ReplicaStore;
import dev.mars.decisionlog.sync.SyncPeer;
import dev.mars.decisionlog.sync.SyncReport;
import dev.mars.decisionlog.sync.SyncScheduler;
import dev.mars.decisionlog.sync.VectorClockSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * One decision-ledger node, fully wired.
 * <p>
 * Data flow: {@link #recordDecision} appends to the local {@link HashChainLedger}; the
 * append path feeds the {@link OpenSegment}; the synchronizer exchanges records with
 * peers into the {@link ReplicaStore}; the coordinator seals segments over own and
 * replicated records; the notary exports sealed roots.
 * <p>
 * A node is its own transport endpoint ({@link SyncPeer}, {@link ConsensusPeer}), so
 * in-process clusters connect nodes directly.
 *
 * <pre>{@code
 * LedgerNode a = LedgerNode.builder(configA).membership(cluster).build().open();
 * a.recordDecision(draft);
 * a.connect(b);
 * a.syncWith(b);
 * a.closeSegment();
 * }</pre>
 */
public final class LedgerNode implements SyncPeer, ConsensusPeer, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(LedgerNode.class);

    private final DecisionLogConfig config;
    private final ClusterMembership membership;
    private final IntegrityAlertSink alerts;
    private final LedgerStorage storage;
    private final ReplicaStore replicas;
    private final HashChainLedger ledger;
    private final OpenSegment openSegment = new OpenSegment();
    private final LocalSyncPeer syncView;
    private final VectorClockSynchronizer synchronizer;
    private final MerkleVerifier verifier;
    private final ConsensusCoordinator coordinator;
    private final NotaryService notary;
    private final LedgerQuery query;
    private final List<SyncPeer> syncPeers = new CopyOnWriteArrayList<>();

    private SyncScheduler syncScheduler;
    private SegmentSealer sealer;

    private LedgerNode(Builder b) {
        this.config = b.config;
        this.membership = b.membership != null ? b.membership : ClusterMembership.of(config.nodeId());
        this.alerts = b.alerts != null ? b.alerts : new LoggingAlertSink();
        this.storage = b.storage != null ? b.storage : new FileLedgerStorage(config);
        this.replicas = new ReplicaStore(config.nodeId(), b.replicaStorage, config.ioTimeoutMs());
        this.ledger = new HashChainLedger(config.nodeId(), storage, replicas::observedClock,
                config.ioTimeoutMs(), alerts);
        this.syncView = new LocalSyncPeer(ledger, replicas, alerts);
        this.synchronizer = new VectorClockSynchronizer(syncView, config.maxBatchSize(), alerts);
        this.verifier = new MerkleVerifier(config);
        OrderingStrategy strategy = OrderingStrategies.forKind(config.consensusStrategy(), membership, config.nodeId());
        this.coordinator = new ConsensusCoordinator(config.nodeId(), strategy, new NodeRecords(),
                verifier, config, alerts);
        this.notary = new NotaryService(coordinator, verifier);
        this.query = new LedgerQuery(coordinator, verifier);

        ledger.onAppend(openSegment::add);
        coordinator.onSeal(this::releaseSealed);
    }

    public static Builder builder(DecisionLogConfig config) {
        return new Builder(config);
    }

    /**
     * Node with heap storage for its own chain and its replicas.
     */
    public static LedgerNode inMemory(DecisionLogConfig config, ClusterMembership membership) {
        return builder(config)
                .storage(new InMemoryLedgerStorage(config.nodeId()))
                .membership(membership)
                .build();
    }

    /**
     * Opens storage, restores the chain head and the replicas of every member, and
     * reloads the open segment.
     */
    public LedgerNode open() {
        ledger.open();
        for (String member : membership.nodes()) {
            if (!member.equals(nodeId())) {
                replicas.restore(member);
            }
        }
        if (ledger.untrustedFrom() < 0) {
            ledger.readRange(0, ledger.size()).forEach(openSegment::add);
        }
        LOG.info("Node {} open: {} own records, replicas {}, strategy={}, members={}",
                nodeId(), ledger.size(), replicas.frontier(), coordinator.strategy().name(), membership);
        return this;
    }

    /**
     * Logs one decision durably on this node.
     *
     * @return the sealed record; never returned unless it is durable
     */
    public AuditRecord recordDecision(RecordDraft draft) {
        return ledger.append(draft);
    }

    /** Makes {@code peers} known for sync and consensus. */
    public void connect(LedgerNode... peers) {
        for (LedgerNode peer : peers) {
            connect(peer, peer);
        }
    }

    /** Makes a remote node known through its two transport endpoints. */
    public void connect(SyncPeer syncPeer, ConsensusPeer consensusPeer) {
        if (!Objects.equals(syncPeer.nodeId(), consensusPeer.nodeId())) {
            throw new IllegalArgumentException("Endpoints of different nodes: " + syncPeer.nodeId() +
                    ", " + consensusPeer.nodeId());
        }
        syncPeers.add(syncPeer);
        coordinator.addPeer(consensusPeer);
        LOG.debug("Node {} connected to {}", nodeId(), syncPeer.nodeId());
    }

    public SyncReport syncWith(SyncPeer peer) {
        return synchronizer.syncWith(peer);
    }

    /** Seals the next segment if a quorum agrees. */
    public Optional<Segment> closeSegment() {
        return coordinator.closeSegment();
    }

    /**
     * Starts background sync with the connected peers and background sealing.
     */
    public synchronized void startBackgroundTasks() {
        if (syncScheduler == null) {
            syncScheduler = new SyncScheduler(nodeId(), synchronizer,
                    new GossipPeerSelector(syncPeers, config.gossipFanout()),
                    RetryBackoff.forSync(config), config.syncIntervalMs());
            syncScheduler.start();
        }
        if (sealer == null) {
            sealer = new SegmentSealer(nodeId(), coordinator, new NodeRecords(), config.segmentSize(),
                    config.sealIntervalMs());
            sealer.start();
        }
    }

    /** Cancels background tasks; the chain and sealed segments are untouched. */
    public synchronized void stopBackgroundTasks() {
        if (syncScheduler != null) {
            syncScheduler.close();
            syncScheduler = null;
        }
        if (sealer != null) {
            sealer.close();
            sealer = null;
        }
    }

    // ========================================================================
    // SyncPeer
    // ========================================================================

    @Override
    public String nodeId() {
        return config.nodeId();
    }

    @Override
    public VectorClock frontier() {
        return syncView.frontier();
    }

    @Override
    public Optional<HashValue> hashAt(String origin, long sequence) {
        return syncView.hashAt(origin, sequence);
    }

    @Override
    public Optional<HashValue> headHash(String origin) {
        return syncView.headHash(origin);
    }

    @Override
    public List<AuditRecord> recordsAfter(VectorClock frontier, int limit) {
        return syncView.recordsAfter(frontier, limit);
    }

    @Override
    public ReceiveResult receive(List<AuditRecord> batch) {
        return syncView.receive(batch);
    }

    // ========================================================================
    // ConsensusPeer
    // ========================================================================

    @Override
    public CompletableFuture<Vote> vote(Proposal proposal) {
        return CompletableFuture.completedFuture(coordinator.vote(proposal));
    }

    @Override
    public CompletableFuture<Boolean> commit(Segment segment) {
        return CompletableFuture.completedFuture(coordinator.install(segment));
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public HashChainLedger ledger() {
        return ledger;
    }

    public ReplicaStore replicas() {
        return replicas;
    }

    public OpenSegment openSegment() {
        return openSegment;
    }

    public MerkleVerifier verifier() {
        return verifier;
    }

    public ConsensusCoordinator coordinator() {
        return coordinator;
    }

    public NotaryService notary() {
        return notary;
    }

    public LedgerQuery query() {
        return query;
    }

    public IntegrityAlertSink alerts() {
        return alerts;
    }

    public ClusterMembership membership() {
        return membership;
    }

    @Override
    public void close() {
        stopBackgroundTasks();
        syncView.close();
        storage.close();
        replicas.close();
        LOG.info("Node {} closed", nodeId());
    }

    private void releaseSealed(Segment segment) {
        Set<RecordSlot> own = new HashSet<>();
        for (AuditRecord r : segment.records()) {
            if (r.nodeId().equals(nodeId())) {
                own.add(r.slot());
            }
        }
        if (!own.isEmpty()) {
            openSegment.release(own);
        }
    }

    /**
     * Own chain plus replicas, as the coordinator sees them.
     */
    private final class NodeRecords implements RecordSource {

        @Override
        public Optional<AuditRecord> find(RecordSlot slot) {
            if (slot.nodeId().equals(nodeId())) {
                if (slot.localSequence() < 0 || slot.localSequence() >= ledger.size()) {
                    return Optional.empty();
                }
                return Optional.of(ledger.get(slot.localSequence()));
            }
            List<AuditRecord> held = replicas.read(slot.nodeId(), slot.localSequence(), slot.localSequence() + 1);
            return held.isEmpty() ? Optional.empty() : Optional.of(held.get(0));
        }

        @Override
        public List<AuditRecord> unsealed(VectorClock sealed, int limit) {
            return syncView.recordsAfter(sealed, limit);
        }
    }

    /**
     * Wiring options for a {@link LedgerNode}.
     */
    public static final class Builder {
        private final DecisionLogConfig config;
        private LedgerStorage storage;
        private Function<String, LedgerStorage> replicaStorage;
        private ClusterMembership membership;
        private IntegrityAlertSink alerts;

        private Builder(DecisionLogConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            this.replicaStorage = origin -> new InMemoryLedgerStorage(config.nodeId() + "/replica-" + origin);
        }

        /** Storage of the node's own chain; defaults to a {@link FileLedgerStorage} in the data directory. */
        public Builder storage(LedgerStorage storage) {
            this.storage = storage;
            return this;
        }

        /** Storage per replicated origin; defaults to heap storage. */
        public Builder replicaStorage(Function<String, LedgerStorage> replicaStorage) {
            this.replicaStorage = Objects.requireNonNull(replicaStorage, "replicaStorage");
            return this;
        }

        public Builder membership(ClusterMembership membership) {
            this.membership = membership;
            return this;
        }

        public Builder alerts(IntegrityAlertSink alerts) {
            this.alerts = alerts;
            return this;
        }

        public LedgerNode build() {
            return new LedgerNode(this);
        }
    }
}
