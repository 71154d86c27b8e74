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

import dev.mars.decisionlog.DecisionLogConfig;
import dev.mars.decisionlog.RetryBackoff;
import dev.mars.decisionlog.error.CausalOrderViolationException;
import dev.mars.decisionlog.error.ForkDetectedException;
import dev.mars.decisionlog.error.IntegrityAlert;
import dev.mars.decisionlog.error.IntegrityAlertSink;
import dev.mars.decisionlog.error.QuorumTimeoutException;
import dev.mars.decisionlog.ledger.VerificationResult;
import dev.mars.decisionlog.merkle.MerkleVerifier;
import dev.mars.decisionlog.merkle.Segment;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.VectorClock;
import dev.mars.decisionlog.sync.ForkEvidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Turns unsealed records into sealed segments, one at a time, under the active
 * {@link OrderingStrategy}.
 * <p>
 * <b>Round:</b> {@link #propose()} picks the causally closed unsealed records, orders
 * them and commits to a root ({@code OPEN -> PENDING_QUORUM}); {@link #awaitQuorum}
 * collects votes from every peer in parallel, each bounded by the quorum timeout;
 * {@link #sealSegment} builds the segment, verifies it in full and hands it to the
 * peers ({@code -> SEALED}). A FORK vote ends the round in {@code FORK_DETECTED}.
 * A missed quorum leaves the round pending; {@link #closeSegment()} retries with backoff.
 * <p>
 * Sealed segments are read-only and shared without locking. The sealed list and the
 * sealed frontier change under one lock, on either the local seal path or
 * {@link #install} of a segment sealed elsewhere. Local appends never wait on any of this.
 */
public final class ConsensusCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ConsensusCoordinator.class);

    private final String nodeId;
    private final OrderingStrategy strategy;
    private final RecordSource records;
    private final ProposalValidator validator;
    private final MerkleVerifier verifier;
    private final IntegrityAlertSink alerts;
    private final long quorumTimeoutMs;
    private final int maxAttempts;
    private final int segmentSize;
    private final RetryBackoff backoff;

    private final List<ConsensusPeer> peers = new CopyOnWriteArrayList<>();
    private final List<Consumer<Segment>> sealListeners = new CopyOnWriteArrayList<>();
    private final List<Segment> sealed = new CopyOnWriteArrayList<>();
    private final Object sealLock = new Object();
    private volatile VectorClock sealedFrontier = VectorClock.empty();
    // Guarded by sealLock
    private final Map<Long, Promise> promises = new HashMap<>();

    public ConsensusCoordinator(String nodeId, OrderingStrategy strategy, RecordSource records,
                                MerkleVerifier verifier, DecisionLogConfig config, IntegrityAlertSink alerts) {
        this.nodeId = nodeId;
        this.strategy = strategy;
        this.records = records;
        this.validator = new ProposalValidator(nodeId, records, strategy);
        this.verifier = verifier;
        this.alerts = alerts;
        this.quorumTimeoutMs = config.quorumTimeoutMs();
        this.maxAttempts = config.maxQuorumAttempts();
        this.segmentSize = config.segmentSize();
        this.backoff = new RetryBackoff(Math.max(1, config.quorumTimeoutMs() / 10), config.quorumTimeoutMs());
    }

    public void addPeer(ConsensusPeer peer) {
        if (peer.nodeId().equals(nodeId)) {
            throw new IllegalArgumentException("A node is not its own peer: " + nodeId);
        }
        peers.add(peer);
    }

    /** Registers a callback run after a segment is sealed or installed. */
    public void onSeal(Consumer<Segment> listener) {
        sealListeners.add(listener);
    }

    // ========================================================================
    // Proposer side
    // ========================================================================

    /**
     * Opens a round over the unsealed records.
     *
     * @return the round, now {@code PENDING_QUORUM}; empty if nothing is unsealed or
     *         this node may not propose in the current epoch
     */
    public Optional<SegmentRound> propose() {
        if (!strategy.mayPropose(nodeId)) {
            LOG.debug("{} is not a proposer under {} in epoch {}", nodeId, strategy.name(), strategy.epoch());
            return Optional.empty();
        }
        long number;
        VectorClock frontier;
        synchronized (sealLock) {
            number = sealed.size();
            frontier = sealedFrontier;
        }
        List<AuditRecord> candidates = records.unsealed(frontier, segmentSize);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        List<AuditRecord> ordered = strategy.propose(candidates);
        int bad = CausalOrder.firstViolation(ordered);
        if (bad >= 0) {
            throw new CausalOrderViolationException("Strategy " + strategy.name() + " placed " +
                    ordered.get(bad).slot() + " before one of its dependencies");
        }
        HashValue root = verifier.rootOf(ordered);
        SegmentRound round = new SegmentRound(Proposal.of(number, nodeId, strategy.epoch(), ordered, root), ordered);
        round.transition(SegmentState.PENDING_QUORUM);
        LOG.info("{} proposes segment {}: {} records, root={}, strategy={}",
                nodeId, number, ordered.size(), root.shortHex(), strategy.name());
        return Optional.of(round);
    }

    /**
     * Collects votes for every phase of the strategy.
     *
     * @throws QuorumTimeoutException if a phase gathers too few acknowledgements; the round stays pending
     * @throws ForkDetectedException  if any voter holds a different record at a proposed position
     */
    public void awaitQuorum(SegmentRound round) {
        if (round.state() != SegmentState.PENDING_QUORUM) {
            throw new IllegalStateException("Segment " + round.number() + " is " + round.state());
        }
        round.startAttempt();
        for (int phase = 1; phase <= strategy.phases(); phase++) {
            Proposal proposal = round.proposal().inPhase(phase);
            List<Vote> votes = collectVotes(proposal);
            round.recordVotes(votes);

            for (Vote v : votes) {
                if (v.kind() == Vote.Kind.FORK) {
                    ForkEvidence evidence = v.forkEvidence();
                    round.forkDetected(evidence);
                    ForkDetectedException e = evidence.toException();
                    LOG.error("Segment {} halted: {} reports {}", round.number(), v.voter(), e.getMessage());
                    alerts.raise(IntegrityAlert.of(e));
                    throw e;
                }
            }
            int acks = (int) votes.stream().filter(Vote::isAck).count();
            if (acks < strategy.quorumSize()) {
                LOG.warn("Segment {} phase {}: {} of {} required acknowledgements (attempt {})",
                        round.number(), phase, acks, strategy.quorumSize(), round.attempts());
                throw new QuorumTimeoutException(round.number(), acks, strategy.quorumSize());
            }
            round.phaseAcknowledged();
            LOG.debug("Segment {} phase {} acknowledged by {} nodes", round.number(), phase, acks);
        }
    }

    /**
     * Seals a round that reached quorum and hands the segment to every peer.
     *
     * @throws IllegalStateException if the round has no quorum or another segment took its number
     */
    public Segment sealSegment(SegmentRound round) {
        if (round.state() != SegmentState.PENDING_QUORUM || !round.quorumReached(strategy.phases())) {
            throw new IllegalStateException("Segment " + round.number() + " cannot be sealed without quorum");
        }
        Segment segment = verifier.buildSegment(round.number(), round.records());
        VerificationResult check = verifier.verifyFull(segment, round.proposal().root());
        if (!check.isOk()) {
            throw check.toException();
        }
        synchronized (sealLock) {
            if (segment.number() != sealed.size()) {
                throw new IllegalStateException("Segment " + segment.number() + " was overtaken; next is " + sealed.size());
            }
            applySealed(segment);
        }
        round.transition(SegmentState.SEALED);
        LOG.info("{} sealed segment {}: {} records, root={}", nodeId, segment.number(), segment.size(),
                segment.root().shortHex());
        broadcast(segment);
        return segment;
    }

    /**
     * Proposes, waits for quorum and seals, retrying a missed quorum with backoff.
     *
     * @return the sealed segment; empty if there was nothing to seal or this node may not propose
     * @throws QuorumTimeoutException after {@code maxQuorumAttempts} missed quorums
     */
    public Optional<Segment> closeSegment() {
        QuorumTimeoutException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<SegmentRound> round = propose();
            if (round.isEmpty()) {
                if (last != null) {
                    throw last;
                }
                return Optional.empty();
            }
            try {
                awaitQuorum(round.get());
                return Optional.of(sealSegment(round.get()));
            } catch (QuorumTimeoutException e) {
                last = e;
                strategy.onTimeout(round.get());
                if (attempt < maxAttempts) {
                    pause(attempt, e);
                }
            }
        }
        throw last;
    }

    // ========================================================================
    // Voter side
    // ========================================================================

    /**
     * Answers a proposal, this node's own included.
     * <p>
     * An acknowledgement is a promise: for one quorum timeout this node refuses any
     * other root for the same segment number, so two concurrent proposers cannot both
     * gather a majority.
     */
    public Vote vote(Proposal proposal) {
        synchronized (sealLock) {
            Vote vote = validator.validate(proposal, sealed.size(), sealedFrontier);
            if (!vote.isAck()) {
                return vote;
            }
            long now = System.currentTimeMillis();
            Promise held = promises.get(proposal.segmentNumber());
            if (held != null && now < held.expiresAt() && !held.root().equals(proposal.root())) {
                LOG.debug("{} NACKs segment {} from {}: promised to {} until {}", nodeId, proposal.segmentNumber(),
                        proposal.proposer(), held.proposer(), held.expiresAt());
                return Vote.nack(nodeId, "segment " + proposal.segmentNumber() + " already promised to root " +
                        held.root().shortHex() + " from " + held.proposer());
            }
            promises.put(proposal.segmentNumber(), new Promise(proposal.root(), proposal.proposer(), now + quorumTimeoutMs));
            return vote;
        }
    }

    /**
     * Installs a segment sealed by another node after re-verifying it locally.
     *
     * @return true if installed or already held, false if refused
     */
    public boolean install(Segment segment) {
        synchronized (sealLock) {
            long next = sealed.size();
            if (segment.number() < next) {
                Segment held = sealed.get((int) segment.number());
                if (held.root().equals(segment.root())) {
                    return true;
                }
                LOG.error("{} refuses segment {}: root {} conflicts with sealed root {}", nodeId,
                        segment.number(), segment.root().shortHex(), held.root().shortHex());
                return false;
            }
            if (segment.number() > next) {
                LOG.warn("{} cannot install segment {} yet; next expected is {}", nodeId, segment.number(), next);
                return false;
            }
            VerificationResult check = verifier.verifyFull(segment);
            if (!check.isOk()) {
                LOG.error("{} refuses segment {}: {}", nodeId, segment.number(), check.reason());
                return false;
            }
            String gap = continuityGap(segment, sealedFrontier);
            if (gap != null) {
                LOG.warn("{} refuses segment {}: {}", nodeId, segment.number(), gap);
                return false;
            }
            for (AuditRecord r : segment.records()) {
                Optional<AuditRecord> held = records.find(r.slot());
                if (held.isPresent() && !held.get().recordHash().equals(r.recordHash())) {
                    ForkDetectedException e = new ForkEvidence(r.slot(), held.get().recordHash(), r.recordHash())
                            .toException();
                    alerts.raise(IntegrityAlert.of(e));
                    LOG.error("{} refuses segment {}: {}", nodeId, segment.number(), e.getMessage());
                    return false;
                }
            }
            applySealed(segment);
        }
        LOG.info("{} installed segment {} ({} records, root={})", nodeId, segment.number(), segment.size(),
                segment.root().shortHex());
        return true;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /** Sealed segments, oldest first. */
    public List<Segment> sealedSegments() {
        return List.copyOf(sealed);
    }

    public Optional<Segment> segment(long number) {
        if (number < 0 || number >= sealed.size()) {
            return Optional.empty();
        }
        return Optional.of(sealed.get((int) number));
    }

    /** Records sealed so far, per origin. */
    public VectorClock sealedFrontier() {
        return sealedFrontier;
    }

    public long nextSegmentNumber() {
        return sealed.size();
    }

    public OrderingStrategy strategy() {
        return strategy;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private List<Vote> collectVotes(Proposal proposal) {
        List<Vote> votes = new ArrayList<>();
        votes.add(vote(proposal));
        List<CompletableFuture<Vote>> pending = new ArrayList<>();
        for (ConsensusPeer peer : peers) {
            pending.add(askPeer(peer, proposal));
        }
        CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).join();
        for (CompletableFuture<Vote> f : pending) {
            votes.add(f.join());
        }
        return votes;
    }

    private CompletableFuture<Vote> askPeer(ConsensusPeer peer, Proposal proposal) {
        CompletableFuture<Vote> answer;
        try {
            answer = peer.vote(proposal);
        } catch (RuntimeException e) {
            answer = CompletableFuture.failedFuture(e);
        }
        return answer
                .orTimeout(quorumTimeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    LOG.warn("No vote from {} on segment {}: {}", peer.nodeId(), proposal.segmentNumber(), cause.toString());
                    return Vote.nack(peer.nodeId(), "no answer: " + cause);
                });
    }

    private void broadcast(Segment segment) {
        List<CompletableFuture<Boolean>> commits = new ArrayList<>();
        for (ConsensusPeer peer : peers) {
            CompletableFuture<Boolean> commit;
            try {
                commit = peer.commit(segment);
            } catch (RuntimeException e) {
                commit = CompletableFuture.failedFuture(e);
            }
            commits.add(commit
                    .orTimeout(quorumTimeoutMs, TimeUnit.MILLISECONDS)
                    .handle((installed, ex) -> {
                        if (ex != null) {
                            LOG.warn("Commit of segment {} to {} failed: {}", segment.number(), peer.nodeId(), ex.toString());
                            return false;
                        }
                        if (!installed) {
                            LOG.warn("{} refused segment {}", peer.nodeId(), segment.number());
                        }
                        return installed;
                    }));
        }
        CompletableFuture.allOf(commits.toArray(new CompletableFuture<?>[0])).join();
    }

    /** Must hold sealLock. */
    private void applySealed(Segment segment) {
        Map<String, Long> frontier = new HashMap<>(sealedFrontier.entries());
        for (AuditRecord r : segment.records()) {
            frontier.merge(r.nodeId(), r.localSequence() + 1, Math::max);
        }
        sealed.add(segment);
        sealedFrontier = VectorClock.of(frontier);
        promises.keySet().removeIf(number -> number <= segment.number());
        for (Consumer<Segment> listener : sealListeners) {
            try {
                listener.accept(segment);
            } catch (RuntimeException e) {
                LOG.error("Seal listener failed for segment {}: {}", segment.number(), e.getMessage(), e);
            }
        }
    }

    private static String continuityGap(Segment segment, VectorClock frontier) {
        Map<String, Long> next = new HashMap<>(frontier.entries());
        List<AuditRecord> bySlot = new ArrayList<>(segment.records());
        bySlot.sort(CausalOrder.BY_SLOT);
        for (AuditRecord r : bySlot) {
            long want = next.getOrDefault(r.nodeId(), 0L);
            if (r.localSequence() != want) {
                return r.nodeId() + " continues at " + want + ", segment has " + r.slot();
            }
            next.put(r.nodeId(), want + 1);
        }
        for (AuditRecord r : segment.records()) {
            for (Map.Entry<String, Long> e : r.vectorClock().entries().entrySet()) {
                if (e.getValue() > next.getOrDefault(e.getKey(), 0L)) {
                    return r.slot() + " depends on unsealed " + e.getKey() + "#" + (e.getValue() - 1);
                }
            }
        }
        return CausalOrder.respectsCausality(segment.records()) ? null : "order breaks causality";
    }

    private record Promise(HashValue root, String proposer, long expiresAt) {
    }

    private void pause(int attempt, QuorumTimeoutException cause) {
        try {
            backoff.pause(attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
