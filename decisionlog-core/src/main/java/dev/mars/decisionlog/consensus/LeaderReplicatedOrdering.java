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

import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.RecordSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/**
 * Raft-like strategy: one leader per epoch assigns the order, followers replicate it.
 * <p>
 * The leader of epoch {@code e} is the {@code e}-th node of the sorted membership. A
 * missed quorum moves to the next epoch, which elects the next node. A follower adopts
 * a newer epoch when its rightful leader proposes, and refuses proposals from stale
 * epochs or from anyone else. Sealing resumes at the next segment number, so a new
 * leader continues from the last acknowledged segment.
 * <p>
 * Among concurrent records the leader puts its own first; followers accept any order
 * that respects causality.
 */
public final class LeaderReplicatedOrdering implements OrderingStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(LeaderReplicatedOrdering.class);

    private final ClusterMembership membership;
    private final String self;
    private long epoch;

    public LeaderReplicatedOrdering(ClusterMembership membership, String self) {
        this.membership = membership;
        this.self = self;
    }

    @Override
    public String name() {
        return "leader";
    }

    public synchronized String leader() {
        return membership.rotate(epoch);
    }

    @Override
    public synchronized long epoch() {
        return epoch;
    }

    @Override
    public boolean mayPropose(String nodeId) {
        return leader().equals(nodeId);
    }

    @Override
    public List<AuditRecord> propose(List<AuditRecord> candidates) {
        Comparator<AuditRecord> ownFirst = Comparator
                .comparing((AuditRecord r) -> !r.nodeId().equals(self))
                .thenComparing(CausalOrder.BY_SLOT);
        return CausalOrder.sort(candidates, ownFirst);
    }

    @Override
    public int quorumSize() {
        return membership.size() / 2 + 1;
    }

    @Override
    public synchronized boolean acknowledges(Proposal proposal, List<RecordSlot> localOrder) {
        if (proposal.epoch() < epoch) {
            LOG.debug("{} refuses proposal from stale epoch {} (current {})", self, proposal.epoch(), epoch);
            return false;
        }
        if (!membership.rotate(proposal.epoch()).equals(proposal.proposer())) {
            LOG.debug("{} refuses proposal from {}: not the leader of epoch {}", self, proposal.proposer(), proposal.epoch());
            return false;
        }
        if (proposal.epoch() > epoch) {
            LOG.info("{} follows leader {} into epoch {}", self, proposal.proposer(), proposal.epoch());
            epoch = proposal.epoch();
        }
        return true;
    }

    @Override
    public synchronized void onTimeout(SegmentRound round) {
        epoch++;
        LOG.warn("Segment {} missed quorum under leader {}; epoch {} elects {}",
                round.number(), round.proposal().proposer(), epoch, membership.rotate(epoch));
    }
}
