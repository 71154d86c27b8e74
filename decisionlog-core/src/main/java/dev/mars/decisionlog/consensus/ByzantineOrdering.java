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

import java.util.List;

/**
 * PBFT-like strategy for deployments that must tolerate compromised nodes.
 * <p>
 * With {@code n >= 3f + 1} nodes it tolerates {@code f} faulty ones: a proposal needs
 * {@code 2f + 1} acknowledgements in each of two phases (prepare, commit), and every
 * voter recomputes each record's hash from its content instead of trusting stored hashes.
 * The order is the canonical causal order, so a faulty proposer cannot steer it.
 */
public final class ByzantineOrdering implements OrderingStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ByzantineOrdering.class);

    private final ClusterMembership membership;
    private final int faultTolerance;
    private long view;

    /**
     * Tolerates the largest {@code f} the membership allows.
     */
    public ByzantineOrdering(ClusterMembership membership) {
        this(membership, (membership.size() - 1) / 3);
    }

    /**
     * @throws IllegalArgumentException if the membership has fewer than {@code 3f + 1} nodes
     */
    public ByzantineOrdering(ClusterMembership membership, int faultTolerance) {
        if (faultTolerance < 0 || membership.size() < 3 * faultTolerance + 1) {
            throw new IllegalArgumentException("Byzantine ordering with f=" + faultTolerance +
                    " needs at least " + (3 * faultTolerance + 1) + " nodes, have " + membership.size());
        }
        this.membership = membership;
        this.faultTolerance = faultTolerance;
    }

    @Override
    public String name() {
        return "byzantine";
    }

    public int faultTolerance() {
        return faultTolerance;
    }

    @Override
    public List<AuditRecord> propose(List<AuditRecord> candidates) {
        return CausalOrder.canonical(candidates);
    }

    @Override
    public int quorumSize() {
        return 2 * faultTolerance + 1;
    }

    @Override
    public int phases() {
        return 2;
    }

    @Override
    public synchronized long epoch() {
        return view;
    }

    @Override
    public boolean reverifiesContent() {
        return true;
    }

    @Override
    public boolean acknowledges(Proposal proposal, List<RecordSlot> localOrder) {
        if (proposal.phase() < 1 || proposal.phase() > phases()) {
            return false;
        }
        return proposal.slots().equals(localOrder);
    }

    @Override
    public synchronized void onTimeout(SegmentRound round) {
        view++;
        LOG.warn("Segment {} missed its {}-of-{} quorum; view change to {}",
                round.number(), quorumSize(), membership.size(), view);
    }
}
