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

import java.util.List;

/**
 * Default strategy: the canonical causal order, ratified by a simple majority.
 * <p>
 * Any node may propose; a voter acknowledges only the order it would have
 * produced itself, so every honest proposer converges on the same root.
 */
public final class MajorityOrdering implements OrderingStrategy {

    private final ClusterMembership membership;

    public MajorityOrdering(ClusterMembership membership) {
        this.membership = membership;
    }

    @Override
    public String name() {
        return "majority";
    }

    @Override
    public List<AuditRecord> propose(List<AuditRecord> candidates) {
        return CausalOrder.canonical(candidates);
    }

    @Override
    public int quorumSize() {
        return membership.size() / 2 + 1;
    }

    @Override
    public boolean acknowledges(Proposal proposal, List<RecordSlot> localOrder) {
        return proposal.slots().equals(localOrder);
    }
}
