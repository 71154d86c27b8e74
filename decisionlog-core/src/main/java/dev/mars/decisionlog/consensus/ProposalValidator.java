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

import dev.mars.decisionlog.merkle.MerkleTree;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordSlot;
import dev.mars.decisionlog.record.VectorClock;
import dev.mars.decisionlog.sync.ForkEvidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A voter's checks on a {@link Proposal}.
 * <ol>
 *   <li>the segment number is the next one this node expects</li>
 *   <li>the root commits to the listed hashes</li>
 *   <li>every record is held with the same hash (a different hash is a FORK vote)</li>
 *   <li>per origin, records continue the sealed prefix without gaps</li>
 *   <li>every causal dependency is sealed or in the proposal, and precedes its dependent</li>
 *   <li>the strategy accepts the order</li>
 * </ol>
 */
public final class ProposalValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ProposalValidator.class);

    private final String self;
    private final RecordSource records;
    private final OrderingStrategy strategy;

    public ProposalValidator(String self, RecordSource records, OrderingStrategy strategy) {
        this.self = self;
        this.records = records;
        this.strategy = strategy;
    }

    /**
     * @param nextSegment number of the next segment this node would seal
     * @param sealed      records sealed so far, per origin
     */
    public Vote validate(Proposal proposal, long nextSegment, VectorClock sealed) {
        if (proposal.segmentNumber() != nextSegment) {
            return refuse(proposal, "expected segment " + nextSegment + ", got " + proposal.segmentNumber());
        }
        if (proposal.size() == 0) {
            return refuse(proposal, "empty proposal");
        }
        Optional<HashValue> root = MerkleTree.build(proposal.recordHashes()).root();
        if (root.isEmpty() || !root.get().equals(proposal.root())) {
            return refuse(proposal, "root does not commit to the listed hashes");
        }

        List<AuditRecord> ordered = new ArrayList<>(proposal.size());
        for (int i = 0; i < proposal.size(); i++) {
            RecordSlot slot = proposal.slots().get(i);
            Optional<AuditRecord> held = records.find(slot);
            if (held.isEmpty()) {
                return refuse(proposal, "record " + slot + " not held yet");
            }
            AuditRecord r = held.get();
            HashValue proposed = proposal.recordHashes().get(i);
            if (!r.recordHash().equals(proposed)) {
                ForkEvidence evidence = new ForkEvidence(slot, r.recordHash(), proposed);
                LOG.error("{} votes FORK on segment {}: {}", self, proposal.segmentNumber(),
                        evidence.toException().getMessage());
                return Vote.fork(self, evidence);
            }
            if (!r.id().equals(proposal.recordIds().get(i))) {
                return refuse(proposal, "record id mismatch at " + slot);
            }
            if (strategy.reverifiesContent() && !r.hashMatchesContent()) {
                return refuse(proposal, "record " + slot + " does not match its hash");
            }
            ordered.add(r);
        }

        // After this loop 'expected' is the sealed frontier once the proposal is sealed
        Map<String, Long> expected = new HashMap<>(sealed.entries());
        for (AuditRecord r : sortedBySlot(ordered)) {
            long want = expected.getOrDefault(r.nodeId(), 0L);
            if (r.localSequence() != want) {
                return refuse(proposal, "membership gap: " + r.nodeId() + " continues at " + want +
                        ", proposal has " + r.slot());
            }
            expected.put(r.nodeId(), want + 1);
        }
        for (AuditRecord r : ordered) {
            for (Map.Entry<String, Long> e : r.vectorClock().entries().entrySet()) {
                if (e.getValue() > expected.getOrDefault(e.getKey(), 0L)) {
                    return refuse(proposal, "record " + r.slot() + " depends on " + e.getKey() + "#" +
                            (e.getValue() - 1) + ", which is neither sealed nor proposed");
                }
            }
        }
        int violation = CausalOrder.firstViolation(ordered);
        if (violation >= 0) {
            return refuse(proposal, "record " + ordered.get(violation).slot() + " precedes a dependency");
        }

        List<RecordSlot> localOrder = new ArrayList<>(ordered.size());
        CausalOrder.canonical(ordered).forEach(r -> localOrder.add(r.slot()));
        if (!strategy.acknowledges(proposal, localOrder)) {
            return refuse(proposal, strategy.name() + " strategy refuses the order");
        }
        LOG.debug("{} ACKs {}", self, proposal);
        return Vote.ack(self);
    }

    private static List<AuditRecord> sortedBySlot(List<AuditRecord> ordered) {
        List<AuditRecord> copy = new ArrayList<>(ordered);
        copy.sort(CausalOrder.BY_SLOT);
        return copy;
    }

    private Vote refuse(Proposal proposal, String reason) {
        LOG.debug("{} NACKs segment {} from {}: {}", self, proposal.segmentNumber(), proposal.proposer(), reason);
        return Vote.nack(self, reason);
    }
}
