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
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordSlot;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A proposed segment: membership and order, committed to by a Merkle root.
 * <p>
 * Records travel by reference only; voters look them up in their own replicas.
 *
 * @param segmentNumber number the segment will carry once sealed
 * @param proposer      proposing node
 * @param epoch         strategy epoch the proposal belongs to
 * @param phase         1-based voting phase
 * @param slots         record positions, in proposed order
 * @param recordIds     record ids, same order
 * @param recordHashes  record hashes, same order
 * @param root          Merkle root over {@code recordHashes}
 */
public record Proposal(long segmentNumber, String proposer, long epoch, int phase,
                       List<RecordSlot> slots, List<UUID> recordIds, List<HashValue> recordHashes,
                       HashValue root) {

    public Proposal {
        slots = List.copyOf(slots);
        recordIds = List.copyOf(recordIds);
        recordHashes = List.copyOf(recordHashes);
        if (slots.size() != recordIds.size() || slots.size() != recordHashes.size()) {
            throw new IllegalArgumentException("Proposal lists differ in length");
        }
    }

    public static Proposal of(long segmentNumber, String proposer, long epoch,
                              List<AuditRecord> ordered, HashValue root) {
        List<RecordSlot> slots = new ArrayList<>(ordered.size());
        List<UUID> ids = new ArrayList<>(ordered.size());
        List<HashValue> hashes = new ArrayList<>(ordered.size());
        for (AuditRecord r : ordered) {
            slots.add(r.slot());
            ids.add(r.id());
            hashes.add(r.recordHash());
        }
        return new Proposal(segmentNumber, proposer, epoch, 1, slots, ids, hashes, root);
    }

    public Proposal inPhase(int nextPhase) {
        return new Proposal(segmentNumber, proposer, epoch, nextPhase, slots, recordIds, recordHashes, root);
    }

    public int size() {
        return slots.size();
    }

    @Override
    public String toString() {
        return "Proposal{segment=" + segmentNumber + ", proposer=" + proposer + ", epoch=" + epoch +
                ", phase=" + phase + ", records=" + slots.size() + ", root=" + root.shortHex() + '}';
    }
}
