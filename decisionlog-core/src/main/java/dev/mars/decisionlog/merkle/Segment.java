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
package dev.mars.decisionlog.merkle;

import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordSlot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A closed, totally ordered run of records with its Merkle root.
 * <p>
 * Records are held by value, in segment order, with a position index by
 * {@code (nodeId, localSequence)}; records know nothing about the segments that
 * contain them. The tree is built once, so proofs cost O(log n).
 * <p>
 * Immutable and safe to share between threads.
 */
public final class Segment {

    private final long number;
    private final List<AuditRecord> records;
    private final Map<RecordSlot, Integer> positions;
    private final MerkleTree tree;

    public Segment(long number, List<AuditRecord> records) {
        if (number < 0) {
            throw new IllegalArgumentException("Segment number must be >= 0: " + number);
        }
        if (records.isEmpty()) {
            throw new IllegalArgumentException("Segment " + number + " has no records");
        }
        this.number = number;
        this.records = List.copyOf(records);
        Map<RecordSlot, Integer> index = new HashMap<>();
        List<HashValue> leaves = new ArrayList<>(records.size());
        for (int i = 0; i < this.records.size(); i++) {
            AuditRecord r = this.records.get(i);
            if (index.put(r.slot(), i) != null) {
                throw new IllegalArgumentException("Slot " + r.slot() + " appears twice in segment " + number);
            }
            leaves.add(r.recordHash());
        }
        this.positions = Collections.unmodifiableMap(index);
        this.tree = MerkleTree.build(leaves);
    }

    public long number() {
        return number;
    }

    public List<AuditRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public AuditRecord record(int position) {
        return records.get(position);
    }

    public HashValue root() {
        return tree.root().orElseThrow();
    }

    /** Position of a record in this segment, or -1. */
    public int positionOf(RecordSlot slot) {
        return positions.getOrDefault(Objects.requireNonNull(slot, "slot"), -1);
    }

    public boolean contains(RecordSlot slot) {
        return positions.containsKey(slot);
    }

    /** Inclusion proof of the record at {@code position}. */
    public MerkleProof prove(int position) {
        return tree.prove(position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Segment other && number == other.number && root().equals(other.root());
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(number) + root().hashCode();
    }

    @Override
    public String toString() {
        return "Segment{number=" + number + ", records=" + records.size() + ", root=" + root().shortHex() + '}';
    }
}
