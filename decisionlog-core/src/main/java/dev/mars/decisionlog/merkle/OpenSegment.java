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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The local segment still taking records.
 * <p>
 * Fed by the ledger's append path, one leaf per local record, with the tree
 * extended incrementally. When a segment seals, the records it took are dropped
 * and the tree is rebuilt over what is left.
 */
public final class OpenSegment {

    private static final Logger LOG = LoggerFactory.getLogger(OpenSegment.class);

    private final List<AuditRecord> records = new ArrayList<>();
    private MerkleTree tree = new MerkleTree();

    /** Adds a freshly appended record. */
    public synchronized void add(AuditRecord record) {
        records.add(record);
        tree.append(record.recordHash());
    }

    public synchronized int size() {
        return records.size();
    }

    /** Current root over the open records, empty when nothing is open. */
    public synchronized Optional<HashValue> root() {
        return tree.root();
    }

    public synchronized MerkleProof prove(int position) {
        return tree.prove(position);
    }

    public synchronized List<AuditRecord> records() {
        return List.copyOf(records);
    }

    /**
     * Drops the records a sealed segment took.
     *
     * @return number of records removed
     */
    public synchronized int release(Set<RecordSlot> sealed) {
        int before = records.size();
        records.removeIf(r -> sealed.contains(r.slot()));
        int removed = before - records.size();
        if (removed > 0) {
            List<HashValue> leaves = new ArrayList<>(records.size());
            records.forEach(r -> leaves.add(r.recordHash()));
            tree = MerkleTree.build(leaves);
            LOG.debug("Released {} sealed records, {} still open", removed, records.size());
        }
        return removed;
    }
}
