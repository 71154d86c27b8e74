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
package dev.mars.decisionlog.record;

import java.util.Comparator;
import java.util.Objects;

/**
 * Position of a record in its author's local chain.
 * <p>
 * Two records claiming the same slot with different hashes are a fork.
 * The natural order, {@code (nodeId, localSequence)} lexicographic, is the
 * deterministic tie-break used when ordering concurrent records.
 *
 * @param nodeId        authoring node
 * @param localSequence position in that node's chain, from 0
 */
public record RecordSlot(String nodeId, long localSequence) implements Comparable<RecordSlot> {

    private static final Comparator<RecordSlot> ORDER = Comparator
            .comparing(RecordSlot::nodeId)
            .thenComparingLong(RecordSlot::localSequence);

    public RecordSlot {
        Objects.requireNonNull(nodeId, "nodeId");
    }

    @Override
    public int compareTo(RecordSlot other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return nodeId + "#" + localSequence;
    }
}
