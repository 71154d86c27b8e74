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
 * How a cluster agrees on the order of a segment.
 * <p>
 * Chosen once per deployment ({@link OrderingStrategies#forKind}); every node of a
 * cluster must run the same kind. Every order a strategy proposes is a linear
 * extension of happens-before; strategies differ in who may propose, how many
 * acknowledgements seal a segment and over how many phases.
 */
public interface OrderingStrategy {

    /** Short name for logs. */
    String name();

    /**
     * Orders a causally closed candidate set.
     */
    List<AuditRecord> propose(List<AuditRecord> candidates);

    /** Acknowledgements needed per phase, the proposer's own included. */
    int quorumSize();

    /** Voting phases a proposal goes through. */
    default int phases() {
        return 1;
    }

    /** Current epoch; strategies without epochs stay at 0. */
    default long epoch() {
        return 0;
    }

    /** True if {@code nodeId} may propose in the current epoch. */
    default boolean mayPropose(String nodeId) {
        return true;
    }

    /** True if voters recompute every record hash from content. */
    default boolean reverifiesContent() {
        return false;
    }

    /**
     * Strategy-specific acceptance of a proposal that already passed the generic checks
     * (membership, hashes, causal order).
     *
     * @param localOrder the canonical order this voter computes for the same records
     */
    boolean acknowledges(Proposal proposal, List<RecordSlot> localOrder);

    /** Called when a round misses its quorum. */
    default void onTimeout(SegmentRound round) {
    }
}
