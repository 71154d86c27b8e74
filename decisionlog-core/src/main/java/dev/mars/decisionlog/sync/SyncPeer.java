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
package dev.mars.decisionlog.sync;

import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.VectorClock;

import java.util.List;
import java.util.Optional;

/**
 * A node as seen by the synchronizer.
 * <p>
 * This is the transport seam: in-process clusters pass nodes directly, a networked
 * deployment would put an RPC client behind it. Any call may fail with
 * {@link PeerUnavailableException}.
 */
public interface SyncPeer {

    String nodeId();

    /**
     * Per origin node, how many of its records this peer holds (own chain included).
     */
    VectorClock frontier();

    /** Hash of this peer's copy of {@code origin}'s record at {@code sequence}. */
    Optional<HashValue> hashAt(String origin, long sequence);

    /** Hash of the last record of {@code origin} this peer holds. */
    Optional<HashValue> headHash(String origin);

    /**
     * Records this peer holds beyond {@code frontier}, in causal delivery order,
     * at most {@code limit} of them. Any prefix of the answer is deliverable by a
     * node whose frontier is {@code frontier}.
     */
    List<AuditRecord> recordsAfter(VectorClock frontier, int limit);

    /**
     * Delivers a batch. Duplicates are ignored, so a retried batch is harmless.
     */
    ReceiveResult receive(List<AuditRecord> batch);
}
