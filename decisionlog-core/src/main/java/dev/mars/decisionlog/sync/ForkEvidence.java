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

import dev.mars.decisionlog.error.ForkDetectedException;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordSlot;

import java.util.Objects;

/**
 * Two different hashes claimed for the same chain position.
 *
 * @param slot       the contested {@code (nodeId, localSequence)}
 * @param localHash  hash held locally
 * @param remoteHash hash the other side holds or links to
 */
public record ForkEvidence(RecordSlot slot, HashValue localHash, HashValue remoteHash) {

    public ForkEvidence {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(localHash, "localHash");
        Objects.requireNonNull(remoteHash, "remoteHash");
    }

    public ForkDetectedException toException() {
        return new ForkDetectedException(slot.nodeId(), slot.localSequence(),
                "Fork at " + slot + ": local " + localHash.shortHex() + " vs remote " + remoteHash.shortHex());
    }
}
