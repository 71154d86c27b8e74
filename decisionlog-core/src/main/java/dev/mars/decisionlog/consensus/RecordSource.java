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
import dev.mars.decisionlog.record.VectorClock;

import java.util.List;
import java.util.Optional;

/**
 * The records a node holds, own and replicated, as the coordinator reads them.
 */
public interface RecordSource {

    /** The record at {@code slot}, if held. */
    Optional<AuditRecord> find(RecordSlot slot);

    /**
     * Records beyond {@code sealed}, causally closed, at most {@code limit}, in delivery order.
     */
    List<AuditRecord> unsealed(VectorClock sealed, int limit);
}
