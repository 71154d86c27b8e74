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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An unsealed decision record, as handed over by the decision producer.
 * <p>
 * Carries everything the producer knows. Chain position, vector clock and
 * hashes are assigned by the ledger at append time.
 *
 * @param id              globally unique id, never reused
 * @param timestamp       wall-clock creation time (informational only)
 * @param eventType       kind of event
 * @param actor           who triggered it
 * @param statuteId       opaque statute reference
 * @param subjectId       opaque subject reference
 * @param decisionContext opaque serialized input context
 * @param decisionResult  opaque serialized outcome
 */
public record RecordDraft(
        UUID id,
        Instant timestamp,
        EventType eventType,
        Actor actor,
        byte[] statuteId,
        byte[] subjectId,
        byte[] decisionContext,
        byte[] decisionResult
) {

    public RecordDraft {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(actor, "actor");
        statuteId = copyOrEmpty(statuteId);
        subjectId = copyOrEmpty(subjectId);
        decisionContext = copyOrEmpty(decisionContext);
        decisionResult = copyOrEmpty(decisionResult);
    }

    private static byte[] copyOrEmpty(byte[] b) {
        return b == null ? new byte[0] : b.clone();
    }
}
