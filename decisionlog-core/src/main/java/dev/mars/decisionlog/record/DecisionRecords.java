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

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Entry point for decision producers.
 * <p>
 * Turns the outcome of a statute evaluation into an unsealed {@link RecordDraft}
 * ready for {@code HashChainLedger.append}. Statute and subject references and
 * the context/result payloads are opaque to the ledger.
 */
public final class DecisionRecords {

    private DecisionRecords() {
    }

    /**
     * Creates a draft with a fresh random id, timestamped now.
     */
    public static RecordDraft draft(EventType eventType, Actor actor,
                                    byte[] statuteId, byte[] subjectId,
                                    byte[] decisionContext, byte[] decisionResult) {
        return draft(Clock.systemUTC(), eventType, actor, statuteId, subjectId,
                decisionContext, decisionResult);
    }

    /**
     * Creates a draft timestamped from the given clock.
     */
    public static RecordDraft draft(Clock clock, EventType eventType, Actor actor,
                                    byte[] statuteId, byte[] subjectId,
                                    byte[] decisionContext, byte[] decisionResult) {
        return new RecordDraft(UUID.randomUUID(), Instant.now(clock), eventType, actor,
                statuteId, subjectId, decisionContext, decisionResult);
    }

    /**
     * UTF-8 convenience overload for textual references and payloads.
     */
    public static RecordDraft draft(EventType eventType, Actor actor,
                                    String statuteId, String subjectId,
                                    String decisionContext, String decisionResult) {
        return draft(eventType, actor, utf8(statuteId), utf8(subjectId),
                utf8(decisionContext), utf8(decisionResult));
    }

    private static byte[] utf8(String s) {
        return s == null ? null : s.getBytes(StandardCharsets.UTF_8);
    }
}
