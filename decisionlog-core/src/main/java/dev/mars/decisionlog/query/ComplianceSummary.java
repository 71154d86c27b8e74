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
package dev.mars.decisionlog.query;

import dev.mars.decisionlog.record.EventType;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view of the sealed ledger for compliance reporting.
 *
 * @param segments          sealed segments
 * @param records           sealed records
 * @param byEventType       record count per event type
 * @param integrityVerified true if every sealed segment passed full verification
 * @param earliest          earliest record timestamp, null when empty
 * @param latest            latest record timestamp, null when empty
 */
public record ComplianceSummary(int segments, long records, Map<EventType, Long> byEventType,
                                boolean integrityVerified, Instant earliest, Instant latest) {

    public ComplianceSummary {
        byEventType = Map.copyOf(byEventType);
    }

    public long count(EventType type) {
        return byEventType.getOrDefault(type, 0L);
    }
}
