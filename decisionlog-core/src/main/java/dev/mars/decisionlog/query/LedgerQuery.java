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

import dev.mars.decisionlog.consensus.ConsensusCoordinator;
import dev.mars.decisionlog.merkle.MerkleVerifier;
import dev.mars.decisionlog.merkle.Segment;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only access to sealed segments for analytics and compliance collaborators.
 * <p>
 * Only sealed records are visible; nothing here can change the ledger.
 */
public final class LedgerQuery {

    private static final Logger LOG = LoggerFactory.getLogger(LedgerQuery.class);

    private final ConsensusCoordinator coordinator;
    private final MerkleVerifier verifier;

    public LedgerQuery(ConsensusCoordinator coordinator, MerkleVerifier verifier) {
        this.coordinator = coordinator;
        this.verifier = verifier;
    }

    public List<Segment> segments() {
        return coordinator.sealedSegments();
    }

    /** Every sealed record, in segment order. */
    public Stream<AuditRecord> records() {
        return segments().stream().flatMap(s -> s.records().stream());
    }

    public List<AuditRecord> bySubject(byte[] subjectId) {
        return matching(r -> Arrays.equals(r.subjectId(), subjectId));
    }

    public List<AuditRecord> bySubject(String subjectId) {
        return bySubject(subjectId.getBytes(StandardCharsets.UTF_8));
    }

    public List<AuditRecord> byStatute(byte[] statuteId) {
        return matching(r -> Arrays.equals(r.statuteId(), statuteId));
    }

    public List<AuditRecord> byStatute(String statuteId) {
        return byStatute(statuteId.getBytes(StandardCharsets.UTF_8));
    }

    public List<AuditRecord> byEventType(EventType eventType) {
        return matching(r -> r.eventType() == eventType);
    }

    /** Records timestamped in {@code [from, to)}. */
    public List<AuditRecord> inTimeRange(Instant from, Instant to) {
        return matching(r -> !r.timestamp().isBefore(from) && r.timestamp().isBefore(to));
    }

    /** Counts per event type, time span and a full re-verification of every sealed segment. */
    public ComplianceSummary summary() {
        List<Segment> segments = segments();
        Map<EventType, Long> counts = new EnumMap<>(EventType.class);
        Instant earliest = null;
        Instant latest = null;
        long total = 0;
        boolean intact = true;
        for (Segment segment : segments) {
            intact &= verifier.verifyFull(segment).isOk();
            for (AuditRecord r : segment.records()) {
                counts.merge(r.eventType(), 1L, Long::sum);
                earliest = earliest == null || r.timestamp().isBefore(earliest) ? r.timestamp() : earliest;
                latest = latest == null || r.timestamp().isAfter(latest) ? r.timestamp() : latest;
                total++;
            }
        }
        LOG.debug("Compliance summary: {} segments, {} records, intact={}", segments.size(), total, intact);
        return new ComplianceSummary(segments.size(), total, counts, intact, earliest, latest);
    }

    private List<AuditRecord> matching(Predicate<AuditRecord> filter) {
        return records().filter(filter).collect(Collectors.toList());
    }
}
