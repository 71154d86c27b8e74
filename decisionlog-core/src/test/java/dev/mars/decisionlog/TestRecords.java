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
package dev.mars.decisionlog;

import dev.mars.decisionlog.record.Actor;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.DecisionRecords;
import dev.mars.decisionlog.record.EventType;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordDraft;
import dev.mars.decisionlog.record.VectorClock;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shared fixtures for ledger tests.
 */
public final class TestRecords {

    private TestRecords() {
    }

    /** Draft whose decision result is {@code "result-" + label + ";"}. */
    public static RecordDraft draft(String label) {
        return DecisionRecords.draft(EventType.AUTOMATIC_DECISION, new Actor.System("rules-engine"),
                "statute-1", "subject-" + label, "context-" + label, "result-" + label + ";");
    }

    public static RecordDraft draft(EventType type, String statute, String subject, Instant at) {
        return new RecordDraft(UUID.randomUUID(), at, type, new Actor.User("clerk", "REVIEWER"),
                utf8(statute), utf8(subject), utf8("ctx"), utf8("res"));
    }

    /**
     * A valid standalone chain of {@code n} records authored by {@code nodeId}, with no
     * dependencies on other nodes.
     */
    public static List<AuditRecord> chain(String nodeId, int n) {
        List<AuditRecord> out = new ArrayList<>(n);
        HashValue prev = HashValue.ZERO;
        for (int i = 0; i < n; i++) {
            AuditRecord r = AuditRecord.seal(draft(nodeId + "-" + i), nodeId, i,
                    VectorClock.of(Map.of(nodeId, (long) i + 1)), prev);
            out.add(r);
            prev = r.recordHash();
        }
        return out;
    }

    /** Seals the next record of a chain ending in {@code last} with extra causal dependencies. */
    public static AuditRecord next(AuditRecord last, VectorClock observed, String label) {
        VectorClock clock = last.vectorClock().merge(observed).advance(last.nodeId(), last.localSequence() + 2);
        return AuditRecord.seal(draft(label), last.nodeId(), last.localSequence() + 1, clock, last.recordHash());
    }

    /** Configuration for tests: no fsync, no disk space floor, short timeouts. */
    public static DecisionLogConfig config(String nodeId, Path dataDir) {
        return DecisionLogConfig.builder()
                .nodeId(nodeId)
                .dataDir(dataDir)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .ioTimeoutMs(5_000)
                .syncIntervalMs(10)
                .quorumTimeoutMs(1_000)
                .maxQuorumAttempts(2)
                .sampleSeed(42)
                .build();
    }

    public static DecisionLogConfig config(String nodeId) {
        return config(nodeId, Path.of("target", "test-data", nodeId));
    }

    public static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    /** First index of {@code needle} in {@code data}, or -1. */
    public static int indexOf(byte[] data, byte[] needle) {
        outer:
        for (int i = 0; i <= data.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (data[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
