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
import dev.mars.decisionlog.record.RecordSlot;
import dev.mars.decisionlog.record.VectorClock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pure calculator that decides what to do with an inbound batch of records.
 * <p>
 * This class implements the "Prepare" phase of the Prepare → Persist → Apply pattern.
 * It computes which records can be delivered without mutating any state, so a crash
 * or failure mid-batch leaves replicas untouched.
 * <p>
 * <b>Classification:</b>
 * <ul>
 *   <li><b>accepted</b> - next in its origin's chain, every causal dependency already
 *       delivered (or earlier in the batch), linked to the known predecessor</li>
 *   <li><b>duplicate</b> - same position and same hash as a record already held</li>
 *   <li><b>fork</b> - a position already held with a different hash, or a record that
 *       links to a predecessor hash other than the one held</li>
 *   <li><b>tampered</b> - stored hash does not match the content</li>
 *   <li><b>violation</b> - a gap in the origin's sequence, a missing dependency, a bad
 *       clock step, or a record of the receiving node beyond its own head</li>
 * </ul>
 * <p>
 * <b>Usage Pattern (Prepare → Persist → Apply):</b>
 * <pre>{@code
 * // 1. Calculate the plan (no mutations)
 * MergePlan plan = MergePlan.from(receiverId, frontier, replicas::hashAt, batch);
 *
 * // 2. Persist (each accepted record durable before it becomes visible)
 * if (!plan.hasForks()) {
 *     replicas.commit(plan.accepted());
 * }
 * }</pre>
 *
 * @param accepted   records to deliver, in delivery order
 * @param duplicates records already held
 * @param forks      divergent positions
 * @param tampered   records whose hash does not match their content
 * @param violations records that would break causal order
 * @param frontier   receiver frontier after delivering {@code accepted}
 */
public record MergePlan(
        List<AuditRecord> accepted,
        int duplicates,
        List<ForkEvidence> forks,
        List<AuditRecord> tampered,
        List<CausalViolation> violations,
        VectorClock frontier
) {

    /**
     * Causal delivery order: clock weight, then {@code (nodeId, localSequence)}.
     * Weight strictly grows along happens-before, so this is a linear extension of it.
     */
    public static final Comparator<AuditRecord> DELIVERY_ORDER = Comparator
            .comparingLong((AuditRecord r) -> r.vectorClock().weight())
            .thenComparing(AuditRecord::slot);

    /**
     * Hashes the receiver already holds.
     */
    @FunctionalInterface
    public interface KnownHashes {
        Optional<HashValue> hashAt(String origin, long sequence);
    }

    public MergePlan {
        accepted = List.copyOf(accepted);
        forks = List.copyOf(forks);
        tampered = List.copyOf(tampered);
        violations = List.copyOf(violations);
    }

    /**
     * Calculates the plan for {@code incoming} against the receiver's current state.
     *
     * @param receiver receiving node id
     * @param frontier records held per origin, receiver's own chain included
     * @param known    lookup of held hashes
     * @param incoming the batch, in any order
     */
    public static MergePlan from(String receiver, VectorClock frontier, KnownHashes known,
                                 List<AuditRecord> incoming) {
        if (incoming == null || incoming.isEmpty()) {
            return new MergePlan(List.of(), 0, List.of(), List.of(), List.of(), frontier);
        }
        List<AuditRecord> sorted = new ArrayList<>(incoming);
        sorted.sort(DELIVERY_ORDER);

        Map<String, Long> next = new HashMap<>(frontier.entries());
        Map<RecordSlot, HashValue> inBatch = new HashMap<>();
        List<AuditRecord> accepted = new ArrayList<>();
        List<ForkEvidence> forks = new ArrayList<>();
        List<AuditRecord> tampered = new ArrayList<>();
        List<CausalViolation> violations = new ArrayList<>();
        int duplicates = 0;

        for (AuditRecord r : sorted) {
            if (!r.hashMatchesContent()) {
                tampered.add(r);
                continue;
            }
            String origin = r.nodeId();
            long seq = r.localSequence();
            long expected = next.getOrDefault(origin, 0L);

            if (seq < expected) {
                HashValue held = lookup(known, inBatch, origin, seq);
                if (r.recordHash().equals(held)) {
                    duplicates++;
                } else {
                    forks.add(new ForkEvidence(r.slot(), held == null ? HashValue.ZERO : held, r.recordHash()));
                }
                continue;
            }
            if (origin.equals(receiver)) {
                violations.add(new CausalViolation(r.slot(), "record of the receiving node beyond its head " + expected));
                continue;
            }
            if (seq > expected) {
                violations.add(new CausalViolation(r.slot(), "gap: next expected sequence is " + expected));
                continue;
            }
            if (r.vectorClock().get(origin) != seq + 1) {
                violations.add(new CausalViolation(r.slot(),
                        "own clock entry " + r.vectorClock().get(origin) + " at sequence " + seq));
                continue;
            }
            String missing = missingDependency(r, next);
            if (missing != null) {
                violations.add(new CausalViolation(r.slot(), "missing causal dependency " + missing));
                continue;
            }
            if (seq == 0) {
                if (!r.prevHash().isZero()) {
                    violations.add(new CausalViolation(r.slot(), "genesis record with non-zero prev hash"));
                    continue;
                }
            } else {
                HashValue prev = lookup(known, inBatch, origin, seq - 1);
                if (!r.prevHash().equals(prev)) {
                    forks.add(new ForkEvidence(new RecordSlot(origin, seq - 1),
                            prev == null ? HashValue.ZERO : prev, r.prevHash()));
                    continue;
                }
            }
            accepted.add(r);
            inBatch.put(r.slot(), r.recordHash());
            next.put(origin, seq + 1);
        }
        return new MergePlan(accepted, duplicates, forks, tampered, violations, VectorClock.of(next));
    }

    private static HashValue lookup(KnownHashes known, Map<RecordSlot, HashValue> inBatch, String origin, long seq) {
        HashValue h = inBatch.get(new RecordSlot(origin, seq));
        return h != null ? h : known.hashAt(origin, seq).orElse(null);
    }

    private static String missingDependency(AuditRecord r, Map<String, Long> delivered) {
        for (Map.Entry<String, Long> e : r.vectorClock().entries().entrySet()) {
            if (e.getKey().equals(r.nodeId())) {
                continue;
            }
            if (e.getValue() > delivered.getOrDefault(e.getKey(), 0L)) {
                return e.getKey() + "#" + (e.getValue() - 1);
            }
        }
        return null;
    }

    public boolean hasForks() {
        return !forks.isEmpty();
    }

    /** Tampered records plus causal violations. */
    public int rejected() {
        return tampered.size() + violations.size();
    }

    /**
     * @return true if this plan delivers anything
     */
    public boolean requiresPersistence() {
        return !accepted.isEmpty() && forks.isEmpty();
    }

    /** Accepted records concurrent with {@code clock}. */
    public int concurrentWith(VectorClock clock) {
        if (clock.isEmpty()) {
            return 0;
        }
        int n = 0;
        for (AuditRecord r : accepted) {
            if (r.vectorClock().isConcurrentWith(clock)) {
                n++;
            }
        }
        return n;
    }

    static List<AuditRecord> deliveryOrdered(List<AuditRecord> records) {
        List<AuditRecord> copy = new ArrayList<>(records);
        copy.sort(DELIVERY_ORDER);
        return Collections.unmodifiableList(copy);
    }
}
