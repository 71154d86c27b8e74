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

import dev.mars.decisionlog.error.CausalOrderViolationException;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.RecordSlot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Linear extensions of happens-before over a set of records.
 * <p>
 * Only direct dependencies are materialised: a record's predecessor on its own node
 * and, for every other clock entry {@code (n, v)}, the record {@code n#(v-1)}. Chains
 * on each node are contiguous inside a candidate set, so these edges imply every
 * happens-before pair in the set. Dependencies outside the set are treated as
 * already ordered (sealed earlier).
 */
public final class CausalOrder {

    /** Canonical tie-break among concurrent records: {@code (nodeId, localSequence)}. */
    public static final Comparator<AuditRecord> BY_SLOT = Comparator.comparing(AuditRecord::slot);

    private CausalOrder() {
    }

    /** The canonical order: Kahn's algorithm, ready records taken smallest slot first. */
    public static List<AuditRecord> canonical(List<AuditRecord> records) {
        return sort(records, BY_SLOT);
    }

    /**
     * Kahn's topological sort with {@code tieBreak} choosing among ready records.
     *
     * @throws CausalOrderViolationException if the clocks describe a cycle
     */
    public static List<AuditRecord> sort(List<AuditRecord> records, Comparator<AuditRecord> tieBreak) {
        Map<RecordSlot, AuditRecord> bySlot = index(records);
        Map<RecordSlot, Integer> pending = new HashMap<>();
        Map<RecordSlot, List<AuditRecord>> dependents = new HashMap<>();
        for (AuditRecord r : records) {
            int deps = 0;
            for (RecordSlot dep : directDependencies(r)) {
                if (bySlot.containsKey(dep)) {
                    dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(r);
                    deps++;
                }
            }
            pending.put(r.slot(), deps);
        }

        PriorityQueue<AuditRecord> ready = new PriorityQueue<>(tieBreak);
        for (AuditRecord r : records) {
            if (pending.get(r.slot()) == 0) {
                ready.add(r);
            }
        }
        List<AuditRecord> ordered = new ArrayList<>(records.size());
        while (!ready.isEmpty()) {
            AuditRecord next = ready.poll();
            ordered.add(next);
            for (AuditRecord d : dependents.getOrDefault(next.slot(), List.of())) {
                if (pending.merge(d.slot(), -1, Integer::sum) == 0) {
                    ready.add(d);
                }
            }
        }
        if (ordered.size() != records.size()) {
            throw new CausalOrderViolationException("Causal cycle among " +
                    (records.size() - ordered.size()) + " records");
        }
        return ordered;
    }

    /**
     * True if no record appears before one of its direct dependencies.
     */
    public static boolean respectsCausality(List<AuditRecord> ordered) {
        return firstViolation(ordered) < 0;
    }

    /** Position of the first record placed before a dependency, or -1. */
    public static int firstViolation(List<AuditRecord> ordered) {
        Map<RecordSlot, Integer> position = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            position.put(ordered.get(i).slot(), i);
        }
        for (int i = 0; i < ordered.size(); i++) {
            for (RecordSlot dep : directDependencies(ordered.get(i))) {
                Integer p = position.get(dep);
                if (p != null && p > i) {
                    return i;
                }
            }
        }
        return -1;
    }

    static List<RecordSlot> directDependencies(AuditRecord r) {
        List<RecordSlot> deps = new ArrayList<>(r.vectorClock().size());
        if (r.localSequence() > 0) {
            deps.add(new RecordSlot(r.nodeId(), r.localSequence() - 1));
        }
        r.vectorClock().entries().forEach((node, counter) -> {
            if (!node.equals(r.nodeId())) {
                deps.add(new RecordSlot(node, counter - 1));
            }
        });
        return deps;
    }

    private static Map<RecordSlot, AuditRecord> index(List<AuditRecord> records) {
        Map<RecordSlot, AuditRecord> bySlot = new HashMap<>();
        for (AuditRecord r : records) {
            if (bySlot.put(r.slot(), r) != null) {
                throw new IllegalArgumentException("Slot " + r.slot() + " appears twice");
            }
        }
        return bySlot;
    }
}
