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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable vector clock: node id to monotonically increasing counter.
 * <p>
 * Missing entries read as zero. Entries are kept sorted by node id so that
 * iteration order, and therefore the canonical encoding, is deterministic.
 * <p>
 * A record's clock captures its causal history at creation time. For a record
 * authored by node {@code n} with local sequence {@code s}, {@code get(n) == s + 1}.
 */
public final class VectorClock {

    /**
     * Causal relation of one clock to another.
     */
    public enum Causality {
        /** This clock happened strictly before the other. */
        BEFORE,
        /** This clock happened strictly after the other. */
        AFTER,
        /** Both clocks are identical. */
        EQUAL,
        /** Neither clock dominates the other. */
        CONCURRENT
    }

    private static final VectorClock EMPTY = new VectorClock(new TreeMap<>());

    private final SortedMap<String, Long> counters;

    private VectorClock(TreeMap<String, Long> counters) {
        this.counters = Collections.unmodifiableSortedMap(counters);
    }

    public static VectorClock empty() {
        return EMPTY;
    }

    /**
     * Creates a clock from the given entries. Zero entries are dropped.
     *
     * @throws IllegalArgumentException on a negative counter
     */
    public static VectorClock of(Map<String, Long> entries) {
        TreeMap<String, Long> copy = new TreeMap<>();
        entries.forEach((node, value) -> {
            Objects.requireNonNull(node, "node id");
            if (value == null || value < 0) {
                throw new IllegalArgumentException("Invalid counter for " + node + ": " + value);
            }
            if (value > 0) {
                copy.put(node, value);
            }
        });
        return copy.isEmpty() ? EMPTY : new VectorClock(copy);
    }

    /** Counter for {@code nodeId}, zero if absent. */
    public long get(String nodeId) {
        return counters.getOrDefault(nodeId, 0L);
    }

    /** Returns a clock with {@code nodeId}'s counter advanced by one. */
    public VectorClock increment(String nodeId) {
        TreeMap<String, Long> copy = new TreeMap<>(counters);
        copy.merge(nodeId, 1L, Long::sum);
        return new VectorClock(copy);
    }

    /** Returns a clock with {@code nodeId}'s counter set to at least {@code value}. */
    public VectorClock advance(String nodeId, long value) {
        if (value <= get(nodeId)) {
            return this;
        }
        TreeMap<String, Long> copy = new TreeMap<>(counters);
        copy.put(nodeId, value);
        return new VectorClock(copy);
    }

    /** Entry-wise maximum of both clocks. */
    public VectorClock merge(VectorClock other) {
        if (other.counters.isEmpty()) {
            return this;
        }
        if (counters.isEmpty()) {
            return other;
        }
        TreeMap<String, Long> copy = new TreeMap<>(counters);
        other.counters.forEach((node, value) -> copy.merge(node, value, Math::max));
        return new VectorClock(copy);
    }

    /**
     * Compares this clock against {@code other}.
     */
    public Causality compare(VectorClock other) {
        boolean less = false;
        boolean greater = false;
        for (Map.Entry<String, Long> e : counters.entrySet()) {
            long theirs = other.get(e.getKey());
            if (e.getValue() < theirs) {
                less = true;
            } else if (e.getValue() > theirs) {
                greater = true;
            }
        }
        for (Map.Entry<String, Long> e : other.counters.entrySet()) {
            if (!counters.containsKey(e.getKey())) {
                less = true;
            }
        }
        if (less && greater) {
            return Causality.CONCURRENT;
        }
        if (less) {
            return Causality.BEFORE;
        }
        if (greater) {
            return Causality.AFTER;
        }
        return Causality.EQUAL;
    }

    /** True if every entry of {@code other} is less than or equal to ours. */
    public boolean dominates(VectorClock other) {
        Causality c = compare(other);
        return c == Causality.AFTER || c == Causality.EQUAL;
    }

    public boolean happensBefore(VectorClock other) {
        return compare(other) == Causality.BEFORE;
    }

    public boolean isConcurrentWith(VectorClock other) {
        return compare(other) == Causality.CONCURRENT;
    }

    /** Sum of all counters; strictly grows along happens-before. */
    public long weight() {
        long sum = 0;
        for (long v : counters.values()) {
            sum += v;
        }
        return sum;
    }

    /** Read-only, node-id-sorted view of the non-zero entries. */
    public SortedMap<String, Long> entries() {
        return counters;
    }

    public int size() {
        return counters.size();
    }

    public boolean isEmpty() {
        return counters.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof VectorClock other && counters.equals(other.counters);
    }

    @Override
    public int hashCode() {
        return counters.hashCode();
    }

    @Override
    public String toString() {
        return counters.toString();
    }
}
