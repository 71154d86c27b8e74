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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * The known nodes of a cluster, sorted by id.
 */
public final class ClusterMembership {

    private final List<String> nodes;

    public ClusterMembership(Collection<String> nodeIds) {
        TreeSet<String> sorted = new TreeSet<>(nodeIds);
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one node");
        }
        this.nodes = List.copyOf(new ArrayList<>(sorted));
    }

    public static ClusterMembership of(String... nodeIds) {
        return new ClusterMembership(List.of(nodeIds));
    }

    public List<String> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String nodeId) {
        return nodes.contains(nodeId);
    }

    /** Node at {@code index} modulo the cluster size. */
    public String rotate(long index) {
        return nodes.get((int) Math.floorMod(index, (long) nodes.size()));
    }

    @Override
    public String toString() {
        return nodes.toString();
    }
}
