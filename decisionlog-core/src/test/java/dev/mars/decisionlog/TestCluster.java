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

import dev.mars.decisionlog.DecisionLogConfig.ConsensusKind;
import dev.mars.decisionlog.consensus.ClusterMembership;
import dev.mars.decisionlog.node.LedgerNode;
import dev.mars.decisionlog.record.AuditRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Fully connected in-memory nodes for cluster tests.
 */
public final class TestCluster implements AutoCloseable {

    private final List<LedgerNode> nodes = new ArrayList<>();

    private TestCluster(ConsensusKind kind, UnaryOperator<DecisionLogConfig.Builder> tuning, String... ids) {
        ClusterMembership membership = ClusterMembership.of(ids);
        for (String id : ids) {
            DecisionLogConfig config = tuning.apply(TestRecords.config(id).toBuilder()
                    .consensusStrategy(kind)
                    .quorumTimeoutMs(300)).build();
            nodes.add(LedgerNode.inMemory(config, membership).open());
        }
        for (LedgerNode node : nodes) {
            for (LedgerNode other : nodes) {
                if (other != node) {
                    node.connect(other);
                }
            }
        }
    }

    public static TestCluster of(ConsensusKind kind, String... ids) {
        return new TestCluster(kind, b -> b, ids);
    }

    public static TestCluster of(ConsensusKind kind, UnaryOperator<DecisionLogConfig.Builder> tuning, String... ids) {
        return new TestCluster(kind, tuning, ids);
    }

    public LedgerNode node(int i) {
        return nodes.get(i);
    }

    public List<LedgerNode> nodes() {
        return nodes;
    }

    /** Appends {@code n} decisions on node {@code i}. */
    public List<AuditRecord> write(int i, int n) {
        LedgerNode node = nodes.get(i);
        List<AuditRecord> out = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            out.add(node.recordDecision(TestRecords.draft(node.nodeId() + "-" + node.ledger().size())));
        }
        return out;
    }

    /** Two pairwise passes, enough for every node to hold every record. */
    public void syncAll() {
        for (int pass = 0; pass < 2; pass++) {
            for (LedgerNode node : nodes) {
                for (LedgerNode other : nodes) {
                    if (other != node) {
                        node.syncWith(other);
                    }
                }
            }
        }
    }

    @Override
    public void close() {
        nodes.forEach(LedgerNode::close);
    }
}
