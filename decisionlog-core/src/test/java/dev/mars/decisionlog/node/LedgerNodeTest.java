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
package dev.mars.decisionlog.node;

import dev.mars.decisionlog.DecisionLogConfig;
import dev.mars.decisionlog.DecisionLogConfig.ConsensusKind;
import dev.mars.decisionlog.TestCluster;
import dev.mars.decisionlog.TestRecords;
import dev.mars.decisionlog.consensus.ClusterMembership;
import dev.mars.decisionlog.merkle.Segment;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.VectorClock;
import dev.mars.decisionlog.storage.FileLedgerStorage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link LedgerNode}.
 */
class LedgerNodeTest {

    @TempDir
    Path tempDir;

    @Test
    void testFileBackedNode_SurvivesRestart() {
        DecisionLogConfig config = TestRecords.config("registry-east", tempDir.resolve("east"));
        ClusterMembership membership = ClusterMembership.of("registry-east", "registry-west");
        List<AuditRecord> written;
        try (LedgerNode node = LedgerNode.builder(config).membership(membership)
                .replicaStorage(origin -> new FileLedgerStorage(config.forNode(origin, tempDir.resolve("replica-" + origin))))
                .build().open()) {
            written = List.of(node.recordDecision(TestRecords.draft("1")), node.recordDecision(TestRecords.draft("2")));
            node.receive(TestRecords.chain("registry-west", 4));
        }
        assertTrue(Files.exists(tempDir.resolve("east")));

        try (LedgerNode node = LedgerNode.builder(config).membership(membership)
                .replicaStorage(origin -> new FileLedgerStorage(config.forNode(origin, tempDir.resolve("replica-" + origin))))
                .build().open()) {
            assertEquals(2, node.ledger().size());
            assertEquals(written.get(1).recordHash(), node.ledger().head().get().recordHash());
            assertEquals(4, node.replicas().size("registry-west"));
            assertEquals(VectorClock.of(Map.of("registry-east", 2L, "registry-west", 4L)), node.frontier());
            assertEquals(2, node.openSegment().size());
            assertTrue(node.ledger().verifyAll().isOk());

            AuditRecord third = node.recordDecision(TestRecords.draft("3"));
            assertEquals(written.get(1).recordHash(), third.prevHash());
            assertEquals(3, third.vectorClock().get("registry-east"));
            assertEquals(4, third.vectorClock().get("registry-west"));
        }
    }

    @Test
    void testConnect_RejectsMismatchedEndpoints() {
        try (TestCluster cluster = TestCluster.of(ConsensusKind.MAJORITY, "a", "b", "c")) {
            LedgerNode a = cluster.node(0);

            assertThrows(IllegalArgumentException.class, () -> a.connect(cluster.node(1), cluster.node(2)));
            assertThrows(IllegalArgumentException.class, () -> a.coordinator().addPeer(a));
        }
    }

    @Test
    void testCluster_EveryNodeSealsTheSameLedger() {
        try (TestCluster cluster = TestCluster.of(ConsensusKind.MAJORITY, b -> b.segmentSize(50),
                "registry-east", "registry-north", "registry-west")) {
            for (int i = 0; i < 3; i++) {
                cluster.write(i, 50);
            }
            cluster.syncAll();
            for (int i = 0; i < 3; i++) {
                cluster.write(i, 50);
            }
            cluster.syncAll();

            int sealed = 0;
            for (LedgerNode proposer : cluster.nodes()) {
                Optional<Segment> next = proposer.closeSegment();
                while (next.isPresent()) {
                    sealed++;
                    next = proposer.closeSegment();
                }
            }
            assertEquals(6, sealed);

            List<Segment> reference = cluster.node(0).query().segments();
            assertEquals(6, reference.size());
            for (LedgerNode node : cluster.nodes()) {
                assertEquals(reference, node.query().segments(), node.nodeId());
                assertEquals(300, node.query().summary().records());
                assertTrue(node.query().summary().integrityVerified());
                assertEquals(0, node.openSegment().size());
            }
        }
    }

    @Test
    void testBackgroundSync_Converges() throws InterruptedException {
        try (TestCluster cluster = TestCluster.of(ConsensusKind.MAJORITY,
                b -> b.syncIntervalMs(10).sealIntervalMs(600_000).segmentSize(10_000).gossipFanout(1),
                "a", "b", "c")) {
            cluster.write(0, 20);
            cluster.write(1, 10);
            cluster.write(2, 5);
            cluster.nodes().forEach(LedgerNode::startBackgroundTasks);

            VectorClock target = VectorClock.of(Map.of("a", 20L, "b", 10L, "c", 5L));
            long deadline = System.currentTimeMillis() + 10_000;
            while (System.currentTimeMillis() < deadline
                    && !cluster.nodes().stream().allMatch(n -> n.frontier().equals(target))) {
                Thread.sleep(20);
            }
            cluster.nodes().forEach(LedgerNode::stopBackgroundTasks);

            for (LedgerNode node : cluster.nodes()) {
                assertEquals(target, node.frontier(), node.nodeId());
            }
            assertTrue(cluster.node(2).closeSegment().isPresent());
            assertEquals(35, cluster.node(0).query().records().count());
        }
    }
}
