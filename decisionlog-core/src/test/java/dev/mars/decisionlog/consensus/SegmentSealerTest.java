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

import dev.mars.decisionlog.DecisionLogConfig.ConsensusKind;
import dev.mars.decisionlog.TestCluster;
import dev.mars.decisionlog.TestRecords;
import dev.mars.decisionlog.merkle.Segment;
import dev.mars.decisionlog.node.LedgerNode;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.RecordSlot;
import dev.mars.decisionlog.record.VectorClock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SegmentSealerTest {

    private static SegmentSealer sealer(LedgerNode node, int segmentSize, long sealIntervalMs) {
        RecordSource unsealed = new RecordSource() {
            @Override
            public Optional<AuditRecord> find(RecordSlot slot) {
                return Optional.empty();
            }

            @Override
            public List<AuditRecord> unsealed(VectorClock sealed, int limit) {
                return node.recordsAfter(sealed, limit);
            }
        };
        return new SegmentSealer(node.nodeId(), node.coordinator(), unsealed, segmentSize, sealIntervalMs);
    }

    @Test
    void testTick_SealsFullSegment() {
        try (TestCluster cluster = TestCluster.of(ConsensusKind.MAJORITY, b -> b.segmentSize(4), "solo");
             SegmentSealer sealer = sealer(cluster.node(0), 4, 60_000)) {
            cluster.write(0, 3);
            assertTrue(sealer.tick().isEmpty());

            cluster.write(0, 2);
            Optional<Segment> sealed = sealer.tick();

            assertTrue(sealed.isPresent());
            assertEquals(4, sealed.get().size());
        }
    }

    @Test
    void testTick_SealsPartialSegmentWhenIntervalPassed() throws InterruptedException {
        try (TestCluster cluster = TestCluster.of(ConsensusKind.MAJORITY, "solo");
             SegmentSealer sealer = sealer(cluster.node(0), 100, 20)) {
            assertTrue(sealer.tick().isEmpty());
            cluster.write(0, 2);
            Thread.sleep(40);

            Optional<Segment> sealed = sealer.tick();

            assertEquals(2, sealed.map(Segment::size).orElse(0));
        }
    }

    @Test
    void testMissedQuorum_RetriedOnLaterTick() {
        try (TestCluster cluster = TestCluster.of(ConsensusKind.MAJORITY, b -> b.segmentSize(2), "a", "b", "c");
             SegmentSealer sealer = sealer(cluster.node(0), 2, 60_000)) {
            cluster.write(0, 2);

            assertTrue(sealer.tick().isEmpty());
            assertFalse(sealer.isHalted());

            cluster.syncAll();
            assertTrue(sealer.tick().isPresent());
        }
    }

    @Test
    void testFork_HaltsSealer() {
        try (TestCluster cluster = TestCluster.of(ConsensusKind.MAJORITY, b -> b.segmentSize(2), "a", "b");
             SegmentSealer sealer = sealer(cluster.node(0), 2, 60_000)) {
            cluster.node(1).replicas().commit(TestRecords.chain("a", 2));
            cluster.write(0, 2);

            assertTrue(sealer.tick().isEmpty());
            assertTrue(sealer.isHalted());

            cluster.write(0, 2);
            assertTrue(sealer.tick().isEmpty());
            assertEquals(0, cluster.node(0).coordinator().nextSegmentNumber());
        }
    }

    @Test
    void testBackground_SealsAndCancels() throws InterruptedException {
        try (TestCluster cluster = TestCluster.of(ConsensusKind.MAJORITY, b -> b.segmentSize(5), "solo");
             SegmentSealer sealer = sealer(cluster.node(0), 5, 60_000)) {
            sealer.start();
            sealer.start();
            cluster.write(0, 10);

            ConsensusCoordinator coordinator = cluster.node(0).coordinator();
            long deadline = System.currentTimeMillis() + 5_000;
            while (coordinator.nextSegmentNumber() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            sealer.cancel();

            assertEquals(2, coordinator.nextSegmentNumber());
            assertEquals(10, coordinator.sealedFrontier().get("solo"));
        }
    }
}
