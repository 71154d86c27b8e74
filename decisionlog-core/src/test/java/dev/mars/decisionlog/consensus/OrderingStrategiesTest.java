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
import dev.mars.decisionlog.TestRecords;
import dev.mars.decisionlog.merkle.MerkleVerifier;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.RecordSlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the three {@link OrderingStrategy} implementations.
 */
class OrderingStrategiesTest {

    private static final MerkleVerifier VERIFIER = new MerkleVerifier();

    private static ClusterMembership members(int n) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            ids.add("n" + i);
        }
        return new ClusterMembership(ids);
    }

    private static Proposal proposal(String proposer, long epoch, List<AuditRecord> ordered) {
        return Proposal.of(0, proposer, epoch, ordered, VERIFIER.rootOf(ordered));
    }

    private static List<RecordSlot> slots(List<AuditRecord> records) {
        List<RecordSlot> out = new ArrayList<>();
        records.forEach(r -> out.add(r.slot()));
        return out;
    }

    @Test
    void testForKind() {
        ClusterMembership m = ClusterMembership.of("a", "b", "c", "d");

        assertInstanceOf(MajorityOrdering.class, OrderingStrategies.forKind(ConsensusKind.MAJORITY, m, "a"));
        assertInstanceOf(LeaderReplicatedOrdering.class, OrderingStrategies.forKind(ConsensusKind.LEADER, m, "a"));
        assertInstanceOf(ByzantineOrdering.class, OrderingStrategies.forKind(ConsensusKind.BYZANTINE, m, "a"));
    }

    @Test
    void testMembership_SortedAndRotating() {
        ClusterMembership m = ClusterMembership.of("c", "a", "b", "a");

        assertEquals(List.of("a", "b", "c"), m.nodes());
        assertEquals("b", m.rotate(4));
        assertEquals("c", m.rotate(-1));
        assertThrows(IllegalArgumentException.class, () -> new ClusterMembership(List.of()));
    }

    @Nested
    @DisplayName("Majority")
    class Majority {

        @ParameterizedTest
        @CsvSource({"1, 1", "2, 2", "3, 2", "4, 3", "5, 3", "7, 4"})
        void testQuorumSize(int nodes, int quorum) {
            assertEquals(quorum, new MajorityOrdering(members(nodes)).quorumSize());
        }

        @Test
        void testAcknowledgesOnlyCanonicalOrder() {
            MajorityOrdering majority = new MajorityOrdering(members(3));
            AuditRecord a0 = TestRecords.chain("a", 1).get(0);
            AuditRecord b0 = TestRecords.chain("b", 1).get(0);
            List<AuditRecord> canonical = majority.propose(List.of(b0, a0));

            assertEquals(List.of(a0, b0), canonical);
            assertTrue(majority.acknowledges(proposal("n0", 0, canonical), slots(canonical)));
            assertFalse(majority.acknowledges(proposal("n0", 0, List.of(b0, a0)), slots(canonical)));
            assertEquals(1, majority.phases());
            assertTrue(majority.mayPropose("anyone"));
        }
    }

    @Nested
    @DisplayName("Leader")
    class Leader {

        @Test
        void testLeaderRotatesOnTimeout() {
            ClusterMembership m = ClusterMembership.of("a", "b", "c");
            LeaderReplicatedOrdering leader = new LeaderReplicatedOrdering(m, "a");
            List<AuditRecord> records = TestRecords.chain("a", 1);

            assertEquals("a", leader.leader());
            assertTrue(leader.mayPropose("a"));
            assertFalse(leader.mayPropose("b"));

            leader.onTimeout(new SegmentRound(proposal("a", 0, records), records));

            assertEquals(1, leader.epoch());
            assertEquals("b", leader.leader());
            assertTrue(leader.mayPropose("b"));
        }

        @Test
        void testFollowerAdoptsNewerEpochAndRefusesStale() {
            ClusterMembership m = ClusterMembership.of("a", "b", "c");
            LeaderReplicatedOrdering follower = new LeaderReplicatedOrdering(m, "c");
            List<AuditRecord> records = TestRecords.chain("a", 1);
            List<RecordSlot> order = slots(records);

            assertFalse(follower.acknowledges(proposal("b", 0, records), order));
            assertTrue(follower.acknowledges(proposal("b", 1, records), order));
            assertEquals(1, follower.epoch());
            assertFalse(follower.acknowledges(proposal("a", 0, records), order));
        }

        @Test
        void testLeaderPutsOwnConcurrentRecordsFirst() {
            LeaderReplicatedOrdering leader = new LeaderReplicatedOrdering(ClusterMembership.of("a", "c"), "c");
            AuditRecord a0 = TestRecords.chain("a", 1).get(0);
            AuditRecord c0 = TestRecords.chain("c", 1).get(0);

            List<AuditRecord> ordered = leader.propose(List.of(a0, c0));

            assertEquals(List.of(c0, a0), ordered);
            assertTrue(leader.acknowledges(proposal("a", 0, ordered), slots(List.of(a0, c0))));
        }
    }

    @Nested
    @DisplayName("Byzantine")
    class Byzantine {

        @ParameterizedTest
        @CsvSource({"1, 0, 1", "3, 0, 1", "4, 1, 3", "6, 1, 3", "7, 2, 5", "10, 3, 7"})
        void testToleranceAndQuorum(int nodes, int f, int quorum) {
            ByzantineOrdering byzantine = new ByzantineOrdering(members(nodes));

            assertEquals(f, byzantine.faultTolerance());
            assertEquals(quorum, byzantine.quorumSize());
            assertEquals(2, byzantine.phases());
            assertTrue(byzantine.reverifiesContent());
        }

        @Test
        void testTooFewNodesForTolerance_Rejected() {
            assertThrows(IllegalArgumentException.class, () -> new ByzantineOrdering(members(3), 1));
            assertThrows(IllegalArgumentException.class, () -> new ByzantineOrdering(members(4), -1));
        }

        @Test
        void testUnknownPhase_Refused() {
            ByzantineOrdering byzantine = new ByzantineOrdering(members(4));
            List<AuditRecord> records = TestRecords.chain("a", 2);
            Proposal p = proposal("n0", 0, records);

            assertTrue(byzantine.acknowledges(p, slots(records)));
            assertTrue(byzantine.acknowledges(p.inPhase(2), slots(records)));
            assertFalse(byzantine.acknowledges(p.inPhase(3), slots(records)));
        }

        @Test
        void testViewChangeOnTimeout() {
            ByzantineOrdering byzantine = new ByzantineOrdering(members(4));
            List<AuditRecord> records = TestRecords.chain("a", 1);

            byzantine.onTimeout(new SegmentRound(proposal("n0", 0, records), records));

            assertEquals(1, byzantine.epoch());
        }
    }
}
