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

import dev.mars.decisionlog.TestRecords;
import dev.mars.decisionlog.error.ForkDetectedException;
import dev.mars.decisionlog.error.IntegrityAlert;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordSlot;
import dev.mars.decisionlog.record.VectorClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link VectorClockSynchronizer} and {@link LocalSyncPeer}.
 */
class VectorClockSynchronizerTest {

    /** Builds {@code n} records continuing {@code base}, each with a fresh id. */
    private static List<AuditRecord> extend(List<AuditRecord> base, int n, String label) {
        List<AuditRecord> out = new ArrayList<>(base);
        for (int i = 0; i < n; i++) {
            out.add(TestRecords.next(out.get(out.size() - 1), VectorClock.empty(), label + i));
        }
        return out;
    }

    @Nested
    @DisplayName("Convergence")
    class Convergence {

        @Test
        void testTwoNodes_ConvergeInOneRound() {
            SyncTestNode a = new SyncTestNode("a");
            SyncTestNode b = new SyncTestNode("b");
            a.write(20);
            b.write(15);

            SyncReport report = a.syncWith(b);

            assertEquals("b", report.peer());
            assertEquals(15, report.received());
            assertEquals(20, report.sent());
            assertEquals(0, report.rejected());
            VectorClock expected = VectorClock.of(Map.of("a", 20L, "b", 15L));
            assertEquals(expected, a.peer.frontier());
            assertEquals(expected, b.peer.frontier());
        }

        @Test
        void testSecondRound_ReportsNothing() {
            SyncTestNode a = new SyncTestNode("a");
            SyncTestNode b = new SyncTestNode("b");
            a.write(5);
            b.write(5);
            a.syncWith(b);

            SyncReport again = a.syncWith(b);
            SyncReport reverse = b.syncWith(a);

            assertTrue(again.isEmpty());
            assertTrue(reverse.isEmpty());
        }

        @Test
        void testSmallBatches_TransferEverything() {
            SyncTestNode a = new SyncTestNode("a");
            SyncTestNode b = new SyncTestNode("b", 4);
            a.write(30);

            SyncReport report = b.syncWith(a);

            assertEquals(30, report.received());
            assertEquals(30, b.replicas.size("a"));
            assertEquals(a.ledger.head().get().recordHash(), b.replicas.headHash("a").get());
        }

        @Test
        void testConcurrentRecords_CountedAsConflicts() {
            SyncTestNode a = new SyncTestNode("a");
            SyncTestNode b = new SyncTestNode("b");
            a.write(1);
            b.write(1);

            SyncReport report = a.syncWith(b);

            assertEquals(1, report.conflicts());
        }

        @Test
        void testRecordsFromThirdNode_DeliveredCausally() {
            SyncTestNode a = new SyncTestNode("a");
            SyncTestNode b = new SyncTestNode("b");
            SyncTestNode c = new SyncTestNode("c", 2);
            a.write(3);
            b.syncWith(a);
            AuditRecord b0 = b.write(1).get(0);
            assertEquals(3, b0.vectorClock().get("a"));

            SyncReport report = c.syncWith(b);

            assertEquals(4, report.received());
            assertEquals(3, c.replicas.size("a"));
            assertEquals(1, c.replicas.size("b"));
            AuditRecord c0 = c.write(1).get(0);
            assertEquals(VectorClock.of(Map.of("a", 3L, "b", 1L, "c", 1L)), c0.vectorClock());
        }

        @Test
        void testNewRecordsAfterSync_DependOnWhatWasReceived() {
            SyncTestNode a = new SyncTestNode("a");
            SyncTestNode b = new SyncTestNode("b");
            b.write(4);
            a.syncWith(b);

            AuditRecord next = a.write(1).get(0);

            assertEquals(4, next.vectorClock().get("b"));
            assertEquals(1, next.vectorClock().get("a"));
        }
    }

    @Nested
    @DisplayName("Forks")
    class Forks {

        @Test
        void testDivergentReplicas_AbortBeforeTransfer() {
            SyncTestNode a = new SyncTestNode("a");
            SyncTestNode b = new SyncTestNode("b");
            a.write(2);
            a.replicas.commit(TestRecords.chain("x", 3));
            b.replicas.commit(TestRecords.chain("x", 3));

            ForkDetectedException e = assertThrows(ForkDetectedException.class, () -> a.syncWith(b));

            assertEquals("x", e.nodeId());
            assertEquals(0, e.localSequence());
            assertEquals(0, b.replicas.size("a"));
            List<IntegrityAlert> alerts = a.alerts.raised();
            assertEquals(1, alerts.size());
            assertEquals(IntegrityAlert.Kind.FORK_DETECTED, alerts.get(0).kind());
            assertEquals("x", alerts.get(0).nodeId());
        }

        @Test
        void testProbe_FindsFirstDivergentSequence() {
            SyncTestNode a = new SyncTestNode("a");
            SyncTestNode b = new SyncTestNode("b");
            List<AuditRecord> common = TestRecords.chain("x", 5);
            a.replicas.commit(extend(common, 3, "left-"));
            b.replicas.commit(extend(common, 3, "right-"));

            Optional<ForkEvidence> fork = a.synchronizer.probeForks(b.peer);

            assertTrue(fork.isPresent());
            assertEquals(new RecordSlot("x", 5), fork.get().slot());
            assertEquals(a.replicas.hashAt("x", 5).get(), fork.get().localHash());
            assertEquals(b.replicas.hashAt("x", 5).get(), fork.get().remoteHash());
        }

        @Test
        void testProbe_LongerChainWithSamePrefix_IsNoFork() {
            SyncTestNode a = new SyncTestNode("a");
            SyncTestNode b = new SyncTestNode("b");
            List<AuditRecord> chain = TestRecords.chain("x", 6);
            a.replicas.commit(chain);
            b.replicas.commit(chain.subList(0, 4));

            assertTrue(a.synchronizer.probeForks(b.peer).isEmpty());
            SyncReport report = b.syncWith(a);
            assertEquals(2, report.received());
        }

        @Test
        void testReceive_BatchWithFork_RefusedWhole() {
            SyncTestNode a = new SyncTestNode("a");
            a.replicas.commit(TestRecords.chain("x", 2));
            List<AuditRecord> batch = new ArrayList<>(TestRecords.chain("y", 3));
            batch.addAll(TestRecords.chain("x", 2));

            ReceiveResult result = a.peer.receive(batch);

            assertTrue(result.hasForks());
            assertEquals(0, result.accepted());
            assertEquals(0, a.replicas.size("y"));
            assertFalse(a.alerts.raised().isEmpty());
        }
    }

    @Nested
    @DisplayName("Receive")
    class Receive {

        @Test
        void testReceive_IsIdempotent() {
            SyncTestNode a = new SyncTestNode("a");
            List<AuditRecord> batch = TestRecords.chain("y", 3);

            ReceiveResult first = a.peer.receive(batch);
            ReceiveResult second = a.peer.receive(batch);

            assertEquals(3, first.accepted());
            assertEquals(0, second.accepted());
            assertEquals(3, second.duplicates());
            assertEquals(3, a.replicas.size("y"));
        }

        @Test
        void testReceive_TamperedRecordRejected() {
            SyncTestNode a = new SyncTestNode("a");
            List<AuditRecord> batch = new ArrayList<>(TestRecords.chain("y", 3));
            AuditRecord r = batch.get(1);
            batch.set(1, AuditRecord.restore(r.id(), r.nodeId(), r.vectorClock(), r.localSequence(),
                    r.timestamp(), r.eventType(), r.actor(), r.statuteId(), r.subjectId(),
                    TestRecords.utf8("rewritten"), r.decisionResult(), r.prevHash(), r.recordHash()));

            ReceiveResult result = a.peer.receive(batch);

            assertEquals(1, result.accepted());
            assertEquals(2, result.rejected());
            assertEquals(1, a.replicas.size("y"));
        }

        @Test
        void testRecordsAfter_RespectsLimitAndOrder() {
            SyncTestNode a = new SyncTestNode("a");
            a.write(3);
            a.replicas.commit(TestRecords.chain("y", 3));

            List<AuditRecord> offered = a.peer.recordsAfter(VectorClock.empty(), 4);

            assertEquals(4, offered.size());
            for (int i = 1; i < offered.size(); i++) {
                assertTrue(MergePlan.DELIVERY_ORDER.compare(offered.get(i - 1), offered.get(i)) < 0);
            }
            assertTrue(a.peer.recordsAfter(VectorClock.empty(), 0).isEmpty());
        }

        @Test
        void testHashLookups_CoverOwnChainAndReplicas() {
            SyncTestNode a = new SyncTestNode("a");
            List<AuditRecord> own = a.write(2);
            List<AuditRecord> y = TestRecords.chain("y", 2);
            a.replicas.commit(y);

            assertEquals(Optional.of(own.get(1).recordHash()), a.peer.hashAt("a", 1));
            assertEquals(Optional.of(y.get(0).recordHash()), a.peer.hashAt("y", 0));
            assertEquals(Optional.empty(), a.peer.hashAt("a", 2));
            assertEquals(Optional.of(y.get(1).recordHash()), a.peer.headHash("y"));
            assertEquals(Optional.empty(), a.peer.headHash("z"));
        }
    }

    @Test
    void testUnavailablePeer_Propagates() {
        SyncTestNode a = new SyncTestNode("a");
        SyncPeer down = new UnreachablePeer("down");

        PeerUnavailableException e = assertThrows(PeerUnavailableException.class,
                () -> a.synchronizer.syncWith(down));

        assertEquals("down", e.peerId());
    }

    @Test
    void testInvalidBatchSize() {
        SyncTestNode a = new SyncTestNode("a");
        assertThrows(IllegalArgumentException.class, () -> new VectorClockSynchronizer(a.peer, 0, a.alerts));
    }

    /** Answers identity questions, fails on everything else. */
    static final class UnreachablePeer implements SyncPeer {

        private final String id;
        int calls;

        UnreachablePeer(String id) {
            this.id = id;
        }

        @Override
        public String nodeId() {
            return id;
        }

        @Override
        public VectorClock frontier() {
            calls++;
            throw new PeerUnavailableException(id, "connection refused");
        }

        @Override
        public Optional<HashValue> hashAt(String origin, long sequence) {
            throw new PeerUnavailableException(id, "connection refused");
        }

        @Override
        public Optional<HashValue> headHash(String origin) {
            throw new PeerUnavailableException(id, "connection refused");
        }

        @Override
        public List<AuditRecord> recordsAfter(VectorClock frontier, int limit) {
            throw new PeerUnavailableException(id, "connection refused");
        }

        @Override
        public ReceiveResult receive(List<AuditRecord> batch) {
            throw new PeerUnavailableException(id, "connection refused");
        }
    }
}
