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
package dev.mars.decisionlog.notary;

import dev.mars.decisionlog.DecisionLogConfig.ConsensusKind;
import dev.mars.decisionlog.TestCluster;
import dev.mars.decisionlog.TestRecords;
import dev.mars.decisionlog.merkle.MerkleProof;
import dev.mars.decisionlog.merkle.MerkleVerifier;
import dev.mars.decisionlog.merkle.Segment;
import dev.mars.decisionlog.node.LedgerNode;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordSlot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link NotaryService}.
 */
class NotaryServiceTest {

    private TestCluster cluster;
    private LedgerNode node;
    private Segment sealed;

    @BeforeEach
    void setUp() {
        cluster = TestCluster.of(ConsensusKind.MAJORITY, "a", "b");
        cluster.write(0, 6);
        cluster.write(1, 5);
        cluster.syncAll();
        sealed = cluster.node(0).closeSegment().orElseThrow();
        node = cluster.node(1);
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    @Test
    void testExportRoot_IsSealedRoot() {
        assertEquals(sealed.root(), node.notary().exportRoot(0));
    }

    @Test
    void testProveRecord_VerifiesAgainstExportedRoot() {
        HashValue root = node.notary().exportRoot(0);

        for (AuditRecord r : sealed.records()) {
            MerkleProof proof = node.notary().proveRecord(0, r.slot());
            assertTrue(MerkleVerifier.verifyProof(r.recordHash(), proof, root), r.slot().toString());
        }
    }

    @Test
    void testProof_DoesNotVerifyOtherRecord() {
        AuditRecord first = sealed.record(0);
        AuditRecord second = sealed.record(1);

        MerkleProof proof = node.notary().proveRecord(0, first.slot());

        assertFalse(MerkleVerifier.verifyProof(second.recordHash(), proof, sealed.root()));
    }

    @Test
    void testUnknownSegmentOrRecord() {
        assertThrows(NoSuchElementException.class, () -> node.notary().exportRoot(1));
        assertThrows(NoSuchElementException.class, () -> node.notary().proveRecord(0, new RecordSlot("a", 99)));
    }

    @Test
    void testAttestations_AttachedBesideSegment() {
        Attestation timestamp = new Attestation("tsa.example", Instant.parse("2026-03-01T10:00:00Z"),
                sealed.root(), TestRecords.utf8("signed-token"));
        Attestation anchor = new Attestation("anchor.example", Instant.parse("2026-03-01T10:05:00Z"),
                sealed.root(), null);

        node.notary().importAttestation(0, timestamp);
        node.notary().importAttestation(0, anchor);

        List<Attestation> held = node.notary().attestations(0);
        assertEquals(2, held.size());
        assertEquals("tsa.example", held.get(0).witness());
        assertArrayEquals(TestRecords.utf8("signed-token"), held.get(0).proof());
        assertEquals(0, held.get(1).proof().length);
        assertTrue(node.notary().attestations(1).isEmpty());
        assertEquals(sealed, node.coordinator().segment(0).orElseThrow());
    }

    @Test
    void testAttestationForOtherRoot_Rejected() {
        Attestation wrong = new Attestation("tsa.example", Instant.now(),
                HashValue.sha256(TestRecords.utf8("another segment")), new byte[0]);

        assertThrows(IllegalArgumentException.class, () -> node.notary().importAttestation(0, wrong));
        assertThrows(NoSuchElementException.class, () -> node.notary().importAttestation(3, wrong));
        assertTrue(node.notary().attestations(0).isEmpty());
    }

    @Test
    void testAttestationProof_DefensivelyCopied() {
        byte[] proof = TestRecords.utf8("token");
        Attestation attestation = new Attestation("tsa.example", Instant.now(), sealed.root(), proof);

        proof[0] = 'X';
        attestation.proof()[1] = 'X';

        assertArrayEquals(TestRecords.utf8("token"), attestation.proof());
    }
}
