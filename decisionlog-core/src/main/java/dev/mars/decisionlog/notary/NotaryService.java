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

import dev.mars.decisionlog.consensus.ConsensusCoordinator;
import dev.mars.decisionlog.error.IntegrityViolationException;
import dev.mars.decisionlog.ledger.VerificationResult;
import dev.mars.decisionlog.merkle.MerkleProof;
import dev.mars.decisionlog.merkle.MerkleVerifier;
import dev.mars.decisionlog.merkle.Segment;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Exposes sealed segment roots to witnesses and keeps what they send back.
 * <p>
 * A root leaves the node only after a full verification of its segment.
 * Attestations are attached beside a segment; the segment itself never changes.
 */
public final class NotaryService {

    private static final Logger LOG = LoggerFactory.getLogger(NotaryService.class);

    private final ConsensusCoordinator coordinator;
    private final MerkleVerifier verifier;
    private final Map<Long, List<Attestation>> attestations = new ConcurrentHashMap<>();

    public NotaryService(ConsensusCoordinator coordinator, MerkleVerifier verifier) {
        this.coordinator = coordinator;
        this.verifier = verifier;
    }

    /**
     * Root of a sealed segment, for anchoring.
     *
     * @throws NoSuchElementException      if the segment is not sealed on this node
     * @throws IntegrityViolationException if the segment fails full verification
     */
    public HashValue exportRoot(long segmentNumber) {
        Segment segment = sealed(segmentNumber);
        VerificationResult check = verifier.verifyFull(segment);
        if (!check.isOk()) {
            LOG.error("Refusing to export root of segment {}: {}", segmentNumber, check.reason());
            throw check.toException();
        }
        LOG.info("Exported root of segment {}: {}", segmentNumber, segment.root().toHex());
        return segment.root();
    }

    /**
     * Inclusion proof for one record of a sealed segment, checkable with
     * {@link MerkleVerifier#verifyProof} against the exported root.
     */
    public MerkleProof proveRecord(long segmentNumber, RecordSlot slot) {
        Segment segment = sealed(segmentNumber);
        int position = segment.positionOf(slot);
        if (position < 0) {
            throw new NoSuchElementException("Record " + slot + " is not in segment " + segmentNumber);
        }
        return verifier.prove(segment, position);
    }

    /**
     * Attaches a witness statement to a sealed segment.
     *
     * @throws IllegalArgumentException if the attestation is about a different root
     */
    public void importAttestation(long segmentNumber, Attestation attestation) {
        Segment segment = sealed(segmentNumber);
        if (!segment.root().equals(attestation.attestedRoot())) {
            throw new IllegalArgumentException("Attestation from " + attestation.witness() + " is for root " +
                    attestation.attestedRoot().shortHex() + ", segment " + segmentNumber + " has " +
                    segment.root().shortHex());
        }
        attestations.computeIfAbsent(segmentNumber, n -> new CopyOnWriteArrayList<>()).add(attestation);
        LOG.info("Attestation from {} attached to segment {}", attestation.witness(), segmentNumber);
    }

    /** Attestations of a segment, in import order. */
    public List<Attestation> attestations(long segmentNumber) {
        return List.copyOf(attestations.getOrDefault(segmentNumber, List.of()));
    }

    private Segment sealed(long segmentNumber) {
        return coordinator.segment(segmentNumber)
                .orElseThrow(() -> new NoSuchElementException("Segment " + segmentNumber + " is not sealed"));
    }
}
