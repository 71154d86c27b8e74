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
package dev.mars.decisionlog.merkle;

import dev.mars.decisionlog.DecisionLogConfig;
import dev.mars.decisionlog.ledger.VerificationResult;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.TreeSet;

/**
 * Builds and checks Merkle commitments over segments.
 * <p>
 * {@link #verifyProof} is the check external auditors run: it needs only the leaf,
 * the proof and the committed root. {@link #verifyFull} re-hashes every record of a
 * segment and is required before a root is exported. {@link #verifySampled} checks a
 * seeded subset of records and states the chance that one bad record went unseen.
 * <p>
 * Stateless apart from the sample seed; safe to share.
 */
public final class MerkleVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(MerkleVerifier.class);

    private final long sampleSeed;

    /**
     * @param sampleSeed fixed seed for sampling, or 0 to derive it from each segment's root
     */
    public MerkleVerifier(long sampleSeed) {
        this.sampleSeed = sampleSeed;
    }

    public MerkleVerifier(DecisionLogConfig config) {
        this(config.sampleSeed());
    }

    public MerkleVerifier() {
        this(0);
    }

    /** Builds segment {@code number} over {@code records} in the given order. */
    public Segment buildSegment(long number, List<AuditRecord> records) {
        Segment segment = new Segment(number, records);
        LOG.debug("Built segment {} over {} records, root={}", number, segment.size(), segment.root().shortHex());
        return segment;
    }

    /** Merkle root over the record hashes, in the given order. */
    public HashValue rootOf(List<AuditRecord> records) {
        List<HashValue> leaves = new ArrayList<>(records.size());
        for (AuditRecord r : records) {
            leaves.add(r.recordHash());
        }
        return MerkleTree.build(leaves).root()
                .orElseThrow(() -> new IllegalArgumentException("No records to commit to"));
    }

    public MerkleProof prove(Segment segment, int position) {
        return segment.prove(position);
    }

    /**
     * Recomputes the path from {@code leaf} through {@code proof} and compares it to {@code root}.
     * <p>
     * The proof's shape must match its leaf index and leaf count; a reshaped proof
     * is rejected even if it happens to hash to the root.
     */
    public static boolean verifyProof(HashValue leaf, MerkleProof proof, HashValue root) {
        if (leaf == null || proof == null || root == null) {
            return false;
        }
        if (proof.leafIndex() < 0 || proof.leafIndex() >= proof.leafCount()) {
            return false;
        }
        if (proof.steps().size() != MerkleProof.height(proof.leafCount())) {
            return false;
        }
        HashValue current = leaf;
        long index = proof.leafIndex();
        for (MerkleProof.Step step : proof.steps()) {
            MerkleProof.Side expected = (index & 1) == 0 ? MerkleProof.Side.RIGHT : MerkleProof.Side.LEFT;
            if (step.side() != expected) {
                return false;
            }
            current = step.side() == MerkleProof.Side.LEFT
                    ? HashValue.combine(step.sibling(), current)
                    : HashValue.combine(current, step.sibling());
            index >>= 1;
        }
        return current.equals(root);
    }

    /**
     * Checks every record of the segment and its root.
     */
    public VerificationResult verifyFull(Segment segment) {
        return verifyFull(segment, segment.root());
    }

    /**
     * Checks every record hash, every chain link inside the segment, and that the
     * records commit to {@code committedRoot}. Mismatch indices are segment positions.
     */
    public VerificationResult verifyFull(Segment segment, HashValue committedRoot) {
        for (int i = 0; i < segment.size(); i++) {
            String failure = checkRecord(segment, i);
            if (failure != null) {
                LOG.error("Segment {} fails full verification at position {}: {}", segment.number(), i, failure);
                return VerificationResult.firstMismatchAt(i, failure, i);
            }
        }
        HashValue rebuilt = rootOf(segment.records());
        if (!rebuilt.equals(committedRoot)) {
            LOG.error("Segment {} root mismatch: committed={}, rebuilt={}", segment.number(),
                    committedRoot.shortHex(), rebuilt.shortHex());
            return VerificationResult.firstMismatchAt(0, "root mismatch: committed " + committedRoot.shortHex() +
                    ", rebuilt " + rebuilt.shortHex(), segment.size());
        }
        LOG.debug("Segment {} fully verified ({} records)", segment.number(), segment.size());
        return VerificationResult.ok(segment.size());
    }

    /**
     * Checks the hash and chain link of a seeded random subset of records.
     * <p>
     * Cost is proportional to the sample, not the segment. Never a substitute for
     * {@link #verifyFull} on a segment about to be anchored.
     *
     * @param rate fraction of records to check, in (0, 1]
     */
    public SampledVerification verifySampled(Segment segment, double rate) {
        if (!(rate > 0 && rate <= 1)) {
            throw new IllegalArgumentException("Sample rate must be in (0, 1]: " + rate);
        }
        int total = segment.size();
        int sampleSize = (int) Math.min(total, Math.max(1, Math.ceil(rate * total)));
        long seed = sampleSeed != 0 ? sampleSeed : seedFrom(segment.root());

        VerificationResult result = VerificationResult.ok(sampleSize);
        int checked = 0;
        for (int position : choose(total, sampleSize, seed)) {
            String failure = checkRecord(segment, position);
            checked++;
            if (failure != null) {
                LOG.error("Segment {} fails sampled verification at position {}: {}",
                        segment.number(), position, failure);
                result = VerificationResult.firstMismatchAt(position, failure, checked);
                break;
            }
        }
        double missProbability = 1.0 - (double) sampleSize / total;
        LOG.debug("Sampled {} of {} records in segment {} (seed={}, miss probability {})",
                checked, total, segment.number(), seed, missProbability);
        return new SampledVerification(result, checked, total, missProbability);
    }

    /**
     * Hash of the record and, where its predecessor on the same node is in the segment,
     * the link and clock step to that predecessor.
     */
    private static String checkRecord(Segment segment, int position) {
        AuditRecord r = segment.record(position);
        if (!r.hashMatchesContent()) {
            return "record hash mismatch for " + r.slot();
        }
        if (r.isGenesis()) {
            return r.prevHash().isZero() ? null : "genesis record " + r.slot() + " has non-zero prev hash";
        }
        int p = segment.positionOf(new RecordSlot(r.nodeId(), r.localSequence() - 1));
        if (p < 0) {
            return null;
        }
        AuditRecord prev = segment.record(p);
        if (p > position) {
            return r.slot() + " placed before its predecessor";
        }
        if (!r.prevHash().equals(prev.recordHash())) {
            return "broken chain link at " + r.slot();
        }
        if (r.vectorClock().get(r.nodeId()) != prev.vectorClock().get(r.nodeId()) + 1) {
            return "own clock entry of " + r.slot() + " does not follow its predecessor";
        }
        return null;
    }

    /** Floyd's sampling: {@code k} distinct positions out of {@code n}, ascending. */
    private static TreeSet<Integer> choose(int n, int k, long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        TreeSet<Integer> chosen = new TreeSet<>();
        for (int j = n - k; j < n; j++) {
            int t = random.nextInt(j + 1);
            if (!chosen.add(t)) {
                chosen.add(j);
            }
        }
        return chosen;
    }

    private static long seedFrom(HashValue root) {
        return ByteBuffer.wrap(root.toBytes()).getLong();
    }
}
