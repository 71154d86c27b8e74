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

import dev.mars.decisionlog.TestRecords;
import dev.mars.decisionlog.record.HashValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MerkleTree} and {@link MerkleProof}.
 */
class MerkleTreeTest {

    private static List<HashValue> leaves(int n) {
        List<HashValue> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(HashValue.sha256(TestRecords.utf8("leaf-" + i)));
        }
        return out;
    }

    @Nested
    @DisplayName("Root")
    class Root {

        @Test
        void emptyTreeHasNoRoot() {
            assertTrue(new MerkleTree().root().isEmpty());
            assertTrue(MerkleTree.build(List.of()).root().isEmpty());
        }

        @Test
        @DisplayName("Single leaf is its own root")
        void singleLeaf() {
            HashValue leaf = leaves(1).get(0);
            assertEquals(leaf, MerkleTree.build(List.of(leaf)).root().orElseThrow());
        }

        @Test
        void twoLeaves() {
            List<HashValue> l = leaves(2);
            assertEquals(HashValue.combine(l.get(0), l.get(1)), MerkleTree.build(l).root().orElseThrow());
        }

        @Test
        @DisplayName("Odd level pairs its last node with itself")
        void oddLevelDuplicatesLast() {
            List<HashValue> l = leaves(3);
            HashValue expected = HashValue.combine(
                    HashValue.combine(l.get(0), l.get(1)),
                    HashValue.combine(l.get(2), l.get(2)));
            assertEquals(expected, MerkleTree.build(l).root().orElseThrow());
        }

        @Test
        @DisplayName("Leaf order changes the root")
        void orderMatters() {
            List<HashValue> l = leaves(4);
            List<HashValue> swapped = new ArrayList<>(l);
            swapped.set(0, l.get(1));
            swapped.set(1, l.get(0));
            assertNotEquals(MerkleTree.build(l).root(), MerkleTree.build(swapped).root());
        }

        @Test
        @DisplayName("Incremental append matches a bottom-up build at every size")
        void incrementalMatchesBuild() {
            List<HashValue> l = leaves(70);
            MerkleTree incremental = new MerkleTree();
            for (int n = 1; n <= l.size(); n++) {
                assertEquals(n - 1, incremental.append(l.get(n - 1)));
                assertEquals(MerkleTree.build(l.subList(0, n)).root(), incremental.root(), "size " + n);
            }
            assertEquals(l, incremental.leaves());
        }
    }

    @Nested
    @DisplayName("Proofs")
    class Proofs {

        @Test
        @DisplayName("Every leaf's proof verifies, for trees of 1 to 40 leaves")
        void allProofsVerify() {
            for (int n = 1; n <= 40; n++) {
                List<HashValue> l = leaves(n);
                MerkleTree tree = MerkleTree.build(l);
                HashValue root = tree.root().orElseThrow();
                for (int i = 0; i < n; i++) {
                    MerkleProof proof = tree.prove(i);
                    assertEquals(MerkleProof.height(n), proof.steps().size());
                    assertTrue(MerkleVerifier.verifyProof(l.get(i), proof, root), "leaf " + i + " of " + n);
                }
            }
        }

        @Test
        @DisplayName("Proof does not verify a different leaf")
        void wrongLeaf() {
            List<HashValue> l = leaves(9);
            MerkleTree tree = MerkleTree.build(l);
            assertFalse(MerkleVerifier.verifyProof(l.get(4), tree.prove(3), tree.root().orElseThrow()));
        }

        @Test
        @DisplayName("Corrupted sibling fails")
        void corruptedSibling() {
            List<HashValue> l = leaves(9);
            MerkleTree tree = MerkleTree.build(l);
            MerkleProof proof = tree.prove(5);
            List<MerkleProof.Step> steps = new ArrayList<>(proof.steps());
            MerkleProof.Step first = steps.get(1);
            byte[] sibling = first.sibling().toBytes();
            sibling[0] ^= 0x01;
            steps.set(1, new MerkleProof.Step(HashValue.of(sibling), first.side()));

            MerkleProof corrupted = new MerkleProof(proof.leafIndex(), proof.leafCount(), steps);
            assertFalse(MerkleVerifier.verifyProof(l.get(5), corrupted, tree.root().orElseThrow()));
        }

        @Test
        @DisplayName("Flipped side fails")
        void flippedSide() {
            List<HashValue> l = leaves(8);
            MerkleTree tree = MerkleTree.build(l);
            MerkleProof proof = tree.prove(2);
            List<MerkleProof.Step> steps = new ArrayList<>(proof.steps());
            MerkleProof.Step s = steps.get(0);
            steps.set(0, new MerkleProof.Step(s.sibling(),
                    s.side() == MerkleProof.Side.LEFT ? MerkleProof.Side.RIGHT : MerkleProof.Side.LEFT));

            assertFalse(MerkleVerifier.verifyProof(l.get(2),
                    new MerkleProof(2, 8, steps), tree.root().orElseThrow()));
        }

        @Test
        @DisplayName("Reshaped proof is rejected")
        void reshapedProof() {
            List<HashValue> l = leaves(8);
            MerkleTree tree = MerkleTree.build(l);
            MerkleProof proof = tree.prove(6);
            HashValue root = tree.root().orElseThrow();

            assertFalse(MerkleVerifier.verifyProof(l.get(6), new MerkleProof(6, 8, proof.steps().subList(0, 2)), root));
            assertFalse(MerkleVerifier.verifyProof(l.get(6), new MerkleProof(7, 8, proof.steps()), root));
            assertFalse(MerkleVerifier.verifyProof(l.get(6), new MerkleProof(6, 5, proof.steps()), root));
            assertFalse(MerkleVerifier.verifyProof(l.get(6), new MerkleProof(9, 8, proof.steps()), root));
            assertFalse(MerkleVerifier.verifyProof(null, proof, root));
        }

        @Test
        void proveOutOfRange() {
            MerkleTree tree = MerkleTree.build(leaves(3));
            assertThrows(IndexOutOfBoundsException.class, () -> tree.prove(3));
            assertThrows(IndexOutOfBoundsException.class, () -> tree.prove(-1));
        }
    }

    @Test
    void heights() {
        assertEquals(0, MerkleProof.height(1));
        assertEquals(1, MerkleProof.height(2));
        assertEquals(2, MerkleProof.height(3));
        assertEquals(2, MerkleProof.height(4));
        assertEquals(3, MerkleProof.height(5));
        assertEquals(10, MerkleProof.height(1024));
    }
}
