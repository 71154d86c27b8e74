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

import dev.mars.decisionlog.record.HashValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Binary SHA-256 hash tree over an ordered list of leaves.
 * <p>
 * Every level is stored, leaves at level 0. A parent is
 * {@code H(left || right)}; when a level has an odd number of nodes its last node
 * is paired with itself. A one-leaf tree's root is the leaf; an empty tree has no root.
 * <p>
 * {@link #append} touches only the last node of each level, which is exactly the
 * ancestor path of the new leaf, so streaming a segment costs O(log n) per leaf and
 * ends with the same root as {@link #build}.
 * <p>
 * Not thread-safe.
 */
public final class MerkleTree {

    private final List<List<HashValue>> levels = new ArrayList<>();

    public MerkleTree() {
        levels.add(new ArrayList<>());
    }

    /** Builds a tree bottom-up over {@code leaves}. */
    public static MerkleTree build(List<HashValue> leaves) {
        MerkleTree tree = new MerkleTree();
        List<HashValue> level = new ArrayList<>(leaves);
        level.forEach(leaf -> Objects.requireNonNull(leaf, "leaf"));
        tree.levels.set(0, level);
        while (level.size() > 1) {
            List<HashValue> parents = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                parents.add(parent(level, i));
            }
            tree.levels.add(parents);
            level = parents;
        }
        return tree;
    }

    /**
     * Adds a leaf and recomputes its ancestors.
     *
     * @return the new leaf's index
     */
    public int append(HashValue leaf) {
        Objects.requireNonNull(leaf, "leaf");
        List<HashValue> leaves = levels.get(0);
        leaves.add(leaf);
        int depth = 0;
        while (levels.get(depth).size() > 1) {
            List<HashValue> level = levels.get(depth);
            int last = level.size() - 1;
            int parentIndex = last / 2;
            if (levels.size() == depth + 1) {
                levels.add(new ArrayList<>());
            }
            List<HashValue> parents = levels.get(depth + 1);
            HashValue parent = parent(level, parentIndex * 2);
            if (parentIndex == parents.size()) {
                parents.add(parent);
            } else {
                parents.set(parentIndex, parent);
            }
            depth++;
        }
        return leaves.size() - 1;
    }

    /** Root hash, empty if the tree has no leaves. */
    public Optional<HashValue> root() {
        if (levels.get(0).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(levels.get(levels.size() - 1).get(0));
    }

    public int size() {
        return levels.get(0).size();
    }

    public HashValue leaf(int index) {
        return levels.get(0).get(index);
    }

    /** Read-only view of the leaves. */
    public List<HashValue> leaves() {
        return List.copyOf(levels.get(0));
    }

    /**
     * Sibling path from leaf {@code index} to the root.
     */
    public MerkleProof prove(int index) {
        int count = size();
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("Leaf " + index + " not in tree of " + count);
        }
        List<MerkleProof.Step> steps = new ArrayList<>();
        int i = index;
        for (int depth = 0; levels.get(depth).size() > 1; depth++) {
            List<HashValue> level = levels.get(depth);
            if ((i & 1) == 0) {
                HashValue sibling = i + 1 < level.size() ? level.get(i + 1) : level.get(i);
                steps.add(new MerkleProof.Step(sibling, MerkleProof.Side.RIGHT));
            } else {
                steps.add(new MerkleProof.Step(level.get(i - 1), MerkleProof.Side.LEFT));
            }
            i >>= 1;
        }
        return new MerkleProof(index, count, steps);
    }

    private static HashValue parent(List<HashValue> level, int leftIndex) {
        HashValue left = level.get(leftIndex);
        HashValue right = leftIndex + 1 < level.size() ? level.get(leftIndex + 1) : left;
        return HashValue.combine(left, right);
    }
}
