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

import java.util.List;
import java.util.Objects;

/**
 * Inclusion proof of one leaf: the sibling hashes from leaf to root, each with
 * the side it sits on.
 *
 * @param leafIndex position of the proven leaf
 * @param leafCount number of leaves in the tree the proof was cut from
 * @param steps     siblings, leaf level first
 */
public record MerkleProof(long leafIndex, long leafCount, List<Step> steps) {

    public enum Side {
        LEFT,
        RIGHT
    }

    /**
     * @param sibling hash next to the path at this level
     * @param side    side of the sibling relative to the path
     */
    public record Step(HashValue sibling, Side side) {
        public Step {
            Objects.requireNonNull(sibling, "sibling");
            Objects.requireNonNull(side, "side");
        }
    }

    public MerkleProof {
        steps = List.copyOf(steps);
    }

    /** Number of levels a tree of {@code leafCount} leaves has above its leaves. */
    public static int height(long leafCount) {
        int height = 0;
        for (long width = leafCount; width > 1; width = (width + 1) / 2) {
            height++;
        }
        return height;
    }
}
