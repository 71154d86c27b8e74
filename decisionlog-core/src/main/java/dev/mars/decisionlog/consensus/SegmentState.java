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

/**
 * Lifecycle of a segment on one node.
 * <pre>
 * OPEN -> PENDING_QUORUM -> SEALED          (terminal)
 *                        -> FORK_DETECTED   (terminal, operator resolution)
 * </pre>
 */
public enum SegmentState {
    OPEN,
    PENDING_QUORUM,
    SEALED,
    FORK_DETECTED;

    public boolean isTerminal() {
        return this == SEALED || this == FORK_DETECTED;
    }

    public boolean canTransitionTo(SegmentState next) {
        switch (this) {
            case OPEN:
                return next == PENDING_QUORUM;
            case PENDING_QUORUM:
                return next == SEALED || next == FORK_DETECTED;
            default:
                return false;
        }
    }
}
