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
package dev.mars.decisionlog.error;

import java.time.Instant;
import java.util.Objects;

/**
 * Operator-facing notification of an integrity or fork failure.
 *
 * @param kind     what broke
 * @param nodeId   node whose chain is affected
 * @param index    local sequence where the problem starts
 * @param detail   human-readable description
 * @param raisedAt when the alert was raised
 */
public record IntegrityAlert(Kind kind, String nodeId, long index, String detail, Instant raisedAt) {

    public enum Kind {
        INTEGRITY_VIOLATION,
        FORK_DETECTED
    }

    public IntegrityAlert {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(raisedAt, "raisedAt");
    }

    public static IntegrityAlert of(IntegrityViolationException e, String nodeId) {
        return new IntegrityAlert(Kind.INTEGRITY_VIOLATION, nodeId, e.atIndex(), e.getMessage(), Instant.now());
    }

    public static IntegrityAlert of(ForkDetectedException e) {
        return new IntegrityAlert(Kind.FORK_DETECTED, e.nodeId(), e.localSequence(), e.getMessage(), Instant.now());
    }
}
