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

import dev.mars.decisionlog.sync.ForkEvidence;

import java.util.Objects;

/**
 * A node's answer to a {@link Proposal}.
 *
 * @param voter        answering node
 * @param kind         verdict
 * @param reason       why a proposal was refused, null on ACK
 * @param forkEvidence the divergent position, only on FORK
 */
public record Vote(String voter, Kind kind, String reason, ForkEvidence forkEvidence) {

    public enum Kind {
        ACK,
        NACK,
        FORK
    }

    public Vote {
        Objects.requireNonNull(voter, "voter");
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.FORK && forkEvidence == null) {
            throw new IllegalArgumentException("FORK vote without evidence");
        }
    }

    public static Vote ack(String voter) {
        return new Vote(voter, Kind.ACK, null, null);
    }

    public static Vote nack(String voter, String reason) {
        return new Vote(voter, Kind.NACK, reason, null);
    }

    public static Vote fork(String voter, ForkEvidence evidence) {
        return new Vote(voter, Kind.FORK, "fork at " + evidence.slot(), evidence);
    }

    public boolean isAck() {
        return kind == Kind.ACK;
    }
}
