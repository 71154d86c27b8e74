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

import dev.mars.decisionlog.merkle.Segment;

import java.util.concurrent.CompletableFuture;

/**
 * A node as seen by the consensus coordinator; the transport seam for votes and commits.
 */
public interface ConsensusPeer {

    String nodeId();

    /** Validates a proposal and answers ACK, NACK or FORK. */
    CompletableFuture<Vote> vote(Proposal proposal);

    /**
     * Installs a segment sealed by another node.
     *
     * @return a Future of true if installed (or already held), false if refused
     */
    CompletableFuture<Boolean> commit(Segment segment);
}
