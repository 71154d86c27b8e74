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
package dev.mars.decisionlog.sync;

import java.util.List;

/**
 * What a peer did with one inbound batch.
 *
 * @param accepted   records delivered into the receiver's replicas
 * @param duplicates records the receiver already held
 * @param rejected   tampered records and causal violations
 * @param conflicts  accepted records concurrent with the receiver's latest own record
 * @param forks      divergent chain positions; when present nothing was delivered
 */
public record ReceiveResult(int accepted, int duplicates, int rejected, int conflicts, List<ForkEvidence> forks) {

    public ReceiveResult {
        forks = List.copyOf(forks);
    }

    public static ReceiveResult empty() {
        return new ReceiveResult(0, 0, 0, 0, List.of());
    }

    public boolean hasForks() {
        return !forks.isEmpty();
    }
}
