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

/**
 * Outcome of one {@code syncWith} round.
 *
 * @param peer      the other node
 * @param received  records pulled and delivered locally
 * @param sent      records pushed and delivered at the peer
 * @param conflicts received records concurrent with this node's latest own record
 * @param rejected  records refused on either side (tampered or causally out of order)
 */
public record SyncReport(String peer, int received, int sent, int conflicts, int rejected) {

    public boolean isEmpty() {
        return received == 0 && sent == 0 && conflicts == 0 && rejected == 0;
    }
}
