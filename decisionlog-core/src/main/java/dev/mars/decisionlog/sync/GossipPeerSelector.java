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

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the peers for each background sync round.
 * <p>
 * Each round takes the next {@code fanout} peers in a fixed rotation, so every
 * peer is reached within {@code ceil(peers / fanout)} rounds.
 */
public final class GossipPeerSelector {

    private final List<SyncPeer> peers;
    private final int fanout;
    private int cursor;

    public GossipPeerSelector(List<SyncPeer> peers, int fanout) {
        if (fanout <= 0) {
            throw new IllegalArgumentException("fanout must be positive: " + fanout);
        }
        this.peers = List.copyOf(peers);
        this.fanout = fanout;
    }

    /** Peers for the next round; all of them if there are no more than {@code fanout}. */
    public synchronized List<SyncPeer> nextRound() {
        if (peers.size() <= fanout) {
            return peers;
        }
        List<SyncPeer> round = new ArrayList<>(fanout);
        for (int i = 0; i < fanout; i++) {
            round.add(peers.get(cursor));
            cursor = (cursor + 1) % peers.size();
        }
        return round;
    }

    public int fanout() {
        return fanout;
    }

    public List<SyncPeer> peers() {
        return peers;
    }
}
