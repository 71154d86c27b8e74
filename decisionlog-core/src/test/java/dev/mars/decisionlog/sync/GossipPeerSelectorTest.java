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

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GossipPeerSelectorTest {

    private static List<SyncPeer> peers(int n) {
        SyncPeer[] out = new SyncPeer[n];
        for (int i = 0; i < n; i++) {
            out[i] = new SyncTestNode("p" + i).peer;
        }
        return List.of(out);
    }

    @Test
    void testFewerPeersThanFanout_AllEveryRound() {
        List<SyncPeer> peers = peers(2);
        GossipPeerSelector selector = new GossipPeerSelector(peers, 3);

        assertEquals(peers, selector.nextRound());
        assertEquals(peers, selector.nextRound());
    }

    @Test
    void testRotation_ReachesEveryPeer() {
        List<SyncPeer> peers = peers(5);
        GossipPeerSelector selector = new GossipPeerSelector(peers, 2);

        Set<String> reached = new HashSet<>();
        for (int round = 0; round < 3; round++) {
            List<SyncPeer> picked = selector.nextRound();
            assertEquals(2, picked.size());
            picked.forEach(p -> reached.add(p.nodeId()));
        }

        assertEquals(5, reached.size());
    }

    @Test
    void testRotation_WrapsAround() {
        List<SyncPeer> peers = peers(3);
        GossipPeerSelector selector = new GossipPeerSelector(peers, 2);

        assertEquals(List.of(peers.get(0), peers.get(1)), selector.nextRound());
        assertEquals(List.of(peers.get(2), peers.get(0)), selector.nextRound());
    }

    @Test
    void testInvalidFanout() {
        assertThrows(IllegalArgumentException.class, () -> new GossipPeerSelector(List.of(), 0));
    }
}
