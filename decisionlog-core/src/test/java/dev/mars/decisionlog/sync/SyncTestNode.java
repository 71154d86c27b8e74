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

import dev.mars.decisionlog.TestRecords;
import dev.mars.decisionlog.error.LoggingAlertSink;
import dev.mars.decisionlog.ledger.HashChainLedger;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.storage.InMemoryLedgerStorage;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory node wiring for synchronizer tests.
 */
final class SyncTestNode {

    final String id;
    final LoggingAlertSink alerts = new LoggingAlertSink();
    final ReplicaStore replicas;
    final HashChainLedger ledger;
    final LocalSyncPeer peer;
    final VectorClockSynchronizer synchronizer;

    SyncTestNode(String id, int maxBatchSize) {
        this.id = id;
        this.replicas = ReplicaStore.inMemory(id, 5_000);
        this.ledger = new HashChainLedger(id, new InMemoryLedgerStorage(id), replicas::observedClock,
                5_000, alerts).open();
        this.peer = new LocalSyncPeer(ledger, replicas, alerts);
        this.synchronizer = new VectorClockSynchronizer(peer, maxBatchSize, alerts);
    }

    SyncTestNode(String id) {
        this(id, 64);
    }

    List<AuditRecord> write(int n) {
        List<AuditRecord> out = new ArrayList<>(n);
        long start = ledger.size();
        for (int i = 0; i < n; i++) {
            out.add(ledger.append(TestRecords.draft(id + "-" + (start + i))));
        }
        return out;
    }

    SyncReport syncWith(SyncTestNode other) {
        return synchronizer.syncWith(other.peer);
    }
}
