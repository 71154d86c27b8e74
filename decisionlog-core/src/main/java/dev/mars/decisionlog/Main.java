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
package dev.mars.decisionlog;

import dev.mars.decisionlog.ledger.HashChainLedger;
import dev.mars.decisionlog.ledger.VerificationResult;
import dev.mars.decisionlog.merkle.MerkleVerifier;
import dev.mars.decisionlog.merkle.Segment;
import dev.mars.decisionlog.record.Actor;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.DecisionRecords;
import dev.mars.decisionlog.record.EventType;
import dev.mars.decisionlog.storage.FileLedgerStorage;
import dev.mars.decisionlog.storage.LedgerStorage;

/**
 * Demo entry point for a single-node decision ledger.
 * <p>
 * This demonstrates basic ledger operations:
 * <ul>
 *   <li>Opening file storage and restoring the chain head</li>
 *   <li>Appending decisions</li>
 *   <li>Verifying the chain on restart</li>
 *   <li>Building a Merkle root over the chain</li>
 * </ul>
 */
public class Main {

    public static void main(String[] args) {
        System.out.println("Decision Ledger Demo");
        System.out.println("====================\n");

        DecisionLogConfig config = DecisionLogConfig.load();

        try (LedgerStorage storage = new FileLedgerStorage(config)) {
            HashChainLedger ledger = new HashChainLedger(config, storage).open();
            System.out.println("✓ Ledger opened at: " + config.dataDir().toAbsolutePath());
            System.out.println("✓ Restored " + ledger.size() + " existing records, head=" +
                    ledger.head().map(h -> h.recordHash().shortHex()).orElse("(empty)"));

            // Existing chain must still verify
            VerificationResult existing = ledger.verifyAll();
            System.out.println("✓ Verified existing chain: " + existing);

            long next = ledger.size();
            AuditRecord first = ledger.append(DecisionRecords.draft(EventType.AUTOMATIC_DECISION,
                    new Actor.System("rules-engine"), "statute-42", "subject-" + next,
                    "{\"income\":31000}", "{\"eligible\":true}"));
            AuditRecord second = ledger.append(DecisionRecords.draft(EventType.HUMAN_OVERRIDE,
                    new Actor.User("caseworker-7", "SUPERVISOR"), "statute-42", "subject-" + next,
                    "{\"reason\":\"documentation received\"}", "{\"eligible\":false}"));
            System.out.println("✓ Appended " + first.slot() + " and " + second.slot());

            MerkleVerifier verifier = new MerkleVerifier(config);
            Segment segment = verifier.buildSegment(0, ledger.readRange(0, ledger.size()));
            System.out.println("✓ Merkle root over " + segment.size() + " records: " + segment.root().toHex());

            System.out.println("\n✓ Ledger demo complete!");
        }
    }
}
