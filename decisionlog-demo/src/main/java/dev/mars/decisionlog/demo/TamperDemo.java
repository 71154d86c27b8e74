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
package dev.mars.decisionlog.demo;

import dev.mars.decisionlog.DecisionLogConfig;
import dev.mars.decisionlog.error.LoggingAlertSink;
import dev.mars.decisionlog.ledger.HashChainLedger;
import dev.mars.decisionlog.ledger.VerificationResult;
import dev.mars.decisionlog.record.Actor;
import dev.mars.decisionlog.record.DecisionRecords;
import dev.mars.decisionlog.record.EventType;
import dev.mars.decisionlog.record.VectorClock;
import dev.mars.decisionlog.storage.FileLedgerStorage;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Shows that editing a stored decision is detected.
 * <p>
 * Writes a chain to a file ledger, closes it, flips one byte inside the decision result of
 * one record directly in {@value FileLedgerStorage#LOG_FILE}, reopens, and verifies. The
 * verification names the tampered record's index.
 *
 * <h2>Usage</h2>
 * <pre>
 * java -cp decisionlog-demo/target/decisionlog-demo-1.0-SNAPSHOT.jar dev.mars.decisionlog.demo.TamperDemo [records] [target]
 * </pre>
 */
public class TamperDemo {

    public static void main(String[] args) throws IOException {
        System.out.println("+---------------------------------------+");
        System.out.println("|        Decision Ledger Tamper Demo    |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        int records = args.length > 0 ? Integer.parseInt(args[0].trim()) : 100;
        int target = args.length > 1 ? Integer.parseInt(args[1].trim()) : records / 2;
        if (target < 0 || target >= records) {
            throw new IllegalArgumentException("target must be in [0, " + records + ")");
        }

        Path dataDir = Files.createTempDirectory("decisionlog-tamper-");
        DecisionLogConfig config = DecisionLogConfig.builder()
                .nodeId("registry-east")
                .dataDir(dataDir)
                .build();
        try {
            try (FileLedgerStorage storage = new FileLedgerStorage(config)) {
                HashChainLedger ledger = new HashChainLedger(config, storage).open();
                for (int i = 0; i < records; i++) {
                    ledger.append(DecisionRecords.draft(EventType.AUTOMATIC_DECISION,
                            new Actor.System("rules-engine"), "statute-7", "subject-" + i,
                            "{\"case\":" + i + "}", resultOf(i)));
                }
                System.out.println("[OK] Wrote " + ledger.size() + " records to " + dataDir);
                System.out.println("[OK] Clean chain verifies: " + ledger.verifyAll());
            }

            long offset = flipByteOf(dataDir.resolve(FileLedgerStorage.LOG_FILE), resultOf(target));
            System.out.println("[OK] Flipped one byte of record " + target + "'s decision result at offset " + offset);

            LoggingAlertSink alerts = new LoggingAlertSink();
            try (FileLedgerStorage storage = new FileLedgerStorage(config)) {
                HashChainLedger ledger = new HashChainLedger(config.nodeId(), storage, VectorClock::empty,
                        config.ioTimeoutMs(), alerts).open();
                VerificationResult result = ledger.verifyAll();
                System.out.println("[OK] Reopened and verified: " + result);
                if (result.isOk() || result.firstMismatch() != target) {
                    throw new IllegalStateException("Tamper at " + target + " not reported: " + result);
                }
                System.out.println("[OK] Integrity alerts raised: " + alerts.raised().size());
            }

            System.out.println("\n[OK] Tamper demo complete!");
        } finally {
            deleteRecursively(dataDir);
        }
    }

    private static String resultOf(int i) {
        return "{\"eligible\":true,\"ref\":\"case-" + i + "-end\"}";
    }

    /** Flips the low bit of the last byte of the unique {@code marker} in the file. */
    private static long flipByteOf(Path file, String marker) throws IOException {
        byte[] data = Files.readAllBytes(file);
        byte[] needle = marker.getBytes(StandardCharsets.UTF_8);
        long at = indexOf(data, needle);
        if (at < 0) {
            throw new IllegalStateException("Marker not found in " + file);
        }
        long offset = at + needle.length - 2;
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
            raf.seek(offset);
            int b = raf.read();
            raf.seek(offset);
            raf.write(b ^ 0x01);
        }
        return offset;
    }

    private static long indexOf(byte[] data, byte[] needle) {
        outer:
        for (int i = 0; i <= data.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (data[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(p);
            }
        }
    }
}
