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
package dev.mars.decisionlog.storage;

import dev.mars.decisionlog.DecisionLogConfig;
import dev.mars.decisionlog.TestRecords;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordDraft;
import dev.mars.decisionlog.record.VectorClock;
import dev.mars.decisionlog.storage.LedgerStorage.ChainHead;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileLedgerStorage}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Append and read back across restarts</li>
 *   <li>Torn-tail recovery</li>
 *   <li>Tampered frames kept and read as stored</li>
 *   <li>Damaged length and checksum fields kept and reported, never truncated</li>
 *   <li>Lost frame boundaries marking the store corrupt</li>
 *   <li>Locking and size limits</li>
 * </ul>
 */
class FileLedgerStorageTest {

    @TempDir
    Path tempDir;

    private FileLedgerStorage storage;

    @BeforeEach
    void setUp() throws Exception {
        storage = open();
    }

    @AfterEach
    void tearDown() {
        if (storage != null) {
            storage.close();
        }
    }

    private FileLedgerStorage open() throws Exception {
        FileLedgerStorage s = new FileLedgerStorage(TestRecords.config("node-a", tempDir));
        s.open().get(5, TimeUnit.SECONDS);
        return s;
    }

    private FileLedgerStorage reopen() throws Exception {
        storage.close();
        storage = open();
        return storage;
    }

    private List<AuditRecord> appendChain(int n) throws Exception {
        List<AuditRecord> chain = TestRecords.chain("node-a", n);
        for (AuditRecord r : chain) {
            storage.append(r).get(5, TimeUnit.SECONDS);
        }
        return chain;
    }

    private Path logFile() {
        return tempDir.resolve(FileLedgerStorage.LOG_FILE);
    }

    /** Byte offset of frame {@code seq}, walking the length fields. */
    private long frameOffset(int seq) throws Exception {
        try (FileChannel ch = FileChannel.open(logFile(), StandardOpenOption.READ)) {
            long pos = 0;
            for (int i = 0; i < seq; i++) {
                ByteBuffer len = ByteBuffer.allocate(4);
                ch.read(len, pos + 15);
                len.flip();
                pos += FileLedgerStorage.HEADER_SIZE + len.getInt() + FileLedgerStorage.CRC_SIZE;
            }
            return pos;
        }
    }

    // ========================================================================
    // Append / Read
    // ========================================================================

    @Test
    void testEmptyStorage() throws Exception {
        assertEquals(0, storage.size());
        assertEquals(Optional.empty(), storage.readHead().get(5, TimeUnit.SECONDS));
        assertTrue(storage.readRange(0, 10).get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void testAppendAndReadBack() throws Exception {
        List<AuditRecord> chain = appendChain(5);

        assertEquals(5, storage.size());
        List<AuditRecord> read = storage.readRange(0, 5).get(5, TimeUnit.SECONDS);
        assertEquals(chain, read);
        assertEquals(Optional.of(new ChainHead(chain.get(4).recordHash(), 4)),
                storage.readHead().get(5, TimeUnit.SECONDS));
    }

    @Test
    void testReadRangeIsClampedToSize() throws Exception {
        appendChain(3);
        assertEquals(2, storage.readRange(1, 100).get(5, TimeUnit.SECONDS).size());
    }

    @Test
    void testRecordsSurviveRestart() throws Exception {
        List<AuditRecord> chain = appendChain(4);

        reopen();

        assertEquals(4, storage.size());
        List<AuditRecord> read = storage.readRange(0, 4).get(5, TimeUnit.SECONDS);
        assertEquals(chain, read);
        read.forEach(r -> assertTrue(r.hashMatchesContent()));
    }

    @Test
    void testOutOfOrderAppendRejected() throws Exception {
        List<AuditRecord> chain = TestRecords.chain("node-a", 3);
        storage.append(chain.get(0)).get(5, TimeUnit.SECONDS);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> storage.append(chain.get(2)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(StorageException.class, e.getCause());
        assertEquals(1, storage.size());
    }

    @Test
    void testRecordTooLargeRejected() throws Exception {
        storage.close();
        DecisionLogConfig small = TestRecords.config("node-a", tempDir).toBuilder().maxPayloadSizeMb(1).build();
        storage = new FileLedgerStorage(small);
        storage.open().get(5, TimeUnit.SECONDS);

        RecordDraft d = TestRecords.draft("big");
        RecordDraft big = new RecordDraft(d.id(), d.timestamp(), d.eventType(), d.actor(), d.statuteId(),
                d.subjectId(), d.decisionContext(), new byte[2 * 1024 * 1024]);
        AuditRecord r = AuditRecord.seal(big, "node-a", 0, VectorClock.of(Map.of("node-a", 1L)), HashValue.ZERO);

        ExecutionException e = assertThrows(ExecutionException.class, () -> storage.append(r).get(5, TimeUnit.SECONDS));
        assertInstanceOf(StorageException.class, e.getCause());
        assertEquals(0, storage.size());
    }

    @Test
    void testVerifyWritesEnabled() throws Exception {
        storage.close();
        storage = new FileLedgerStorage(tempDir,
                TestRecords.config("node-a", tempDir).toBuilder().verifyWrites(true).build());
        storage.open().get(5, TimeUnit.SECONDS);

        appendChain(3);
        assertEquals(3, storage.size());
    }

    // ========================================================================
    // Crash Recovery
    // ========================================================================

    @Test
    void testTornTailIsTruncated() throws Exception {
        appendChain(3);
        long validSize = Files.size(logFile());
        storage.close();
        storage = null;

        // Header promising 100 bytes, followed by only 10
        ByteBuffer torn = ByteBuffer.allocate(FileLedgerStorage.HEADER_SIZE + 10);
        torn.putInt(FileLedgerStorage.MAGIC);
        torn.putShort(FileLedgerStorage.VERSION);
        torn.put(FileLedgerStorage.TYPE_RECORD);
        torn.putLong(3);
        torn.putInt(100);
        torn.flip();
        try (FileChannel ch = FileChannel.open(logFile(), StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ch.write(torn);
        }

        storage = open();

        assertEquals(3, storage.size());
        assertEquals(validSize, Files.size(logFile()));
        assertEquals(-1, storage.corruptFrom());

        // Chain continues after recovery
        AuditRecord last = storage.readRange(2, 3).get(5, TimeUnit.SECONDS).get(0);
        AuditRecord next = TestRecords.next(last, VectorClock.empty(), "after-crash");
        storage.append(next).get(5, TimeUnit.SECONDS);
        assertEquals(4, storage.size());
    }

    @Test
    void testZeroFilledTailIsTruncated() throws Exception {
        appendChain(2);
        long validSize = Files.size(logFile());
        storage.close();
        storage = null;

        try (FileChannel ch = FileChannel.open(logFile(), StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ch.write(ByteBuffer.allocate(4096));
        }

        storage = open();
        assertEquals(2, storage.size());
        assertEquals(validSize, Files.size(logFile()));
    }

    @Test
    void testIncompleteHeaderIsTruncated() throws Exception {
        appendChain(2);
        storage.close();
        storage = null;

        try (FileChannel ch = FileChannel.open(logFile(), StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ch.write(ByteBuffer.wrap(new byte[]{0x44, 0x4C, 0x4F}));
        }

        storage = open();
        assertEquals(2, storage.size());
    }

    // ========================================================================
    // Tampering
    // ========================================================================

    @Test
    void testTamperedPayloadIsReadAsStored() throws Exception {
        List<AuditRecord> chain = appendChain(3);
        storage.close();
        storage = null;

        byte[] data = Files.readAllBytes(logFile());
        int at = TestRecords.indexOf(data, TestRecords.utf8("result-node-a-1;"));
        assertTrue(at > 0);
        data[at + 7] ^= 0x01;
        Files.write(logFile(), data);

        storage = open();

        assertEquals(3, storage.size());
        List<AuditRecord> read = storage.readRange(0, 3).get(5, TimeUnit.SECONDS);
        assertTrue(read.get(0).hashMatchesContent());
        assertFalse(read.get(1).hashMatchesContent());
        assertEquals(chain.get(1).recordHash(), read.get(1).recordHash());
        assertTrue(read.get(2).hashMatchesContent());
    }

    @Test
    void testUndecodablePayloadFailsWithSequence() throws Exception {
        appendChain(3);
        long offset = frameOffset(1);
        storage.close();
        storage = null;

        // Format version byte of the record payload
        try (FileChannel ch = FileChannel.open(logFile(), StandardOpenOption.WRITE)) {
            ch.write(ByteBuffer.wrap(new byte[]{99}), offset + FileLedgerStorage.HEADER_SIZE);
        }

        storage = open();
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> storage.readRange(0, 3).get(5, TimeUnit.SECONDS));
        CorruptRecordException cause = assertInstanceOf(CorruptRecordException.class, e.getCause());
        assertEquals(1, cause.sequence());
    }

    @Test
    void testLostFrameBoundaryMarksStoreCorrupt() throws Exception {
        appendChain(3);
        long offset = frameOffset(1);
        storage.close();
        storage = null;

        // Length field of frame 1 beyond any valid payload
        try (FileChannel ch = FileChannel.open(logFile(), StandardOpenOption.WRITE)) {
            ch.write(ByteBuffer.allocate(4).putInt(0, Integer.MAX_VALUE), offset + 15);
        }
        long fileSize = Files.size(logFile());

        storage = open();

        assertEquals(1, storage.corruptFrom());
        assertEquals(fileSize, Files.size(logFile()), "corrupt bytes must be kept");
        assertEquals(1, storage.readRange(0, 1).get(5, TimeUnit.SECONDS).size());

        ExecutionException read = assertThrows(ExecutionException.class,
                () -> storage.readRange(0, storage.size()).get(5, TimeUnit.SECONDS));
        assertInstanceOf(CorruptRecordException.class, read.getCause());

        AuditRecord any = TestRecords.chain("node-a", 1).get(0);
        ExecutionException append = assertThrows(ExecutionException.class,
                () -> storage.append(any).get(5, TimeUnit.SECONDS));
        assertInstanceOf(StorageException.class, append.getCause());
    }

    @Test
    void testDamagedLengthMidFileKeepsLaterRecords() throws Exception {
        appendChain(4);
        long offset = frameOffset(1);
        storage.close();
        storage = null;

        // One bit of the length field: the frame now claims to run past the end of the file
        byte[] data = Files.readAllBytes(logFile());
        data[(int) offset + 16] ^= 0x01;
        Files.write(logFile(), data);

        storage = open();

        assertEquals(data.length, Files.size(logFile()), "acknowledged frames must not be truncated");
        assertEquals(1, storage.corruptFrom());
        assertEquals(1, storage.readRange(0, 1).get(5, TimeUnit.SECONDS).size());
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> storage.readRange(0, storage.size()).get(5, TimeUnit.SECONDS));
        assertEquals(1, assertInstanceOf(CorruptRecordException.class, e.getCause()).sequence());
    }

    @Test
    void testDamagedLengthOfLastFrameIsNotTornTail() throws Exception {
        appendChain(3);
        long offset = frameOffset(2);
        storage.close();
        storage = null;

        byte[] data = Files.readAllBytes(logFile());
        data[(int) offset + 18] ^= 0x01;
        Files.write(logFile(), data);

        storage = open();

        assertEquals(data.length, Files.size(logFile()));
        assertEquals(2, storage.corruptFrom());
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> storage.readHead().get(5, TimeUnit.SECONDS));
        assertEquals(2, assertInstanceOf(CorruptRecordException.class, e.getCause()).sequence());
    }

    @Test
    void testChecksumDamageWithIntactRecordFailsRead() throws Exception {
        appendChain(3);
        long crcAt = frameOffset(2) - 1;
        storage.close();
        storage = null;

        byte[] data = Files.readAllBytes(logFile());
        data[(int) crcAt] ^= 0x01;
        Files.write(logFile(), data);

        storage = open();

        assertEquals(3, storage.size());
        assertEquals(-1, storage.corruptFrom());
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> storage.readRange(0, 3).get(5, TimeUnit.SECONDS));
        assertEquals(1, assertInstanceOf(CorruptRecordException.class, e.getCause()).sequence());
    }

    // ========================================================================
    // Protection
    // ========================================================================

    @Test
    void testSecondInstanceCannotOpenSameDirectory() {
        FileLedgerStorage second = new FileLedgerStorage(TestRecords.config("node-a", tempDir));
        try {
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> second.open().get(5, TimeUnit.SECONDS));
            assertInstanceOf(StorageException.class, e.getCause());
        } finally {
            second.close();
        }
    }

    @Test
    void testOperationsAfterCloseFail() {
        storage.close();
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> storage.readRange(0, 1).get(5, TimeUnit.SECONDS));
        assertInstanceOf(StorageException.class, e.getCause());
        storage = null;
    }

    @Test
    void testDuplicateCloseIsHarmless() {
        storage.close();
        assertDoesNotThrow(() -> storage.close());
        storage = null;
    }
}
