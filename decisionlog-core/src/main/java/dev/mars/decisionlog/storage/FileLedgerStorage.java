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
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.MalformedRecordException;
import dev.mars.decisionlog.record.RecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.zip.CRC32C;

/**
 * File-based implementation of {@link LedgerStorage}.
 * <p>
 * A crash-safe, append-only WAL using {@link FileChannel}. One file holds one
 * node's chain; every record is one frame:
 * <pre>
 * MAGIC(4) VERSION(2) TYPE(1) SEQUENCE(8) LEN(4) PAYLOAD(LEN) CRC32C(4)
 * </pre>
 * where PAYLOAD is {@link RecordCodec#encode} and the CRC covers header and payload.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ ledger.lock  // exclusive process lock
 *  └─ ledger.log   // append-only WAL
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * All operations are serialized through a single-threaded executor.
 * This ensures no concurrent writes can corrupt the log.
 * <p>
 * <b>Durability:</b> {@link #append} forces the channel before completing (when sync is enabled).
 * <p>
 * <b>Recovery on open:</b>
 * <ul>
 *   <li>An <i>incomplete</i> last frame, or a zero-filled tail, is a torn write of an
 *       append that was never acknowledged. It is truncated. A last frame that is complete
 *       under its own checksum, or that runs over the header of the next frame, is not
 *       torn: its length field is damaged and it is treated as below.</li>
 *   <li>A frame with a bad checksum whose end is confirmed (end of file or the next frame's
 *       header) is kept byte for byte. If its content no longer matches its record hash it
 *       is read back as stored, so the hash chain reports the tamper at its sequence;
 *       otherwise reading it fails with {@link CorruptRecordException}.</li>
 *   <li>A frame whose end cannot be confirmed ends the index: the store is corrupt from
 *       that sequence on, keeps the bytes and refuses further appends.</li>
 * </ul>
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>File Locking:</b> Exclusive lock prevents multiple processes
 *       from writing simultaneously. Lock is held for the lifetime of the storage instance.</li>
 *   <li><b>Disk Space Checking:</b> Pre-flight check before writes to detect low disk space
 *       early and fail gracefully rather than mid-write.</li>
 *   <li><b>Read-After-Write Verification:</b> Optional verification that written data
 *       can be read back correctly, detecting silent filesystem corruption.</li>
 * </ul>
 *
 * @see LedgerStorage
 */
public final class FileLedgerStorage implements LedgerStorage {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileLedgerStorage.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Magic number: 'DLOG' in ASCII */
    static final int MAGIC = 0x444C4F47;

    /** Frame format version */
    static final short VERSION = 1;

    /** Frame type: one sealed audit record */
    static final byte TYPE_RECORD = 1;

    /** Header size: MAGIC(4) + VERSION(2) + TYPE(1) + SEQUENCE(8) + PAYLOAD_LEN(4) */
    public static final int HEADER_SIZE = 4 + 2 + 1 + 8 + 4;

    /** CRC size */
    public static final int CRC_SIZE = 4;

    /** Lock file name */
    public static final String LOCK_FILE = "ledger.lock";

    /** WAL file name */
    public static final String LOG_FILE = "ledger.log";

    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    // ========================================================================
    // State
    // ========================================================================

    /**
     * Single-threaded executor for all WAL operations.
     * <p>
     * <b>INVARIANT:</b> every read and write runs here, so the offset index
     * and the channel position are only touched by one thread.
     * <b>DO NOT</b> increase the pool size or add parallel write paths.
     */
    private final ExecutorService walExecutor;
    private final Path dataDir;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int maxPayloadSize;
    private final long minFreeSpace;

    /** Start offset of every indexed frame; position n holds sequence n. */
    private final List<Long> frameOffsets = new ArrayList<>();

    private FileChannel logChannel;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private long endOffset;
    private volatile long corruptFrom = -1;
    private volatile long size;
    private volatile boolean opened = false;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a storage rooted at the configured data directory.
     */
    public FileLedgerStorage(DecisionLogConfig config) {
        this(config.dataDir(), config);
    }

    /**
     * Creates a storage rooted at {@code dataDir}, taking the remaining settings from {@code config}.
     *
     * @param dataDir directory holding {@value #LOG_FILE}
     * @param config  sync, verification and size limits
     */
    public FileLedgerStorage(Path dataDir, DecisionLogConfig config) {
        this.dataDir = dataDir;
        this.syncEnabled = config.syncEnabled();
        this.verifyWrites = config.verifyWrites();
        this.maxPayloadSize = config.maxPayloadSizeBytes();
        this.minFreeSpace = config.minFreeSpaceBytes();

        // Single-threaded executor ensures write serialization
        this.walExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ledger-wal-" + dataDir.getFileName());
            t.setDaemon(true);
            return t;
        });

        LOG.info("FileLedgerStorage initialized: dir={}, syncEnabled={}, verifyWrites={}, maxPayloadSize={} MB, minFreeSpace={} MB",
                dataDir, syncEnabled, verifyWrites, maxPayloadSize / 1024 / 1024, minFreeSpace / 1024 / 1024);

        if (!syncEnabled) {
            LOG.warn("FileLedgerStorage created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /**
     * Creates a storage with default limits and the given sync setting.
     *
     * @param dataDir     directory holding {@value #LOG_FILE}
     * @param syncEnabled if false, fsync is skipped (ONLY for testing!)
     */
    public FileLedgerStorage(Path dataDir, boolean syncEnabled) {
        this(dataDir, DecisionLogConfig.builder().dataDir(dataDir).syncEnabled(syncEnabled).build());
    }

    public Path dataDir() {
        return dataDir;
    }

    /** Sequence from which stored frames cannot be indexed, or -1. */
    public long corruptFrom() {
        return corruptFrom;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    @Override
    public CompletableFuture<Void> open() {
        if (closed) {
            return closedFailure();
        }
        return CompletableFuture.runAsync(() -> {
            if (opened) {
                LOG.debug("Storage already open at {}", dataDir);
                return;
            }
            try {
                LOG.info("Opening ledger WAL at: {}", dataDir);
                Files.createDirectories(dataDir);

                // Acquire exclusive lock to prevent multiple processes
                acquireExclusiveLock();

                // Check available disk space
                checkDiskSpace();

                Path logPath = dataDir.resolve(LOG_FILE);
                this.logChannel = FileChannel.open(logPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.READ,
                        StandardOpenOption.WRITE);

                recoverIndex();
                logChannel.position(endOffset);
                opened = true;
                LOG.info("Ledger WAL opened: path={}, records={}, size={} bytes{}", logPath, size, endOffset,
                        corruptFrom >= 0 ? ", CORRUPT from sequence " + corruptFrom : "");

            } catch (IOException e) {
                LOG.error("Failed to open ledger WAL at {}: {}", dataDir, e.getMessage(), e);
                closeQuietly();
                throw new StorageException("Failed to open ledger WAL at " + dataDir, e);
            } catch (RuntimeException e) {
                closeQuietly();
                throw e;
            }
        }, walExecutor);
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Storage already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing ledger WAL at: {}", dataDir);
        walExecutor.execute(this::closeQuietly);
        walExecutor.shutdown();
        // Lock must be released before a reopen in the same JVM
        try {
            if (!walExecutor.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Ledger WAL at {} did not close within {} s", dataDir, CLOSE_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while closing ledger WAL at {}", dataDir);
        }
    }

    private void closeQuietly() {
        try {
            if (logChannel != null && logChannel.isOpen()) {
                logChannel.close();
                LOG.debug("Log channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Error closing log channel: {}", e.getMessage());
        }
        releaseExclusiveLock();
    }

    // ========================================================================
    // Log Operations
    // ========================================================================

    @Override
    public CompletableFuture<Void> append(AuditRecord record) {
        byte[] payload = RecordCodec.encode(record);
        if (payload.length > maxPayloadSize) {
            LOG.error("Record too large: {} bytes (max: {})", payload.length, maxPayloadSize);
            return CompletableFuture.failedFuture(
                    new StorageException("Record too large: " + payload.length +
                            " bytes (max: " + maxPayloadSize + ")"));
        }

        if (closed) {
            return closedFailure();
        }
        return CompletableFuture.runAsync(() -> {
            requireOpen();
            if (corruptFrom >= 0) {
                throw new StorageException("Ledger WAL is corrupt from sequence " + corruptFrom +
                        "; appends refused until the chain is re-anchored");
            }
            if (record.localSequence() != size) {
                throw new StorageException("Out-of-order append: expected sequence " + size +
                        ", got " + record.localSequence());
            }
            long writePosition = endOffset;
            try {
                writeFrame(record.localSequence(), payload);
                if (syncEnabled) {
                    logChannel.force(true);
                }
            } catch (IOException | RuntimeException e) {
                LOG.error("Failed to append sequence {}: {}", record.localSequence(), e.getMessage(), e);
                rollbackTo(writePosition);
                if (e instanceof StorageException se) {
                    throw se;
                }
                throw new StorageException("Failed to append record " + record.id(), e);
            }
            frameOffsets.add(writePosition);
            endOffset = writePosition + HEADER_SIZE + payload.length + CRC_SIZE;
            size = frameOffsets.size();
            LOG.trace("Appended sequence {} ({} bytes) at position {}", record.localSequence(), payload.length, writePosition);
        }, walExecutor);
    }

    @Override
    public CompletableFuture<List<AuditRecord>> readRange(long from, long to) {
        if (closed) {
            return closedFailure();
        }
        return CompletableFuture.supplyAsync(() -> {
            requireOpen();
            if (from < 0 || to < from) {
                throw new IllegalArgumentException("Invalid range [" + from + ", " + to + ")");
            }
            long end = Math.min(to, size);
            List<AuditRecord> out = new ArrayList<>((int) Math.max(0, end - from));
            for (long seq = from; seq < end; seq++) {
                out.add(readFrame(seq));
            }
            LOG.trace("Read {} records [{}, {})", out.size(), from, end);
            return out;
        }, walExecutor);
    }

    @Override
    public CompletableFuture<Optional<ChainHead>> readHead() {
        if (closed) {
            return closedFailure();
        }
        return CompletableFuture.supplyAsync(() -> {
            requireOpen();
            if (size == 0) {
                return Optional.empty();
            }
            AuditRecord last = readFrame(size - 1);
            return Optional.of(new ChainHead(last.recordHash(), last.localSequence()));
        }, walExecutor);
    }

    @Override
    public long size() {
        return size;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private <T> CompletableFuture<T> closedFailure() {
        return CompletableFuture.failedFuture(new StorageException("Storage at " + dataDir + " is closed"));
    }

    private void requireOpen() {
        if (!opened || closed) {
            throw new StorageException("Storage at " + dataDir + " is not open");
        }
    }

    /**
     * Scans the WAL, building the offset index and trimming a torn tail.
     * <p>
     * Every frame's checksum is checked during the scan. Only an incomplete last frame,
     * one that neither checks out at its actual length nor is followed by the next
     * frame, is a torn write and truncated. Any other damage keeps the bytes on disk:
     * a damaged frame whose end is confirmed by the next frame stays indexed and fails
     * on read; a damaged frame whose end cannot be confirmed marks the store corrupt
     * from that sequence.
     * Must be called from the walExecutor thread.
     */
    private void recoverIndex() throws IOException {
        long startTime = System.currentTimeMillis();
        long fileSize = logChannel.size();
        long pos = 0;
        frameOffsets.clear();
        corruptFrom = -1;
        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);

        while (pos < fileSize) {
            long index = frameOffsets.size();
            long remaining = fileSize - pos;
            if (remaining < HEADER_SIZE) {
                truncateTornTail(pos, fileSize, "incomplete header");
                break;
            }
            header.clear();
            readFully(header, pos);
            header.flip();
            int magic = header.getInt();
            short version = header.getShort();
            byte type = header.get();
            long sequence = header.getLong();
            int payloadLen = header.getInt();

            boolean headerValid = magic == MAGIC && version == VERSION && type == TYPE_RECORD;
            if (!headerValid && isZeroFilled(pos, fileSize)) {
                truncateTornTail(pos, fileSize, "zero-filled tail");
                break;
            }
            long frameEnd = pos + HEADER_SIZE + (long) payloadLen + CRC_SIZE;
            boolean lengthValid = payloadLen >= 0 && payloadLen <= maxPayloadSize;
            if (!lengthValid || frameEnd > fileSize) {
                if (headerValid && lengthValid && sequence == index && isTornTail(pos, fileSize, index)) {
                    truncateTornTail(pos, fileSize, "incomplete frame");
                } else {
                    markCorrupt(pos, index, "length " + payloadLen + " does not fit the file (" + remaining +
                            " bytes left)");
                }
                break;
            }
            if (!checksumMatches(header, pos, payloadLen)) {
                if (frameEnd != fileSize && !startsFrame(frameEnd, index + 1)) {
                    markCorrupt(pos, index, "checksum mismatch and no frame " + (index + 1) +
                            " at the claimed end " + frameEnd);
                    break;
                }
                LOG.warn("Damaged frame at offset {} (sequence {}): checksum mismatch; kept for verification",
                        pos, index);
            } else if (!headerValid || sequence != index) {
                LOG.warn("Frame at offset {} claims sequence {} at position {}; kept for verification",
                        pos, sequence, index);
            }
            frameOffsets.add(pos);
            pos = frameEnd;
        }

        endOffset = corruptFrom >= 0 ? fileSize : pos;
        size = frameOffsets.size() + (corruptFrom >= 0 ? 1 : 0);
        LOG.info("WAL index recovered: {} frames, {} ms", frameOffsets.size(), System.currentTimeMillis() - startTime);
    }

    private void markCorrupt(long pos, long index, String reason) {
        corruptFrom = index;
        LOG.error("Unreadable frame at offset {} (sequence {}): {}. Records from this sequence on cannot be trusted.",
                pos, index, reason);
    }

    /** CRC of the frame at {@code pos} over its header and declared payload. */
    private boolean checksumMatches(ByteBuffer header, long pos, int payloadLen) throws IOException {
        ByteBuffer payload = ByteBuffer.allocate(payloadLen + CRC_SIZE);
        readFully(payload, pos + HEADER_SIZE);
        payload.flip();
        CRC32C crc = new CRC32C();
        header.rewind();
        crc.update(header);
        crc.update(payload.array(), 0, payloadLen);
        return (int) crc.getValue() == payload.getInt(payloadLen);
    }

    /**
     * True if {@code [pos, fileSize)} is the unfinished prefix of a single frame.
     * <p>
     * False when the bytes form a complete frame under its own checksum with only the
     * length field damaged, or when the header of the next frame appears among them.
     */
    private boolean isTornTail(long pos, long fileSize, long index) throws IOException {
        byte[] tail = new byte[(int) (fileSize - pos)];
        readFully(ByteBuffer.wrap(tail), pos);
        ByteBuffer buf = ByteBuffer.wrap(tail);

        int actualLen = tail.length - HEADER_SIZE - CRC_SIZE;
        if (actualLen >= 0) {
            ByteBuffer rewritten = ByteBuffer.allocate(HEADER_SIZE);
            rewritten.put(tail, 0, HEADER_SIZE - 4).putInt(actualLen).flip();
            CRC32C crc = new CRC32C();
            crc.update(rewritten);
            crc.update(tail, HEADER_SIZE, actualLen);
            if ((int) crc.getValue() == buf.getInt(tail.length - CRC_SIZE)) {
                LOG.error("Frame {} at offset {} is complete but its length field is damaged", index, pos);
                return false;
            }
        }
        for (int k = HEADER_SIZE; k + HEADER_SIZE <= tail.length; k++) {
            if (isFrameHeader(buf, k, index + 1)) {
                LOG.error("Frame {} at offset {} overruns frame {} at offset {}", index, pos, index + 1, pos + k);
                return false;
            }
        }
        return true;
    }

    private boolean startsFrame(long pos, long sequence) throws IOException {
        if (pos + HEADER_SIZE > logChannel.size()) {
            return false;
        }
        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
        readFully(header, pos);
        return isFrameHeader(header, 0, sequence);
    }

    private static boolean isFrameHeader(ByteBuffer buf, int at, long sequence) {
        return buf.getInt(at) == MAGIC
                && buf.getShort(at + 4) == VERSION
                && buf.get(at + 6) == TYPE_RECORD
                && buf.getLong(at + 7) == sequence;
    }

    private void truncateTornTail(long pos, long fileSize, String reason) throws IOException {
        LOG.warn("Truncating torn tail ({}): {} bytes removed (file was {} bytes, valid data {} bytes)",
                reason, fileSize - pos, fileSize, pos);
        logChannel.truncate(pos);
        if (syncEnabled) {
            logChannel.force(true);
        }
    }

    private boolean isZeroFilled(long from, long to) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(8192);
        long pos = from;
        while (pos < to) {
            buf.clear();
            int n = logChannel.read(buf, pos);
            if (n <= 0) {
                break;
            }
            for (int i = 0; i < n; i++) {
                if (buf.get(i) != 0) {
                    return false;
                }
            }
            pos += n;
        }
        return true;
    }

    /**
     * Reads and validates one frame. Must be called from the walExecutor thread.
     */
    private AuditRecord readFrame(long seq) {
        if (corruptFrom >= 0 && seq >= corruptFrom) {
            throw new CorruptRecordException(corruptFrom, "frame boundary lost in " + LOG_FILE);
        }
        long offset = frameOffsets.get((int) seq);
        try {
            ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
            readFully(header, offset);
            header.flip();
            int magic = header.getInt();
            short version = header.getShort();
            byte type = header.get();
            long sequence = header.getLong();
            int payloadLen = header.getInt();
            if (magic != MAGIC || version != VERSION || type != TYPE_RECORD || sequence != seq) {
                throw new CorruptRecordException(seq, "damaged frame header at offset " + offset);
            }

            ByteBuffer payload = ByteBuffer.allocate(payloadLen);
            readFully(payload, offset + HEADER_SIZE);
            ByteBuffer crcBuf = ByteBuffer.allocate(CRC_SIZE);
            readFully(crcBuf, offset + HEADER_SIZE + payloadLen);
            crcBuf.flip();

            // Verify CRC over header + payload
            CRC32C crc = new CRC32C();
            header.rewind();
            crc.update(header);
            payload.flip();
            crc.update(payload.duplicate());
            int expectedCrc = crcBuf.getInt();
            AuditRecord record = RecordCodec.decode(payload.array());
            if ((int) crc.getValue() != expectedCrc) {
                if (record.hashMatchesContent()) {
                    // Damage outside the hashed content would otherwise go unseen
                    throw new CorruptRecordException(seq, "frame checksum mismatch at offset " + offset);
                }
                // Returned as stored: the record hash check names the damaged index
                LOG.warn("CRC mismatch at sequence {} (offset {}): stored={}, computed={}",
                        seq, offset, expectedCrc, (int) crc.getValue());
            }
            return record;
        } catch (MalformedRecordException e) {
            throw new CorruptRecordException(seq, e.getMessage(), e);
        } catch (IOException e) {
            LOG.error("Failed to read sequence {}: {}", seq, e.getMessage(), e);
            throw new StorageException("Failed to read sequence " + seq, e);
        }
    }

    private void readFully(ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            int n = logChannel.read(buf, pos);
            if (n < 0) {
                throw new IOException("Unexpected end of " + LOG_FILE + " at " + pos);
            }
            pos += n;
        }
    }

    /**
     * Writes a single frame at the current end of the WAL.
     * Must be called from the walExecutor thread.
     */
    private void writeFrame(long sequence, byte[] payload) throws IOException {
        int payloadLen = payload.length;
        int frameSize = HEADER_SIZE + payloadLen + CRC_SIZE;

        // Pre-flight disk space check for large writes
        if (frameSize > 1024 * 1024) {
            LOG.debug("Large write detected ({} bytes), checking disk space", frameSize);
            checkDiskSpace();
        }

        ByteBuffer buf = ByteBuffer.allocate(frameSize);
        buf.putInt(MAGIC);
        buf.putShort(VERSION);
        buf.put(TYPE_RECORD);
        buf.putLong(sequence);
        buf.putInt(payloadLen);
        buf.put(payload);

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, HEADER_SIZE + payloadLen);
        int crcValue = (int) crc.getValue();
        buf.putInt(crcValue);
        buf.flip();

        long writePosition = endOffset;
        logChannel.position(writePosition);
        while (buf.hasRemaining()) {
            logChannel.write(buf);
        }

        // Optional read-after-write verification
        if (verifyWrites && syncEnabled) {
            verifyWrittenFrame(writePosition, frameSize, crcValue);
        }
    }

    /**
     * Drops bytes written by a failed append so the next append starts at a clean boundary.
     */
    private void rollbackTo(long position) {
        try {
            if (logChannel.size() > position) {
                logChannel.truncate(position);
            }
            logChannel.position(position);
        } catch (IOException e) {
            LOG.error("Could not roll back failed append at {}: {}", position, e.getMessage(), e);
        }
    }

    /**
     * Acquires an exclusive lock on the WAL directory to prevent multiple processes.
     *
     * @throws StorageException if lock cannot be acquired (another process holds it)
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = dataDir.resolve(LOCK_FILE);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException(
                        "Cannot acquire exclusive lock on ledger directory: " + dataDir +
                        ". Another process may be using this storage.");
            }
            LOG.debug("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException(
                    "Cannot acquire exclusive lock: lock already held in this JVM", e);
        }
    }

    /**
     * Releases the exclusive lock and closes the lock channel.
     */
    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws StorageException if disk space is below minimum threshold
     */
    private void checkDiskSpace() throws IOException {
        FileStore store = Files.getFileStore(dataDir);
        long usableSpace = store.getUsableSpace();
        if (usableSpace < minFreeSpace) {
            long usableSpaceMb = usableSpace / 1024 / 1024;
            long minFreeSpaceMb = minFreeSpace / 1024 / 1024;
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, minFreeSpaceMb);
            throw new StorageException(
                    "Insufficient disk space: " + usableSpaceMb + " MB available, " +
                    "need at least " + minFreeSpaceMb + " MB.");
        }
    }

    /**
     * Verifies a written frame by reading it back and checking the CRC.
     * <p>
     * This detects silent filesystem corruption where writes appear to succeed
     * but data is not correctly persisted (e.g., faulty disk controller, bad RAM).
     */
    private void verifyWrittenFrame(long position, int frameSize, int expectedCrc) throws IOException {
        logChannel.force(true);

        ByteBuffer readBuf = ByteBuffer.allocate(frameSize);
        int bytesRead = logChannel.read(readBuf, position);
        if (bytesRead != frameSize) {
            throw new StorageException("Write verification failed: expected to read " + frameSize +
                    " bytes but got " + bytesRead);
        }

        CRC32C verifyCrc = new CRC32C();
        verifyCrc.update(readBuf.array(), 0, frameSize - CRC_SIZE);
        int actualCrc = (int) verifyCrc.getValue();
        int storedCrc = readBuf.getInt(frameSize - CRC_SIZE);

        if (storedCrc != expectedCrc || actualCrc != expectedCrc) {
            LOG.error("Write verification CRC mismatch: written={}, stored={}, computed={}",
                    expectedCrc, storedCrc, actualCrc);
            throw new StorageException("Write verification failed: CRC mismatch. Written=" + expectedCrc +
                    ", Stored=" + storedCrc + ", Computed=" + actualCrc +
                    ". Possible silent data corruption!");
        }
    }
}
