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

import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.MalformedRecordException;
import dev.mars.decisionlog.record.RecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Heap-backed {@link LedgerStorage}.
 * <p>
 * Keeps the persisted encoding of every record rather than the objects, so a
 * record read back goes through the same decode path as the file WAL and raw
 * bytes can be damaged on purpose with {@link #overwriteRaw}. Used for replicated
 * chains by default, and in tests.
 * <p>
 * All operations complete synchronously.
 */
public final class InMemoryLedgerStorage implements LedgerStorage {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryLedgerStorage.class);

    private final String name;
    private final List<byte[]> frames = new ArrayList<>();
    private final AtomicInteger failingAppends = new AtomicInteger();
    private boolean closed;

    public InMemoryLedgerStorage() {
        this("memory");
    }

    /**
     * @param name label used in log lines
     */
    public InMemoryLedgerStorage(String name) {
        this.name = name;
    }

    @Override
    public CompletableFuture<Void> open() {
        LOG.debug("In-memory ledger storage '{}' opened with {} records", name, size());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> append(AuditRecord record) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Storage '" + name + "' is closed"));
        }
        if (failingAppends.get() > 0) {
            failingAppends.decrementAndGet();
            LOG.warn("Injected write failure for sequence {} on '{}'", record.localSequence(), name);
            return CompletableFuture.failedFuture(
                    new StorageException("Injected write failure at sequence " + record.localSequence()));
        }
        if (record.localSequence() != frames.size()) {
            return CompletableFuture.failedFuture(new StorageException(
                    "Out-of-order append: expected sequence " + frames.size() + ", got " + record.localSequence()));
        }
        frames.add(RecordCodec.encode(record));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<List<AuditRecord>> readRange(long from, long to) {
        if (from < 0 || to < from) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Invalid range [" + from + ", " + to + ")"));
        }
        long end = Math.min(to, frames.size());
        List<AuditRecord> out = new ArrayList<>();
        try {
            for (long seq = from; seq < end; seq++) {
                out.add(decode(seq));
            }
        } catch (CorruptRecordException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.completedFuture(out);
    }

    @Override
    public synchronized CompletableFuture<Optional<ChainHead>> readHead() {
        if (frames.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        try {
            AuditRecord last = decode(frames.size() - 1);
            return CompletableFuture.completedFuture(
                    Optional.of(new ChainHead(last.recordHash(), last.localSequence())));
        } catch (CorruptRecordException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public synchronized long size() {
        return frames.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    /**
     * Makes the next {@code count} appends fail without storing anything.
     */
    public void failNextAppends(int count) {
        failingAppends.set(count);
    }

    /** Copy of the stored encoding of one record. */
    public synchronized byte[] rawRecord(long seq) {
        return frames.get((int) seq).clone();
    }

    /** Replaces the stored encoding of one record, bypassing every check. */
    public synchronized void overwriteRaw(long seq, byte[] bytes) {
        frames.set((int) seq, bytes.clone());
        LOG.warn("Raw bytes of sequence {} on '{}' overwritten", seq, name);
    }

    private AuditRecord decode(long seq) {
        try {
            return RecordCodec.decode(frames.get((int) seq));
        } catch (MalformedRecordException e) {
            throw new CorruptRecordException(seq, e.getMessage(), e);
        }
    }
}
