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
import dev.mars.decisionlog.record.HashValue;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence port of the decision ledger.
 * <p>
 * This interface abstracts durable storage of one node's hash chain, allowing
 * implementations to switch between the file WAL ({@link FileLedgerStorage}),
 * an in-memory store, or external engines (SQL, object stores).
 * <p>
 * The ledger depends solely on this interface, never on concrete implementations.
 * In-memory ledger state is a cache that can always be rebuilt from it.
 * <p>
 * <b>Critical Contract:</b>
 * <ul>
 *   <li>{@link #append} must be durable (fsync-equivalent) before its Future completes successfully.</li>
 *   <li>Acknowledged writes are never reordered, rewritten or dropped.</li>
 *   <li>Records are stored at dense positions: the record with local sequence {@code n}
 *       is the {@code n}-th record stored.</li>
 * </ul>
 *
 * @see FileLedgerStorage
 * @see InMemoryLedgerStorage
 */
public interface LedgerStorage extends Closeable {

    /**
     * Opens the storage engine and recovers its index. Idempotent.
     *
     * @return a Future that completes when storage is ready
     */
    CompletableFuture<Void> open();

    /**
     * Durably appends one sealed record.
     * <p>
     * The record's local sequence must equal {@link #size()}; anything else is refused.
     * If the Future fails, nothing was acknowledged and the store is unchanged.
     *
     * @param record the sealed record
     * @return a Future that completes when the record is durable
     */
    CompletableFuture<Void> append(AuditRecord record);

    /**
     * Reads records by local sequence, {@code from} inclusive, {@code to} exclusive.
     * <p>
     * Fails with {@link CorruptRecordException} if a stored record in the range can no
     * longer be read back intact.
     *
     * @return the records in sequence order
     */
    CompletableFuture<List<AuditRecord>> readRange(long from, long to);

    /**
     * Reads the hash and sequence of the last stored record.
     *
     * @return the head, or empty for an empty chain
     */
    CompletableFuture<Optional<ChainHead>> readHead();

    /**
     * Number of records stored (including an unreadable one, if any).
     */
    long size();

    /**
     * Closes the storage, releasing all resources.
     * <p>
     * After close, no other methods should be called.
     */
    @Override
    void close();

    /**
     * Position and hash of the last record in a chain.
     *
     * @param recordHash    hash of the last record
     * @param localSequence its local sequence
     */
    record ChainHead(HashValue recordHash, long localSequence) {
    }
}
