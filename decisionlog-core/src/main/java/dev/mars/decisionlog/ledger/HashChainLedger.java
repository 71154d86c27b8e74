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
package dev.mars.decisionlog.ledger;

import dev.mars.decisionlog.DecisionLogConfig;
import dev.mars.decisionlog.error.IntegrityAlert;
import dev.mars.decisionlog.error.IntegrityAlertSink;
import dev.mars.decisionlog.error.IntegrityViolationException;
import dev.mars.decisionlog.error.LoggingAlertSink;
import dev.mars.decisionlog.error.PersistenceFailureException;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.RecordDraft;
import dev.mars.decisionlog.record.VectorClock;
import dev.mars.decisionlog.storage.CorruptRecordException;
import dev.mars.decisionlog.storage.LedgerStorage;
import dev.mars.decisionlog.storage.LedgerStorage.ChainHead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * One node's local hash chain.
 * <p>
 * Appends are serialized by a single lock: each append reads the head, seals the
 * draft against it, persists the record through the {@link LedgerStorage} and
 * only then publishes the new head. Readers never take the lock; they work on the
 * head snapshot visible when they start.
 * <p>
 * <b>Failure semantics:</b>
 * <ul>
 *   <li>A failed or timed-out write leaves the head where it was and throws
 *       {@link PersistenceFailureException}.</li>
 *   <li>A timed-out write may still land. Its outcome is settled before the next append:
 *       a landed record becomes the head, a failed one is dropped, and while it is still
 *       outstanding appends are refused rather than sealed against a stale head.</li>
 *   <li>A verification mismatch is reported and raised on the {@link IntegrityAlertSink};
 *       it is never repaired.</li>
 *   <li>A chain whose stored head cannot be read on open is untrusted: appends are refused,
 *       verification still runs.</li>
 * </ul>
 * Each instance owns its own head; ledgers for different nodes (or tests) share nothing.
 */
public final class HashChainLedger {

    private static final Logger LOG = LoggerFactory.getLogger(HashChainLedger.class);

    /** Records fetched per storage read while verifying. */
    static final int VERIFY_BATCH = 1024;

    /** Hash-check chunks queued at once by {@link #verifyParallel}. */
    private static final int PARALLEL_WINDOW = 8;

    private final String nodeId;
    private final LedgerStorage storage;
    private final Supplier<VectorClock> observedClock;
    private final long ioTimeoutMs;
    private final IntegrityAlertSink alerts;
    private final ReentrantLock appendLock = new ReentrantLock();
    private final List<Consumer<AuditRecord>> appendListeners = new CopyOnWriteArrayList<>();

    private volatile ChainState state = ChainState.EMPTY;
    private volatile long untrustedFrom = -1;

    // Guarded by appendLock
    private InDoubtWrite inDoubt;

    /**
     * @param nodeId        authoring node of every record appended here
     * @param storage       durable home of the chain
     * @param observedClock frontier of records seen from other nodes, merged into each new clock
     * @param ioTimeoutMs   bound on each storage call
     * @param alerts        operator channel for integrity violations
     */
    public HashChainLedger(String nodeId, LedgerStorage storage, Supplier<VectorClock> observedClock,
                           long ioTimeoutMs, IntegrityAlertSink alerts) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.observedClock = Objects.requireNonNull(observedClock, "observedClock");
        this.ioTimeoutMs = ioTimeoutMs;
        this.alerts = Objects.requireNonNull(alerts, "alerts");
    }

    /**
     * Standalone ledger: no peers observed, alerts logged.
     */
    public HashChainLedger(DecisionLogConfig config, LedgerStorage storage) {
        this(config.nodeId(), storage, VectorClock::empty, config.ioTimeoutMs(), new LoggingAlertSink());
    }

    /**
     * Opens the storage and restores head and own clock from the last stored record.
     */
    public HashChainLedger open() {
        appendLock.lock();
        try {
            await(storage.open(), "open");
            long size = storage.size();
            try {
                Optional<ChainHead> head = await(storage.readHead(), "read head");
                if (head.isEmpty()) {
                    state = ChainState.EMPTY;
                } else {
                    AuditRecord last = await(storage.readRange(size - 1, size), "read last record").get(0);
                    state = new ChainState(head.get().recordHash(), size, last.vectorClock());
                }
                untrustedFrom = -1;
                inDoubt = null;
                LOG.info("Ledger for node {} opened: {} records, head={}", nodeId, size,
                        state.headHash().shortHex());
            } catch (CorruptRecordException e) {
                untrustedFrom = e.sequence();
                state = new ChainState(HashValue.ZERO, size, VectorClock.empty());
                IntegrityViolationException violation = new IntegrityViolationException(e.sequence(),
                        "Stored chain head unreadable: " + e.getMessage(), e);
                LOG.error("Ledger for node {} is untrusted from index {}; appends refused", nodeId, e.sequence());
                alerts.raise(IntegrityAlert.of(violation, nodeId));
            }
            return this;
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * Seals the draft at the head of this node's chain and persists it.
     * <p>
     * Returns only once the record is durable. On any failure the head is unchanged.
     *
     * @throws PersistenceFailureException if storage rejects or does not acknowledge the write
     * @throws IntegrityViolationException if the chain is untrusted
     */
    public AuditRecord append(RecordDraft draft) {
        Objects.requireNonNull(draft, "draft");
        appendLock.lock();
        try {
            if (untrustedFrom >= 0) {
                throw new IntegrityViolationException(untrustedFrom,
                        "Chain of node " + nodeId + " is untrusted from index " + untrustedFrom +
                        "; appends refused until re-anchored");
            }
            settleInDoubt();
            ChainState s = state;
            long sequence = s.size();
            VectorClock clock = nextClock(s.lastClock(), sequence);
            AuditRecord record = AuditRecord.seal(draft, nodeId, sequence, clock, s.headHash());

            CompletableFuture<Void> write = storage.append(record);
            try {
                await(write, "append sequence " + sequence);
            } catch (PersistenceFailureException e) {
                if (!write.isCompletedExceptionally()) {
                    inDoubt = new InDoubtWrite(record, write);
                    LOG.warn("Append of sequence {} on node {} has no outcome yet; settled before the next append",
                            sequence, nodeId);
                }
                LOG.error("Append of sequence {} on node {} failed, head unchanged: {}",
                        sequence, nodeId, e.getMessage());
                throw e;
            }

            publish(record);
            return record;
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * Registers a callback run inside the append critical section after each durable append.
     */
    public void onAppend(Consumer<AuditRecord> listener) {
        appendListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Verifies records {@code [from, to)} against the stored hashes.
     * <p>
     * For each record: the hash recomputed from its content matches the stored hash,
     * {@code prevHash} equals the predecessor's hash (zero for genesis), the own clock
     * entry is one more than the predecessor's, and the local sequence equals its position.
     * {@code to} is clamped to the head visible when the call starts.
     */
    public VerificationResult verifyRange(long from, long to) {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("Invalid range [" + from + ", " + to + ")");
        }
        long end = Math.min(to, snapshotSize());
        long started = System.nanoTime();
        AuditRecord prev = null;
        if (from > 0 && from < end) {
            Loaded p = load(from - 1, from);
            if (p.corruptAt() >= 0) {
                return report(VerificationResult.firstMismatchAt(from - 1, "record unreadable", 0));
            }
            prev = p.records().get(0);
        }
        long checked = 0;
        for (long cursor = from; cursor < end; cursor += VERIFY_BATCH) {
            Loaded batch = load(cursor, Math.min(end, cursor + VERIFY_BATCH));
            long index = cursor;
            for (AuditRecord r : batch.records()) {
                String failure = checkHash(r);
                if (failure == null) {
                    failure = checkLink(prev, r, index);
                }
                if (failure != null) {
                    return report(VerificationResult.firstMismatchAt(index, failure, checked));
                }
                checked++;
                prev = r;
                index++;
            }
            if (batch.corruptAt() >= 0) {
                return report(VerificationResult.firstMismatchAt(batch.corruptAt(), "record unreadable", checked));
            }
        }
        LOG.debug("Verified [{}, {}) on node {}: {} records in {} ms", from, end, nodeId, checked,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return VerificationResult.ok(checked);
    }

    /** Verifies the whole chain up to the current head. */
    public VerificationResult verifyAll() {
        return verifyRange(0, snapshotSize());
    }

    /**
     * Whole-chain verification with content hashes recomputed in parallel chunks.
     * <p>
     * Link, clock and density checks stay sequential. The result is the same as
     * {@link #verifyAll()}: the lowest failing index.
     */
    public VerificationResult verifyParallel(Executor executor) {
        long end = snapshotSize();
        long started = System.nanoTime();
        Deque<CompletableFuture<Mismatch>> inFlight = new ArrayDeque<>();
        Mismatch first = null;
        AuditRecord prev = null;
        long loaded = 0;

        for (long cursor = 0; cursor < end && first == null; cursor += VERIFY_BATCH) {
            Loaded batch = load(cursor, Math.min(end, cursor + VERIFY_BATCH));
            List<AuditRecord> records = batch.records();
            long base = cursor;
            inFlight.add(CompletableFuture.supplyAsync(() -> firstHashMismatch(records, base), executor));
            loaded += records.size();

            long index = cursor;
            for (AuditRecord r : records) {
                String failure = checkLink(prev, r, index);
                if (failure != null) {
                    first = new Mismatch(index, failure);
                    break;
                }
                prev = r;
                index++;
            }
            if (first == null && batch.corruptAt() >= 0) {
                first = new Mismatch(batch.corruptAt(), "record unreadable");
            }
            while (inFlight.size() > PARALLEL_WINDOW) {
                first = lower(first, inFlight.poll().join());
            }
        }
        for (CompletableFuture<Mismatch> chunk : inFlight) {
            first = lower(first, chunk.join());
        }

        if (first == null) {
            LOG.debug("Parallel verification of node {}: {} records intact in {} ms", nodeId, loaded,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            return VerificationResult.ok(loaded);
        }
        return report(VerificationResult.firstMismatchAt(first.index(), first.reason(), first.index()));
    }

    /** Head of the chain at the time of the call; empty for an empty chain. */
    public Optional<ChainHead> head() {
        ChainState s = state;
        if (s.size() == 0 || untrustedFrom >= 0) {
            return Optional.empty();
        }
        return Optional.of(new ChainHead(s.headHash(), s.size() - 1));
    }

    /** Number of records in the chain. */
    public long size() {
        return state.size();
    }

    /** Clock of this node's latest record, empty before the first append. */
    public VectorClock lastClock() {
        return state.lastClock();
    }

    public String nodeId() {
        return nodeId;
    }

    /** Index from which the chain is untrusted, or -1. */
    public long untrustedFrom() {
        return untrustedFrom;
    }

    /**
     * Reads records {@code [from, to)}, clamped to the current head.
     *
     * @throws PersistenceFailureException if storage cannot serve the range
     */
    public List<AuditRecord> readRange(long from, long to) {
        long end = Math.min(to, snapshotSize());
        if (from >= end) {
            return List.of();
        }
        try {
            return await(storage.readRange(from, end), "read [" + from + ", " + end + ")");
        } catch (CorruptRecordException e) {
            throw new PersistenceFailureException("Stored record " + e.sequence() + " is unreadable", e);
        }
    }

    /** Record at a local sequence. */
    public AuditRecord get(long sequence) {
        if (sequence < 0 || sequence >= snapshotSize()) {
            throw new IndexOutOfBoundsException("No record at sequence " + sequence + " on node " + nodeId);
        }
        return readRange(sequence, sequence + 1).get(0);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private long snapshotSize() {
        return state.size();
    }

    /**
     * Settles a write that timed out. Must hold appendLock.
     *
     * @throws PersistenceFailureException if the write is still outstanding
     */
    private void settleInDoubt() {
        InDoubtWrite pending = inDoubt;
        if (pending == null) {
            return;
        }
        long sequence = pending.record().localSequence();
        try {
            pending.write().get(ioTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceFailureException("Interrupted while settling append of sequence " + sequence +
                    " on node " + nodeId, e);
        } catch (ExecutionException e) {
            inDoubt = null;
            LOG.info("Timed-out append of sequence {} on node {} did not land: {}", sequence, nodeId,
                    e.getCause().getMessage());
            return;
        } catch (TimeoutException e) {
            throw new PersistenceFailureException("Append of sequence " + sequence + " on node " + nodeId +
                    " is still outstanding; appends refused until it settles", e);
        }
        inDoubt = null;
        LOG.warn("Append of {} was reported failed but landed after its timeout; adopted as head",
                pending.record().slot());
        publish(pending.record());
    }

    /** Advances the head to a durable record. Must hold appendLock. */
    private void publish(AuditRecord record) {
        state = new ChainState(record.recordHash(), record.localSequence() + 1, record.vectorClock());
        LOG.trace("Appended {} prev={} hash={}", record.slot(), record.prevHash().shortHex(),
                record.recordHash().shortHex());
        for (Consumer<AuditRecord> listener : appendListeners) {
            notifyListener(listener, record);
        }
    }

    private VectorClock nextClock(VectorClock last, long sequence) {
        VectorClock merged = last.merge(observedClock.get());
        Map<String, Long> entries = new TreeMap<>(merged.entries());
        entries.put(nodeId, sequence + 1);
        return VectorClock.of(entries);
    }

    private void notifyListener(Consumer<AuditRecord> listener, AuditRecord record) {
        try {
            listener.accept(record);
        } catch (RuntimeException e) {
            // The record is durable; a listener failure must not be reported as an append failure
            LOG.error("Append listener failed for {}: {}", record.slot(), e.getMessage(), e);
        }
    }

    private Mismatch firstHashMismatch(List<AuditRecord> records, long base) {
        for (int i = 0; i < records.size(); i++) {
            String failure = checkHash(records.get(i));
            if (failure != null) {
                return new Mismatch(base + i, failure);
            }
        }
        return null;
    }

    private static Mismatch lower(Mismatch a, Mismatch b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.index() < a.index() ? b : a;
    }

    private String checkHash(AuditRecord r) {
        if (!r.hashMatchesContent()) {
            return "record hash mismatch (stored " + r.recordHash().shortHex() +
                    ", computed " + r.computeHash().shortHex() + ")";
        }
        return null;
    }

    private String checkLink(AuditRecord prev, AuditRecord r, long index) {
        if (r.localSequence() != index) {
            return "local sequence " + r.localSequence() + " stored at index " + index;
        }
        if (!nodeId.equals(r.nodeId())) {
            return "record authored by " + r.nodeId() + " in chain of " + nodeId;
        }
        if (prev == null) {
            if (!r.prevHash().isZero()) {
                return "genesis record has non-zero prev hash";
            }
            if (r.vectorClock().get(nodeId) != 1) {
                return "genesis clock entry is " + r.vectorClock().get(nodeId);
            }
            return null;
        }
        if (!r.prevHash().equals(prev.recordHash())) {
            return "prev hash " + r.prevHash().shortHex() + " does not match predecessor " +
                    prev.recordHash().shortHex();
        }
        long expected = prev.vectorClock().get(nodeId) + 1;
        if (r.vectorClock().get(nodeId) != expected) {
            return "own clock entry " + r.vectorClock().get(nodeId) + ", expected " + expected;
        }
        return null;
    }

    private VerificationResult report(VerificationResult result) {
        IntegrityViolationException violation = result.toException();
        LOG.error("Integrity violation on node {} at index {}: {}", nodeId, result.firstMismatch(), result.reason());
        alerts.raise(IntegrityAlert.of(violation, nodeId));
        return result;
    }

    /**
     * Reads {@code [from, to)}. Records before an unreadable one are still returned.
     */
    private Loaded load(long from, long to) {
        try {
            return new Loaded(await(storage.readRange(from, to), "read [" + from + ", " + to + ")"), -1);
        } catch (CorruptRecordException e) {
            long bad = e.sequence();
            List<AuditRecord> prefix = bad > from
                    ? await(storage.readRange(from, bad), "read [" + from + ", " + bad + ")")
                    : List.of();
            return new Loaded(prefix, bad);
        }
    }

    private <T> T await(CompletableFuture<T> future, String what) {
        try {
            return future.get(ioTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceFailureException(what + " interrupted on node " + nodeId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CorruptRecordException corrupt) {
                throw corrupt;
            }
            throw new PersistenceFailureException(what + " failed on node " + nodeId + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new PersistenceFailureException(what + " timed out after " + ioTimeoutMs + " ms on node " + nodeId, e);
        }
    }

    private record ChainState(HashValue headHash, long size, VectorClock lastClock) {
        static final ChainState EMPTY = new ChainState(HashValue.ZERO, 0, VectorClock.empty());
    }

    private record Loaded(List<AuditRecord> records, long corruptAt) {
    }

    private record Mismatch(long index, String reason) {
    }

    private record InDoubtWrite(AuditRecord record, CompletableFuture<Void> write) {
    }
}
