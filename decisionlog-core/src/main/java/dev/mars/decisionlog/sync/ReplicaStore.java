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

import dev.mars.decisionlog.error.CausalOrderViolationException;
import dev.mars.decisionlog.error.PersistenceFailureException;
import dev.mars.decisionlog.record.AuditRecord;
import dev.mars.decisionlog.record.HashValue;
import dev.mars.decisionlog.record.VectorClock;
import dev.mars.decisionlog.storage.InMemoryLedgerStorage;
import dev.mars.decisionlog.storage.LedgerStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Copies of other nodes' chains, one {@link LedgerStorage} per origin.
 * <p>
 * A record is committed only if it is the next in its origin's chain and links to
 * the held predecessor; the storage write completes before the record becomes
 * visible. Hashes are cached per origin so fork probes do not touch storage.
 */
public final class ReplicaStore {

    private static final Logger LOG = LoggerFactory.getLogger(ReplicaStore.class);

    private final String owner;
    private final Function<String, LedgerStorage> storageFactory;
    private final long ioTimeoutMs;
    private final Map<String, Replica> replicas = new TreeMap<>();

    /**
     * @param owner          node holding these replicas
     * @param storageFactory storage for a newly seen origin
     * @param ioTimeoutMs    bound on each storage call
     */
    public ReplicaStore(String owner, Function<String, LedgerStorage> storageFactory, long ioTimeoutMs) {
        this.owner = owner;
        this.storageFactory = storageFactory;
        this.ioTimeoutMs = ioTimeoutMs;
    }

    /** Replicas kept in memory. */
    public static ReplicaStore inMemory(String owner, long ioTimeoutMs) {
        return new ReplicaStore(owner, origin -> new InMemoryLedgerStorage(owner + "/replica-" + origin), ioTimeoutMs);
    }

    /**
     * Opens the replica of {@code origin}, recovering whatever its storage already holds.
     */
    public synchronized void restore(String origin) {
        replica(origin);
    }

    /**
     * Commits records in order; each must extend its origin's chain.
     *
     * @throws CausalOrderViolationException if a record does not extend its chain
     * @throws PersistenceFailureException   if storage fails; earlier records stay committed
     */
    public synchronized void commit(List<AuditRecord> records) {
        for (AuditRecord r : records) {
            if (r.nodeId().equals(owner)) {
                throw new CausalOrderViolationException("Replica store of " + owner + " cannot hold its own record " + r.slot());
            }
            Replica replica = replica(r.nodeId());
            long expected = replica.hashes.size();
            if (r.localSequence() != expected) {
                throw new CausalOrderViolationException("Replica of " + r.nodeId() + " expects sequence " +
                        expected + ", got " + r.localSequence());
            }
            HashValue prev = expected == 0 ? HashValue.ZERO : replica.hashes.get((int) expected - 1);
            if (!r.prevHash().equals(prev)) {
                throw new CausalOrderViolationException("Record " + r.slot() + " does not link to held predecessor " +
                        prev.shortHex());
            }
            await(replica.storage.append(r), "replicate " + r.slot());
            replica.hashes.add(r.recordHash());
            replica.clock = r.vectorClock();
            LOG.trace("Replicated {} on {}", r.slot(), owner);
        }
    }

    /** Records held per origin. */
    public synchronized VectorClock frontier() {
        Map<String, Long> sizes = new TreeMap<>();
        replicas.forEach((origin, replica) -> sizes.put(origin, (long) replica.hashes.size()));
        return VectorClock.of(sizes);
    }

    /** Entry-wise maximum of the clocks of the latest replicated records. */
    public synchronized VectorClock observedClock() {
        VectorClock merged = VectorClock.empty();
        for (Replica replica : replicas.values()) {
            merged = merged.merge(replica.clock);
        }
        return merged.merge(frontier());
    }

    public synchronized long size(String origin) {
        Replica replica = replicas.get(origin);
        return replica == null ? 0 : replica.hashes.size();
    }

    public synchronized Optional<HashValue> hashAt(String origin, long sequence) {
        Replica replica = replicas.get(origin);
        if (replica == null || sequence < 0 || sequence >= replica.hashes.size()) {
            return Optional.empty();
        }
        return Optional.of(replica.hashes.get((int) sequence));
    }

    public synchronized Optional<HashValue> headHash(String origin) {
        long size = size(origin);
        return size == 0 ? Optional.empty() : hashAt(origin, size - 1);
    }

    /** Records {@code [from, to)} of {@code origin}, clamped to what is held. */
    public List<AuditRecord> read(String origin, long from, long to) {
        LedgerStorage storage;
        long end;
        synchronized (this) {
            Replica replica = replicas.get(origin);
            if (replica == null) {
                return List.of();
            }
            storage = replica.storage;
            end = Math.min(to, replica.hashes.size());
        }
        if (from >= end) {
            return List.of();
        }
        return await(storage.readRange(from, end), "read replica " + origin);
    }

    public synchronized Set<String> origins() {
        return new TreeSet<>(replicas.keySet());
    }

    /** Closes every replica's storage. */
    public synchronized void close() {
        replicas.values().forEach(r -> r.storage.close());
        replicas.clear();
    }

    private Replica replica(String origin) {
        Replica replica = replicas.get(origin);
        if (replica == null) {
            LedgerStorage storage = storageFactory.apply(origin);
            await(storage.open(), "open replica " + origin);
            replica = new Replica(storage);
            long size = storage.size();
            if (size > 0) {
                List<AuditRecord> held = await(storage.readRange(0, size), "recover replica " + origin);
                for (AuditRecord r : held) {
                    replica.hashes.add(r.recordHash());
                    replica.clock = r.vectorClock();
                }
                LOG.info("Recovered replica of {} on {}: {} records", origin, owner, held.size());
            }
            replicas.put(origin, replica);
        }
        return replica;
    }

    private <T> T await(CompletableFuture<T> future, String what) {
        try {
            return future.get(ioTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceFailureException(what + " interrupted", e);
        } catch (ExecutionException e) {
            throw new PersistenceFailureException(what + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new PersistenceFailureException(what + " timed out after " + ioTimeoutMs + " ms", e);
        }
    }

    private static final class Replica {
        private final LedgerStorage storage;
        private final List<HashValue> hashes = new ArrayList<>();
        private VectorClock clock = VectorClock.empty();

        private Replica(LedgerStorage storage) {
            this.storage = storage;
        }
    }
}
