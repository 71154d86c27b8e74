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
package dev.mars.decisionlog.record;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * The immutable unit of the ledger.
 * <p>
 * {@code recordHash} is {@code SHA-256(RecordCodec.encodeForHash(this))}, computed
 * once when the record is sealed and carried unchanged afterwards. A record read
 * back from storage keeps the stored hash, so {@link #hashMatchesContent()} is
 * how tampering with any other field is detected.
 * <p>
 * Equality is by {@code (id, recordHash)}.
 */
public final class AuditRecord {

    private final UUID id;
    private final String nodeId;
    private final VectorClock vectorClock;
    private final long localSequence;
    private final Instant timestamp;
    private final EventType eventType;
    private final Actor actor;
    private final byte[] statuteId;
    private final byte[] subjectId;
    private final byte[] decisionContext;
    private final byte[] decisionResult;
    private final HashValue prevHash;
    private final HashValue recordHash;

    private AuditRecord(UUID id, String nodeId, VectorClock vectorClock, long localSequence,
                        Instant timestamp, EventType eventType, Actor actor,
                        byte[] statuteId, byte[] subjectId, byte[] decisionContext,
                        byte[] decisionResult, HashValue prevHash, HashValue recordHash) {
        this.id = Objects.requireNonNull(id, "id");
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.vectorClock = Objects.requireNonNull(vectorClock, "vectorClock");
        if (localSequence < 0) {
            throw new IllegalArgumentException("localSequence must be >= 0: " + localSequence);
        }
        this.localSequence = localSequence;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.actor = Objects.requireNonNull(actor, "actor");
        this.statuteId = statuteId.clone();
        this.subjectId = subjectId.clone();
        this.decisionContext = decisionContext.clone();
        this.decisionResult = decisionResult.clone();
        this.prevHash = Objects.requireNonNull(prevHash, "prevHash");
        this.recordHash = recordHash != null ? recordHash : RecordCodec.hash(this);
    }

    /**
     * Seals a draft at a chain position: fills in the chain fields and computes the hash.
     *
     * @param draft         the producer's unsealed record
     * @param nodeId        authoring node
     * @param localSequence next local sequence on that node
     * @param vectorClock   causal history including this record
     * @param prevHash      hash of the node's previous record, {@link HashValue#ZERO} for genesis
     */
    public static AuditRecord seal(RecordDraft draft, String nodeId, long localSequence,
                                   VectorClock vectorClock, HashValue prevHash) {
        return new AuditRecord(draft.id(), nodeId, vectorClock, localSequence,
                draft.timestamp(), draft.eventType(), draft.actor(),
                draft.statuteId(), draft.subjectId(), draft.decisionContext(),
                draft.decisionResult(), prevHash, null);
    }

    /**
     * Rebuilds a record from its stored fields, keeping the stored hash as-is.
     */
    public static AuditRecord restore(UUID id, String nodeId, VectorClock vectorClock,
                                      long localSequence, Instant timestamp, EventType eventType,
                                      Actor actor, byte[] statuteId, byte[] subjectId,
                                      byte[] decisionContext, byte[] decisionResult,
                                      HashValue prevHash, HashValue recordHash) {
        return new AuditRecord(id, nodeId, vectorClock, localSequence, timestamp, eventType,
                actor, statuteId, subjectId, decisionContext, decisionResult, prevHash,
                Objects.requireNonNull(recordHash, "recordHash"));
    }

    /** Recomputes the hash from the current field values. */
    public HashValue computeHash() {
        return RecordCodec.hash(this);
    }

    /** True if the stored hash still matches the content. */
    public boolean hashMatchesContent() {
        return recordHash.equals(computeHash());
    }

    public boolean isGenesis() {
        return localSequence == 0;
    }

    public RecordSlot slot() {
        return new RecordSlot(nodeId, localSequence);
    }

    public UUID id() {
        return id;
    }

    public String nodeId() {
        return nodeId;
    }

    public VectorClock vectorClock() {
        return vectorClock;
    }

    public long localSequence() {
        return localSequence;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public EventType eventType() {
        return eventType;
    }

    public Actor actor() {
        return actor;
    }

    public byte[] statuteId() {
        return statuteId.clone();
    }

    public byte[] subjectId() {
        return subjectId.clone();
    }

    public byte[] decisionContext() {
        return decisionContext.clone();
    }

    public byte[] decisionResult() {
        return decisionResult.clone();
    }

    public HashValue prevHash() {
        return prevHash;
    }

    public HashValue recordHash() {
        return recordHash;
    }

    // Package-private, no-copy views for the codec.
    byte[] statuteIdRef() {
        return statuteId;
    }

    byte[] subjectIdRef() {
        return subjectId;
    }

    byte[] decisionContextRef() {
        return decisionContext;
    }

    byte[] decisionResultRef() {
        return decisionResult;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof AuditRecord other
                && id.equals(other.id)
                && recordHash.equals(other.recordHash);
    }

    @Override
    public int hashCode() {
        return 31 * id.hashCode() + recordHash.hashCode();
    }

    @Override
    public String toString() {
        return "AuditRecord{" +
                "id=" + id +
                ", slot=" + slot() +
                ", eventType=" + eventType +
                ", clock=" + vectorClock +
                ", hash=" + recordHash.shortHex() +
                '}';
    }
}
