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

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Canonical binary serialization of {@link AuditRecord}.
 * <p>
 * The same bytes are hashed and persisted, so the layout is fixed:
 * <pre>
 * VERSION(1)
 * ID_MSB(8) ID_LSB(8)
 * NODE_ID(str)
 * CLOCK_SIZE(4) { NODE(str) COUNTER(8) }*      // sorted by node id
 * LOCAL_SEQUENCE(8)
 * TS_SECONDS(8) TS_NANOS(4)
 * EVENT_TYPE(1)
 * ACTOR_TAG(1) ACTOR_FIELDS(str...)
 * STATUTE_ID(bytes) SUBJECT_ID(bytes)
 * DECISION_CONTEXT(bytes) DECISION_RESULT(bytes)
 * PREV_HASH(32)
 * [RECORD_HASH(32)]                              // persisted form only
 *
 * str   = LEN(4) UTF-8
 * bytes = LEN(4) raw
 * </pre>
 * All integers are big-endian.
 */
public final class RecordCodec {

    /** Encoding format version. */
    public static final byte FORMAT_VERSION = 1;

    private RecordCodec() {
    }

    /** SHA-256 over the canonical encoding of every field except the record hash. */
    public static HashValue hash(AuditRecord record) {
        return HashValue.sha256(encodeForHash(record));
    }

    /** Canonical bytes covered by the record hash. */
    public static byte[] encodeForHash(AuditRecord record) {
        return encode(record, false);
    }

    /** Persisted form: the hashed bytes followed by the record hash. */
    public static byte[] encode(AuditRecord record) {
        return encode(record, true);
    }

    private static byte[] encode(AuditRecord r, boolean withHash) {
        byte[] node = utf8(r.nodeId());
        Map<String, Long> clock = r.vectorClock().entries();
        byte[][] clockNodes = new byte[clock.size()][];

        int size = 1 + 16 + 4 + node.length + 4;
        int i = 0;
        for (String n : clock.keySet()) {
            clockNodes[i] = utf8(n);
            size += 4 + clockNodes[i].length + 8;
            i++;
        }
        size += 8 + 8 + 4 + 1;

        byte[][] actorFields = actorFields(r.actor());
        size += 1;
        for (byte[] f : actorFields) {
            size += 4 + f.length;
        }
        size += 4 + r.statuteIdRef().length
                + 4 + r.subjectIdRef().length
                + 4 + r.decisionContextRef().length
                + 4 + r.decisionResultRef().length
                + HashValue.LENGTH;
        if (withHash) {
            size += HashValue.LENGTH;
        }

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.put(FORMAT_VERSION);
        buf.putLong(r.id().getMostSignificantBits());
        buf.putLong(r.id().getLeastSignificantBits());
        putBytes(buf, node);
        buf.putInt(clock.size());
        i = 0;
        for (long counter : clock.values()) {
            putBytes(buf, clockNodes[i++]);
            buf.putLong(counter);
        }
        buf.putLong(r.localSequence());
        buf.putLong(r.timestamp().getEpochSecond());
        buf.putInt(r.timestamp().getNano());
        buf.put(r.eventType().code());
        buf.put(r.actor().tag());
        for (byte[] f : actorFields) {
            putBytes(buf, f);
        }
        putBytes(buf, r.statuteIdRef());
        putBytes(buf, r.subjectIdRef());
        putBytes(buf, r.decisionContextRef());
        putBytes(buf, r.decisionResultRef());
        r.prevHash().writeTo(buf);
        if (withHash) {
            r.recordHash().writeTo(buf);
        }
        return buf.array();
    }

    /**
     * Decodes the persisted form. The stored record hash is kept, not recomputed.
     *
     * @throws MalformedRecordException if the bytes are truncated, over-long or inconsistent
     */
    public static AuditRecord decode(byte[] data) {
        if (data == null) {
            throw new MalformedRecordException("No record bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(data);
        try {
            byte version = buf.get();
            if (version != FORMAT_VERSION) {
                throw new MalformedRecordException("Unsupported record format version: " + version);
            }
            UUID id = new UUID(buf.getLong(), buf.getLong());
            String nodeId = getString(buf);

            int clockSize = buf.getInt();
            if (clockSize < 0 || clockSize > buf.remaining() / 12) {
                throw new MalformedRecordException("Invalid vector clock size: " + clockSize);
            }
            Map<String, Long> clock = new TreeMap<>();
            for (int i = 0; i < clockSize; i++) {
                String n = getString(buf);
                long counter = buf.getLong();
                if (counter <= 0 || clock.put(n, counter) != null) {
                    throw new MalformedRecordException("Invalid vector clock entry for " + n);
                }
            }

            long localSequence = buf.getLong();
            if (localSequence < 0) {
                throw new MalformedRecordException("Negative local sequence: " + localSequence);
            }
            Instant timestamp = Instant.ofEpochSecond(buf.getLong(), buf.getInt());
            EventType eventType = EventType.fromCode(buf.get());
            Actor actor = getActor(buf);
            byte[] statuteId = getBytes(buf);
            byte[] subjectId = getBytes(buf);
            byte[] context = getBytes(buf);
            byte[] result = getBytes(buf);
            HashValue prevHash = HashValue.read(buf);
            HashValue recordHash = HashValue.read(buf);

            if (buf.hasRemaining()) {
                throw new MalformedRecordException(buf.remaining() + " trailing bytes after record");
            }
            return AuditRecord.restore(id, nodeId, VectorClock.of(clock), localSequence, timestamp,
                    eventType, actor, statuteId, subjectId, context, result, prevHash, recordHash);
        } catch (BufferUnderflowException e) {
            throw new MalformedRecordException("Record bytes truncated", e);
        } catch (DateTimeException | IllegalArgumentException e) {
            throw new MalformedRecordException("Invalid record field: " + e.getMessage(), e);
        }
    }

    private static byte[][] actorFields(Actor actor) {
        if (actor instanceof Actor.System s) {
            return new byte[][]{utf8(s.component())};
        }
        if (actor instanceof Actor.User u) {
            return new byte[][]{utf8(u.id()), utf8(u.role())};
        }
        if (actor instanceof Actor.External e) {
            return new byte[][]{utf8(e.system())};
        }
        throw new IllegalArgumentException("Unknown actor: " + actor);
    }

    private static Actor getActor(ByteBuffer buf) {
        byte tag = buf.get();
        switch (tag) {
            case Actor.System.TAG:
                return new Actor.System(getString(buf));
            case Actor.User.TAG:
                return new Actor.User(getString(buf), getString(buf));
            case Actor.External.TAG:
                return new Actor.External(getString(buf));
            default:
                throw new MalformedRecordException("Unknown actor tag: " + tag);
        }
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void putBytes(ByteBuffer buf, byte[] b) {
        buf.putInt(b.length);
        buf.put(b);
    }

    private static byte[] getBytes(ByteBuffer buf) {
        int len = buf.getInt();
        if (len < 0 || len > buf.remaining()) {
            throw new MalformedRecordException("Invalid field length " + len +
                    " with " + buf.remaining() + " bytes remaining");
        }
        byte[] b = new byte[len];
        buf.get(b);
        return b;
    }

    private static String getString(ByteBuffer buf) {
        return new String(getBytes(buf), StandardCharsets.UTF_8);
    }
}
