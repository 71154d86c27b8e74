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

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * A 32-byte SHA-256 digest.
 * <p>
 * Used for record hashes, chain links and Merkle nodes. Instances are immutable;
 * the backing array never leaves this class without being copied.
 */
public final class HashValue implements Comparable<HashValue> {

    /** Digest length in bytes. */
    public static final int LENGTH = 32;

    /** The {@code prev_hash} of a genesis record. */
    public static final HashValue ZERO = new HashValue(new byte[LENGTH]);

    private static final String ALGORITHM = "SHA-256";
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private HashValue(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps a copy of the given digest bytes.
     *
     * @throws IllegalArgumentException if the array is not exactly {@link #LENGTH} bytes
     */
    public static HashValue of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be " + LENGTH + " bytes, got " +
                    (bytes == null ? "null" : bytes.length));
        }
        return new HashValue(bytes.clone());
    }

    /** Reads {@link #LENGTH} bytes from the buffer's current position. */
    public static HashValue read(ByteBuffer buf) {
        byte[] b = new byte[LENGTH];
        buf.get(b);
        return new HashValue(b);
    }

    /** SHA-256 of the given bytes. */
    public static HashValue sha256(byte[] data) {
        return new HashValue(newDigest().digest(data));
    }

    /** SHA-256 of {@code left || right}; the Merkle internal node rule. */
    public static HashValue combine(HashValue left, HashValue right) {
        MessageDigest digest = newDigest();
        digest.update(left.bytes);
        digest.update(right.bytes);
        return new HashValue(digest.digest());
    }

    /** Parses a 64-character lowercase or uppercase hex string. */
    public static HashValue fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Expected " + (LENGTH * 2) + " hex chars: " + hex);
        }
        return new HashValue(HEX.parseHex(hex));
    }

    static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    /** Returns a copy of the digest bytes. */
    public byte[] toBytes() {
        return bytes.clone();
    }

    /** Writes the digest bytes at the buffer's current position. */
    public void writeTo(ByteBuffer buf) {
        buf.put(bytes);
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    public String toHex() {
        return HEX.formatHex(bytes);
    }

    /** First 12 hex characters, for log lines. */
    public String shortHex() {
        return toHex().substring(0, 12);
    }

    @Override
    public int compareTo(HashValue other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof HashValue other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
