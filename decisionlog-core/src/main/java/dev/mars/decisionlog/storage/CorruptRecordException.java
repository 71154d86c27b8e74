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

/**
 * A stored record exists but cannot be read back intact
 * (checksum mismatch, damaged frame or undecodable bytes).
 */
public class CorruptRecordException extends StorageException {

    private final long sequence;

    public CorruptRecordException(long sequence, String message) {
        super("Corrupt record at sequence " + sequence + ": " + message);
        this.sequence = sequence;
    }

    public CorruptRecordException(long sequence, String message, Throwable cause) {
        super("Corrupt record at sequence " + sequence + ": " + message, cause);
        this.sequence = sequence;
    }

    /** Local sequence of the first unreadable record. */
    public long sequence() {
        return sequence;
    }
}
